package com.interactiveemotes.event;

import com.interactiveemotes.domain.model.ReactionOutcome;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a reaction sequence emitted at least one signal or text fragment.
 *
 * <p>Consumed by {@code ReactionMetricsService}. Not published for dropped (busy) or empty reactions.
 */
public class ReactionPerformedEvent extends ApplicationEvent {

    private final ReactionOutcome outcome;

    public ReactionPerformedEvent(Object source, ReactionOutcome outcome) {
        super(source);
        this.outcome = outcome;
    }

    public ReactionOutcome getOutcome() {
        return outcome;
    }
}
