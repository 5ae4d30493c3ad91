package com.interactiveemotes.event;

import com.interactiveemotes.domain.model.ReactionOutcome;
import com.interactiveemotes.domain.model.RuleBook;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods around Spring's {@link ApplicationEventPublisher} for the
 * reaction engine's events.
 *
 * <p>Delivery is synchronous unless the listener is {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishReactionPerformed(Object source, ReactionOutcome outcome) {
        applicationEventPublisher.publishEvent(new ReactionPerformedEvent(source, outcome));
    }

    public void publishDayStarted(Object source) {
        applicationEventPublisher.publishEvent(new DayStartedEvent(source));
    }

    public void publishRulesReloaded(Object source, RuleBook ruleBook) {
        applicationEventPublisher.publishEvent(new RulesReloadedEvent(source, ruleBook));
    }
}
