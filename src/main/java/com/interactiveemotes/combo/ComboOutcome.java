package com.interactiveemotes.combo;

import com.interactiveemotes.domain.model.ComboRule;

/**
 * Result of feeding one signal into the combo state machine.
 *
 * @param rule the combo rule that fired, or null
 * @param streakCount the streak length after this signal (before any post-trigger reset)
 */
public record ComboOutcome(ComboRule rule, int streakCount) {

    private static final ComboOutcome NOT_TRIGGERED = new ComboOutcome(null, 0);

    public static ComboOutcome notTriggered() {
        return NOT_TRIGGERED;
    }

    public static ComboOutcome notTriggered(int streakCount) {
        return new ComboOutcome(null, streakCount);
    }

    public static ComboOutcome triggered(ComboRule rule, int streakCount) {
        return new ComboOutcome(rule, streakCount);
    }

    public boolean isTriggered() {
        return rule != null;
    }
}
