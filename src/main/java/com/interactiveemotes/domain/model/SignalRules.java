package com.interactiveemotes.domain.model;

import java.util.List;

/**
 * Both rule lists authored for one signal. Order inside each list is significant.
 */
public record SignalRules(List<ReactionRule> immediateRules, List<ComboRule> comboRules) {

    public static final SignalRules EMPTY = new SignalRules(List.of(), List.of());

    public SignalRules {
        immediateRules = immediateRules == null ? List.of() : List.copyOf(immediateRules);
        comboRules = comboRules == null ? List.of() : List.copyOf(comboRules);
    }

    public boolean isEmpty() {
        return immediateRules.isEmpty() && comboRules.isEmpty();
    }
}
