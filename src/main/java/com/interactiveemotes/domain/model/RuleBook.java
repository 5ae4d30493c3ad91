package com.interactiveemotes.domain.model;

import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of every loaded rule, keyed by signal id.
 * Swapped wholesale on reload.
 */
public final class RuleBook {

    public static final RuleBook EMPTY = new RuleBook(Map.of());

    private final Map<String, SignalRules> rulesBySignal;

    public RuleBook(Map<String, SignalRules> rulesBySignal) {
        this.rulesBySignal = Map.copyOf(rulesBySignal);
    }

    public SignalRules forSignal(String signalId) {
        return rulesBySignal.getOrDefault(signalId, SignalRules.EMPTY);
    }

    public Set<String> signals() {
        return rulesBySignal.keySet();
    }

    public int immediateRuleCount() {
        return rulesBySignal.values().stream().mapToInt(r -> r.immediateRules().size()).sum();
    }

    public int comboRuleCount() {
        return rulesBySignal.values().stream().mapToInt(r -> r.comboRules().size()).sum();
    }
}
