package com.interactiveemotes.port;

import com.interactiveemotes.domain.model.RuleBook;
import com.interactiveemotes.domain.model.SignalRules;

/**
 * Supplies the immediate and combo rule lists for each signal.
 *
 * <p>Reloading swaps the rule lists only. Streak state and busy flags held by the engine
 * are not touched.
 */
public interface RuleStore {

    SignalRules rulesFor(String signalId);

    RuleBook current();

    RuleBook reload();

    RuleBook reset();
}
