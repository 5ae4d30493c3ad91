package com.interactiveemotes.combo;

import com.interactiveemotes.condition.ReactionEngineConfig;
import com.interactiveemotes.condition.RuleMatcher;
import com.interactiveemotes.domain.enums.ComboCountMode;
import com.interactiveemotes.domain.model.ComboKey;
import com.interactiveemotes.domain.model.ComboRule;
import com.interactiveemotes.domain.model.ComboState;
import com.interactiveemotes.domain.model.FactSnapshot;
import com.interactiveemotes.domain.model.InitiatorProfile;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tracks repeated-signal streaks per (initiator, target) and decides when a combo fires.
 *
 * <p>Per key the lifecycle is Idle -> Streaking -> Triggered -> Idle:
 * <ul>
 *   <li>first signal creates the streak with count 1</li>
 *   <li>a different signal, or a gap longer than {@code comboTimeoutMs}, restarts it at 1</li>
 *   <li>otherwise the count grows by one</li>
 *   <li>once the count reaches the effective threshold of the first matching combo rule, the
 *       combo fires and the count drops to 0</li>
 * </ul>
 *
 * <p>Timeouts are checked lazily when the next signal arrives; there is no background expiry.
 */
@Component
public class ComboStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ComboStateMachine.class);

    private final ReactionEngineConfig reactionEngineConfig;
    private final ComboStateStore comboStateStore;
    private final RuleMatcher ruleMatcher;

    public ComboStateMachine(
            ReactionEngineConfig reactionEngineConfig, ComboStateStore comboStateStore, RuleMatcher ruleMatcher) {
        this.reactionEngineConfig = reactionEngineConfig;
        this.comboStateStore = comboStateStore;
        this.ruleMatcher = ruleMatcher;
    }

    /**
     * Feeds a signal into the streak for this pair. Returns the rule to run if the combo fired.
     */
    public ComboOutcome onSignal(
            InitiatorProfile initiator,
            FactSnapshot target,
            String signalId,
            List<ComboRule> comboRules,
            long timestamp) {
        if (!reactionEngineConfig.isComboEnabled() || comboRules == null || comboRules.isEmpty()) {
            return ComboOutcome.notTriggered();
        }

        ComboKey key = ComboKey.of(initiator, target);
        Optional<ComboRule> match = ruleMatcher.findFirstMatch(comboRules, target);
        if (match.isEmpty()) {
            return ComboOutcome.notTriggered(record(key, signalId, timestamp).getStreakCount());
        }

        ComboRule rule = match.get();
        int threshold = effectiveThreshold(rule);
        int[] reached = new int[1];
        comboStateStore.update(key, existing -> {
            ComboState current = advance(existing, signalId, timestamp);
            current.setResetThreshold(threshold);
            reached[0] = current.getStreakCount();
            if (reached[0] >= threshold) {
                // the signal that fired the combo does not start the next streak
                current.setStreakCount(0);
            }
            return current;
        });

        if (reached[0] < threshold) {
            log.debug(
                    "Combo streak {} -> {}: '{}' x{} of {}",
                    key.initiatorId(),
                    key.targetId(),
                    signalId,
                    reached[0],
                    threshold);
            return ComboOutcome.notTriggered(reached[0]);
        }

        log.debug(
                "Combo triggered for {} -> {} on '{}' after {}",
                key.initiatorId(),
                key.targetId(),
                signalId,
                threshold);
        return ComboOutcome.triggered(rule, reached[0]);
    }

    /**
     * Advances the streak for {@code key} and returns a copy of the new state.
     */
    public ComboState record(ComboKey key, String signalId, long timestamp) {
        return comboStateStore.update(key, existing -> advance(existing, signalId, timestamp));
    }

    // Runs inside the store's compute, so the read-modify-write is atomic per key.
    private ComboState advance(ComboState existing, String signalId, long timestamp) {
        if (existing == null) {
            return new ComboState(signalId, 1, 0, timestamp);
        }
        boolean sameSignal = signalId.equals(existing.getLastSignal());
        boolean expired = timestamp - existing.getLastTimestamp() > reactionEngineConfig.getComboTimeoutMs();
        if (!sameSignal || expired) {
            existing.setLastSignal(signalId);
            existing.setStreakCount(1);
        } else {
            existing.setStreakCount(existing.getStreakCount() + 1);
        }
        existing.setLastTimestamp(timestamp);
        return existing;
    }

    /**
     * FIXED mode always uses the global target. PER_COMBO uses the rule's trigger count and
     * falls back to the global target when the rule has none.
     */
    public int effectiveThreshold(ComboRule rule) {
        if (reactionEngineConfig.getComboCountMode() == ComboCountMode.FIXED || rule.getTriggerCount() == null) {
            return reactionEngineConfig.getGlobalComboTarget();
        }
        return rule.getTriggerCount();
    }

    public Optional<ComboState> stateFor(ComboKey key) {
        return comboStateStore.find(key);
    }
}
