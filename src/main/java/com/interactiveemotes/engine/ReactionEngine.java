package com.interactiveemotes.engine;

import com.interactiveemotes.action.ActionExecutor;
import com.interactiveemotes.action.ReactionRequest;
import com.interactiveemotes.combo.ComboOutcome;
import com.interactiveemotes.combo.ComboStateMachine;
import com.interactiveemotes.condition.ReactionEngineConfig;
import com.interactiveemotes.condition.RuleMatcher;
import com.interactiveemotes.domain.enums.ReactionKind;
import com.interactiveemotes.domain.model.FactSnapshot;
import com.interactiveemotes.domain.model.InitiatorProfile;
import com.interactiveemotes.domain.model.ReactionRule;
import com.interactiveemotes.domain.model.RuleBook;
import com.interactiveemotes.domain.model.SignalRules;
import com.interactiveemotes.event.EventPublisherHelper;
import com.interactiveemotes.port.FactProvider;
import com.interactiveemotes.port.RuleStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for a performed emote: decides which nearby targets react and starts their
 * reaction sequences.
 *
 * <p>For each nearby target the combo path runs first. A triggered combo replaces the
 * immediate reaction for that target; otherwise the first matching immediate rule runs.
 * Targets are handled independently, so one failing target never affects another.
 *
 * <p>Rule reloads only swap the rule lists. Streaks and busy flags survive a reload.
 */
@Service
public class ReactionEngine {

    private static final Logger log = LoggerFactory.getLogger(ReactionEngine.class);

    private final ReactionEngineConfig reactionEngineConfig;
    private final RuleStore ruleStore;
    private final FactProvider factProvider;
    private final ComboStateMachine comboStateMachine;
    private final RuleMatcher ruleMatcher;
    private final ActionExecutor actionExecutor;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public ReactionEngine(
            ReactionEngineConfig reactionEngineConfig,
            RuleStore ruleStore,
            FactProvider factProvider,
            ComboStateMachine comboStateMachine,
            RuleMatcher ruleMatcher,
            ActionExecutor actionExecutor,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.reactionEngineConfig = reactionEngineConfig;
        this.ruleStore = ruleStore;
        this.factProvider = factProvider;
        this.comboStateMachine = comboStateMachine;
        this.ruleMatcher = ruleMatcher;
        this.actionExecutor = actionExecutor;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    /**
     * Processes one emote performed by {@code initiator}. Never throws.
     *
     * @return a future completing once every reaction started by this signal has finished
     */
    public CompletableFuture<Void> processSignal(
            InitiatorProfile initiator, String signalId, List<String> nearbyTargetIds) {
        if (!reactionEngineConfig.isEnabled() || initiator == null || signalId == null) {
            return CompletableFuture.completedFuture(null);
        }

        SignalRules rules = ruleStore.rulesFor(signalId);
        if (rules.isEmpty()) {
            log.debug("No reaction rules for emote '{}'", signalId);
            return CompletableFuture.completedFuture(null);
        }
        if (nearbyTargetIds == null || nearbyTargetIds.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        long timestamp = clock.millis();
        List<CompletableFuture<Void>> started = new ArrayList<>();
        for (String targetId : new LinkedHashSet<>(nearbyTargetIds)) {
            if (targetId == null || targetId.equals(initiator.getId())) {
                continue;
            }
            try {
                reactFor(initiator, signalId, targetId, rules, timestamp).ifPresent(started::add);
            } catch (RuntimeException e) {
                log.warn("Skipping target {} for emote '{}': {}", targetId, signalId, e.getMessage(), e);
            }
        }

        if (started.isEmpty()) {
            log.debug("Nobody reacted to '{}' from {}", signalId, initiator.getId());
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.allOf(started.toArray(new CompletableFuture[0]));
    }

    private Optional<CompletableFuture<Void>> reactFor(
            InitiatorProfile initiator, String signalId, String targetId, SignalRules rules, long timestamp) {
        Optional<FactSnapshot> snapshot = snapshotOf(initiator, targetId);
        if (snapshot.isEmpty()) {
            return Optional.empty();
        }
        FactSnapshot target = snapshot.get();

        ComboOutcome combo = comboStateMachine.onSignal(initiator, target, signalId, rules.comboRules(), timestamp);
        if (combo.isTriggered()) {
            ReactionRequest request =
                    new ReactionRequest(initiator, target, combo.rule().getAction(), ReactionKind.COMBO);
            return Optional.of(actionExecutor.execute(request));
        }

        Optional<ReactionRule> match = ruleMatcher.findFirstMatch(rules.immediateRules(), target);
        if (match.isEmpty()) {
            return Optional.empty();
        }
        ReactionRequest request =
                new ReactionRequest(initiator, target, match.get().getAction(), ReactionKind.IMMEDIATE);
        return Optional.of(actionExecutor.execute(request));
    }

    private Optional<FactSnapshot> snapshotOf(InitiatorProfile initiator, String targetId) {
        try {
            return factProvider.snapshot(initiator, targetId);
        } catch (RuntimeException e) {
            log.warn("Could not read facts for target {}: {}", targetId, e.getMessage());
            return Optional.empty();
        }
    }

    /** Starts a new in-game day: the daily reward ledger is cleared by its listener. */
    public void startDay() {
        eventPublisherHelper.publishDayStarted(this);
    }

    public RuleBook reloadRules() {
        return ruleStore.reload();
    }

    public RuleBook resetRules() {
        return ruleStore.reset();
    }
}
