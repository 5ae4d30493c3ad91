package com.interactiveemotes.engine;

import com.interactiveemotes.combo.ComboStateMachine;
import com.interactiveemotes.condition.RuleMatcher;
import com.interactiveemotes.domain.model.ComboKey;
import com.interactiveemotes.domain.model.ComboRule;
import com.interactiveemotes.domain.model.ComboState;
import com.interactiveemotes.domain.model.FactSnapshot;
import com.interactiveemotes.domain.model.InitiatorProfile;
import com.interactiveemotes.domain.model.InspectionReport;
import com.interactiveemotes.domain.model.ReactionRule;
import com.interactiveemotes.domain.model.SignalRules;
import com.interactiveemotes.exception.ResourceNotFoundException;
import com.interactiveemotes.port.FactProvider;
import com.interactiveemotes.port.RuleStore;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Dry run of the reaction decision for one target. Nothing is performed and no streak
 * advances.
 */
@Service
public class ReactionInspector {

    private final RuleStore ruleStore;
    private final FactProvider factProvider;
    private final RuleMatcher ruleMatcher;
    private final ComboStateMachine comboStateMachine;

    public ReactionInspector(
            RuleStore ruleStore,
            FactProvider factProvider,
            RuleMatcher ruleMatcher,
            ComboStateMachine comboStateMachine) {
        this.ruleStore = ruleStore;
        this.factProvider = factProvider;
        this.ruleMatcher = ruleMatcher;
        this.comboStateMachine = comboStateMachine;
    }

    /**
     * @throws ResourceNotFoundException if the target is unknown or out of range
     */
    public InspectionReport inspect(InitiatorProfile initiator, String signalId, String targetId) {
        FactSnapshot target = factProvider
                .snapshot(initiator, targetId)
                .orElseThrow(() -> new ResourceNotFoundException("Target in range", targetId));

        SignalRules rules = ruleStore.rulesFor(signalId);
        Optional<ReactionRule> immediate = ruleMatcher.findFirstMatch(rules.immediateRules(), target);
        Optional<ComboRule> combo = ruleMatcher.findFirstMatch(rules.comboRules(), target);

        int currentStreak = comboStateMachine
                .stateFor(ComboKey.of(initiator, target))
                .filter(state -> signalId.equals(state.getLastSignal()))
                .map(ComboState::getStreakCount)
                .orElse(0);

        return InspectionReport.builder()
                .signalId(signalId)
                .targetId(target.getTargetId())
                .targetName(target.getTargetName())
                .actorType(target.getActorType())
                .petType(target.getPetType())
                .relationshipScore(target.getRelationshipScore())
                .spouse(target.isSpouse())
                .dateable(target.isDateable())
                .signalHasRules(!rules.isEmpty())
                .immediateMatch(immediate.isPresent())
                .immediateAction(immediate.map(ReactionRule::getAction).orElse(null))
                .comboAvailable(combo.isPresent())
                .comboTriggerCount(combo.map(comboStateMachine::effectiveThreshold).orElse(null))
                .comboAction(combo.map(ComboRule::getAction).orElse(null))
                .currentStreak(currentStreak)
                .build();
    }
}
