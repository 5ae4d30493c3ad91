package com.interactiveemotes.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.interactiveemotes.combo.ComboStateMachine;
import com.interactiveemotes.combo.ComboStateStore;
import com.interactiveemotes.condition.ConditionEvaluator;
import com.interactiveemotes.condition.ReactionEngineConfig;
import com.interactiveemotes.condition.RuleMatcher;
import com.interactiveemotes.domain.enums.ActorType;
import com.interactiveemotes.domain.model.ComboKey;
import com.interactiveemotes.domain.model.ComboRule;
import com.interactiveemotes.domain.model.Condition;
import com.interactiveemotes.domain.model.FactSnapshot;
import com.interactiveemotes.domain.model.InitiatorProfile;
import com.interactiveemotes.domain.model.InspectionReport;
import com.interactiveemotes.domain.model.ReactionAction;
import com.interactiveemotes.domain.model.ReactionRule;
import com.interactiveemotes.domain.model.SignalRules;
import com.interactiveemotes.engine.ReactionInspector;
import com.interactiveemotes.exception.ResourceNotFoundException;
import com.interactiveemotes.port.FactProvider;
import com.interactiveemotes.port.RuleStore;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReactionInspectorTest {

    @Mock
    private RuleStore ruleStore;

    @Mock
    private FactProvider factProvider;

    private ComboStateMachine comboStateMachine;
    private ReactionInspector reactionInspector;

    private final InitiatorProfile farmer = InitiatorProfile.builder().id("farmer-1").build();

    private final FactSnapshot maru = FactSnapshot.builder()
            .targetId("npc-maru")
            .targetName("Maru")
            .actor(true)
            .actorType(ActorType.VILLAGER)
            .dateable(true)
            .relationshipScore(800)
            .build();

    private final ComboRule blush = ComboRule.builder()
            .condition(Condition.builder().isDateable(true).build())
            .triggerCount(4)
            .action(ReactionAction.signal("blush"))
            .build();

    @BeforeEach
    void setUp() {
        ReactionEngineConfig config = new ReactionEngineConfig();
        RuleMatcher ruleMatcher = new RuleMatcher(new ConditionEvaluator(config));
        comboStateMachine = new ComboStateMachine(config, new ComboStateStore(), ruleMatcher);
        reactionInspector = new ReactionInspector(ruleStore, factProvider, ruleMatcher, comboStateMachine);
    }

    @Test
    @DisplayName("Reports the matching rules and current streak without advancing it")
    void reportsMatches() {
        ReactionRule wave = ReactionRule.builder().action(ReactionAction.signal("wave")).build();
        when(ruleStore.rulesFor("wave")).thenReturn(new SignalRules(List.of(wave), List.of(blush)));
        when(factProvider.snapshot(farmer, "npc-maru")).thenReturn(Optional.of(maru));
        comboStateMachine.record(new ComboKey("farmer-1", "npc-maru"), "wave", 0);
        comboStateMachine.record(new ComboKey("farmer-1", "npc-maru"), "wave", 100);

        InspectionReport report = reactionInspector.inspect(farmer, "wave", "npc-maru");

        assertThat(report.isSignalHasRules()).isTrue();
        assertThat(report.isImmediateMatch()).isTrue();
        assertThat(report.getImmediateAction()).isSameAs(wave.getAction());
        assertThat(report.isComboAvailable()).isTrue();
        assertThat(report.getComboTriggerCount()).isEqualTo(4);
        assertThat(report.getCurrentStreak()).isEqualTo(2);
        assertThat(report.getRelationshipScore()).isEqualTo(800);
        assertThat(report.getActorType()).isEqualTo(ActorType.VILLAGER);

        reactionInspector.inspect(farmer, "wave", "npc-maru");
        assertThat(comboStateMachine.stateFor(new ComboKey("farmer-1", "npc-maru")))
                .get()
                .extracting(state -> state.getStreakCount())
                .isEqualTo(2);
    }

    @Test
    @DisplayName("Streak of another emote counts as zero")
    void otherEmoteStreakIgnored() {
        when(ruleStore.rulesFor("heart")).thenReturn(SignalRules.EMPTY);
        when(factProvider.snapshot(farmer, "npc-maru")).thenReturn(Optional.of(maru));
        comboStateMachine.record(new ComboKey("farmer-1", "npc-maru"), "wave", 0);

        InspectionReport report = reactionInspector.inspect(farmer, "heart", "npc-maru");

        assertThat(report.isSignalHasRules()).isFalse();
        assertThat(report.isImmediateMatch()).isFalse();
        assertThat(report.getComboTriggerCount()).isNull();
        assertThat(report.getCurrentStreak()).isZero();
    }

    @Test
    @DisplayName("Unknown or out-of-range target is not found")
    void unknownTarget() {
        when(factProvider.snapshot(farmer, "nobody")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> reactionInspector.inspect(farmer, "wave", "nobody"))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
