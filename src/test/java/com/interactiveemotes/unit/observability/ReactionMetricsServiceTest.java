package com.interactiveemotes.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.interactiveemotes.domain.enums.ReactionKind;
import com.interactiveemotes.domain.model.ReactionAction;
import com.interactiveemotes.domain.model.ReactionOutcome;
import com.interactiveemotes.domain.model.ReactionRule;
import com.interactiveemotes.domain.model.RuleBook;
import com.interactiveemotes.domain.model.SignalRules;
import com.interactiveemotes.event.ReactionPerformedEvent;
import com.interactiveemotes.observability.ReactionMetricsService;
import com.interactiveemotes.port.RuleStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReactionMetricsServiceTest {

    @Mock
    private RuleStore ruleStore;

    private SimpleMeterRegistry meterRegistry;
    private ReactionMetricsService reactionMetricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        reactionMetricsService = new ReactionMetricsService(meterRegistry, ruleStore);
    }

    private ReactionPerformedEvent performed(ReactionKind kind, int reward) {
        ReactionOutcome outcome = ReactionOutcome.builder()
                .kind(kind)
                .initiatorId("farmer-1")
                .targetId("npc-abigail")
                .signal("happy")
                .text("")
                .rewardAmount(reward)
                .build();
        return new ReactionPerformedEvent(this, outcome);
    }

    @Test
    @DisplayName("Counts performed reactions per kind and granted rewards")
    void countsReactions() {
        reactionMetricsService.onReactionPerformed(performed(ReactionKind.IMMEDIATE, 10));
        reactionMetricsService.onReactionPerformed(performed(ReactionKind.IMMEDIATE, 0));
        reactionMetricsService.onReactionPerformed(performed(ReactionKind.COMBO, 0));

        assertThat(meterRegistry.get("reactions.performed").tag("kind", "immediate").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("reactions.performed").tag("kind", "combo").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("reactions.rewards.granted").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Rule gauge reads the current rule book")
    void ruleGauge() {
        ReactionRule rule = ReactionRule.builder().action(ReactionAction.signal("happy")).build();
        when(ruleStore.current())
                .thenReturn(new RuleBook(Map.of(
                        "heart", new SignalRules(List.of(rule), List.of()),
                        "wave", new SignalRules(List.of(rule), List.of()))));

        assertThat(meterRegistry.get("reactions.rules.signals").gauge().value()).isEqualTo(2.0);
    }
}
