package com.interactiveemotes.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.interactiveemotes.action.ActionExecutor;
import com.interactiveemotes.action.ChoiceResolver;
import com.interactiveemotes.action.ReactionGuard;
import com.interactiveemotes.action.TextTokenParser;
import com.interactiveemotes.combo.ComboStateMachine;
import com.interactiveemotes.combo.ComboStateStore;
import com.interactiveemotes.condition.ConditionEvaluator;
import com.interactiveemotes.condition.ReactionEngineConfig;
import com.interactiveemotes.condition.RuleMatcher;
import com.interactiveemotes.domain.enums.ActorType;
import com.interactiveemotes.domain.model.InitiatorProfile;
import com.interactiveemotes.engine.ReactionEngine;
import com.interactiveemotes.event.DayStartedEvent;
import com.interactiveemotes.event.EventPublisherHelper;
import com.interactiveemotes.event.ReactionPerformedEvent;
import com.interactiveemotes.observability.ReactionMetricsService;
import com.interactiveemotes.port.AnimationPort;
import com.interactiveemotes.port.Localization;
import com.interactiveemotes.port.NotificationPort;
import com.interactiveemotes.port.SignalPort;
import com.interactiveemotes.port.SoundPort;
import com.interactiveemotes.port.TextPort;
import com.interactiveemotes.reward.RewardGate;
import com.interactiveemotes.reward.RewardLedger;
import com.interactiveemotes.rules.JsonRuleStore;
import com.interactiveemotes.rules.RuleDefinitionParser;
import com.interactiveemotes.world.ActorProfile;
import com.interactiveemotes.world.WorldConditions;
import com.interactiveemotes.world.WorldStateRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.io.DefaultResourceLoader;

/**
 * End-to-end reaction flow with real engine components: rules loaded from the bundled JSON
 * files, the in-memory world registry as fact provider and relationship store, and
 * application events routed to the reward gate and metrics by hand.
 *
 * <p>Only the presentation ports are mocked. Pauses complete immediately unless a test holds them.
 */
@ExtendWith(MockitoExtension.class)
class ReactionFlowIntegrationTest {

    private static final Map<String, String> MESSAGES = Map.of(
            "reaction.heart.close", "You always brighten my day, @!",
            "reaction.heart.spouse.1", "Love you too, dear.",
            "reaction.heart.spouse.2", "Love you too, dear.",
            "reaction.wave.hello", "Hi there!|Nice day, isn't it?",
            "combo.wave.dateable", "Okay, okay... hi!");

    @Mock
    private SignalPort signalPort;

    @Mock
    private AnimationPort animationPort;

    @Mock
    private TextPort textPort;

    @Mock
    private SoundPort soundPort;

    @Mock
    private NotificationPort notificationPort;

    private MutableClock clock;
    private CompletableFuture<Void> heldPause;
    private ReactionEngineConfig reactionEngineConfig;
    private WorldStateRegistry world;
    private RewardLedger rewardLedger;
    private SimpleMeterRegistry meterRegistry;
    private ReactionMetricsService reactionMetricsService;
    private ReactionEngine reactionEngine;

    private final InitiatorProfile farmer =
            InitiatorProfile.builder().id("farmer-1").name("Alex").teamName("Sunny Acres").build();

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        reactionEngineConfig = new ReactionEngineConfig();
        world = new WorldStateRegistry(reactionEngineConfig);
        rewardLedger = new RewardLedger();
        meterRegistry = new SimpleMeterRegistry();

        Localization localization = key -> MESSAGES.getOrDefault(key, key);
        RewardGate rewardGate = new RewardGate(reactionEngineConfig, rewardLedger, world, notificationPort);

        ApplicationEventPublisher publisher = event -> {
            if (event instanceof DayStartedEvent dayStarted) {
                rewardGate.onDayStarted(dayStarted);
            } else if (event instanceof ReactionPerformedEvent performed) {
                reactionMetricsService.onReactionPerformed(performed);
            }
        };
        EventPublisherHelper eventPublisherHelper = new EventPublisherHelper(publisher);

        JsonRuleStore ruleStore = new JsonRuleStore(
                reactionEngineConfig,
                new DefaultResourceLoader(),
                new ObjectMapper(),
                new RuleDefinitionParser(),
                eventPublisherHelper);
        ruleStore.reload();
        reactionMetricsService = new ReactionMetricsService(meterRegistry, ruleStore);

        RuleMatcher ruleMatcher = new RuleMatcher(new ConditionEvaluator(reactionEngineConfig));
        ActionExecutor actionExecutor = new ActionExecutor(
                reactionEngineConfig,
                new ChoiceResolver(new Random(11)),
                new TextTokenParser(),
                new ReactionGuard(),
                millis -> heldPause != null ? heldPause : CompletableFuture.completedFuture(null),
                signalPort,
                animationPort,
                textPort,
                soundPort,
                localization,
                rewardGate,
                eventPublisherHelper);

        reactionEngine = new ReactionEngine(
                reactionEngineConfig,
                ruleStore,
                world,
                new ComboStateMachine(reactionEngineConfig, new ComboStateStore(), ruleMatcher),
                ruleMatcher,
                actionExecutor,
                eventPublisherHelper,
                clock);

        world.placeInitiator(farmer, 10, 10);
        world.putActor(ActorProfile.builder()
                .id("npc-abigail")
                .name("Abigail")
                .actorType(ActorType.VILLAGER)
                .dateable(true)
                .x(11)
                .y(10)
                .build());
        world.putActor(ActorProfile.builder()
                .id("npc-far")
                .name("Linus")
                .actorType(ActorType.VILLAGER)
                .x(40)
                .y(40)
                .build());
        world.setRelationship("farmer-1", "npc-abigail", 2200);
    }

    private void signal(String signalId) {
        reactionEngine
                .processSignal(farmer, signalId, world.targetsNear("farmer-1"))
                .join();
    }

    @Test
    @DisplayName("Heart to a close friend earns heart-back, text and the daily reward once per day")
    void heartRewardOncePerDay() {
        signal("heart");

        verify(signalPort).perform("npc-abigail", "heart-back");
        verify(textPort).show("npc-abigail", "You always brighten my day, Alex!");
        verify(soundPort).play("pickUpItem");
        verify(notificationPort).notify("farmer-1", "+10 Abigail");
        assertThat(world.get("farmer-1", "npc-abigail")).isEqualTo(2210);

        signal("heart");
        assertThat(world.get("farmer-1", "npc-abigail")).isEqualTo(2210);
        verify(soundPort, times(1)).play(anyString());

        reactionEngine.startDay();
        signal("heart");
        assertThat(world.get("farmer-1", "npc-abigail")).isEqualTo(2220);
        assertThat(rewardLedger.contains("farmer-1", "npc-abigail")).isTrue();
    }

    @Test
    @DisplayName("Three quick waves to a dateable villager end in a blush and reset the streak")
    void waveComboBlush() {
        signal("wave");
        clock.advance(500);
        signal("wave");
        clock.advance(500);
        signal("wave");

        InOrder inOrder = Mockito.inOrder(signalPort);
        inOrder.verify(signalPort, times(2)).perform("npc-abigail", "wave");
        inOrder.verify(signalPort).perform("npc-abigail", "blush");
        verify(textPort).show("npc-abigail", "Okay, okay... hi!");

        assertThat(meterRegistry.get("reactions.performed").tag("kind", "immediate").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("reactions.performed").tag("kind", "combo").counter().count())
                .isEqualTo(1.0);

        // streak was reset, so the next wave is an ordinary greeting again
        clock.advance(500);
        signal("wave");
        verify(signalPort, times(3)).perform("npc-abigail", "wave");
    }

    @Test
    @DisplayName("Slow waves never build a combo")
    void slowWavesTimeOut() {
        for (int i = 0; i < 4; i++) {
            signal("wave");
            clock.advance(reactionEngineConfig.getComboTimeoutMs() + 1);
        }

        verify(signalPort, times(4)).perform("npc-abigail", "wave");
        verify(signalPort, never()).perform("npc-abigail", "blush");
    }

    @Test
    @DisplayName("Weather changes which greeting a villager answers with")
    void rainyGreeting() {
        world.updateConditions(new WorldConditions("summer", "rainy"));

        signal("wave");

        verify(textPort).show("npc-abigail", "reaction.wave.rain");
        verify(textPort, never()).show("npc-abigail", "Hi there!");
    }

    @Test
    @DisplayName("A target still reacting stays busy across a rule reload")
    void busyTargetSurvivesReload() {
        heldPause = new CompletableFuture<>();
        CompletableFuture<Void> first =
                reactionEngine.processSignal(farmer, "heart", world.targetsNear("farmer-1"));

        reactionEngine.reloadRules();
        CompletableFuture<Void> second =
                reactionEngine.processSignal(farmer, "heart", world.targetsNear("farmer-1"));

        assertThat(second).isDone();
        assertThat(first).isNotDone();
        verify(signalPort, never()).perform(anyString(), anyString());

        heldPause.complete(null);
        first.join();

        verify(signalPort, times(1)).perform("npc-abigail", "heart-back");
    }

    @Test
    @DisplayName("Actors out of range do not react")
    void outOfRangeIgnored() {
        reactionEngine.processSignal(farmer, "heart", List.of("npc-far")).join();

        verify(signalPort, never()).perform(anyString(), anyString());
        assertThat(world.get("farmer-1", "npc-far")).isZero();
    }

    /** Clock whose instant only moves when told to. */
    private static final class MutableClock extends Clock {

        private Instant now = Instant.parse("2024-03-01T06:00:00Z");

        void advance(long millis) {
            now = now.plusMillis(millis);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
