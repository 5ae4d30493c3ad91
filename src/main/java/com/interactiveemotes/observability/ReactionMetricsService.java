package com.interactiveemotes.observability;

import com.interactiveemotes.domain.enums.ReactionKind;
import com.interactiveemotes.domain.model.ReactionOutcome;
import com.interactiveemotes.event.ReactionPerformedEvent;
import com.interactiveemotes.event.RulesReloadedEvent;
import com.interactiveemotes.port.RuleStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the reaction engine:
 * <ul>
 *   <li><b>reactions.performed</b> (counter, tag {@code kind}): reactions that showed something</li>
 *   <li><b>reactions.rewards.granted</b> (counter): daily rewards handed out</li>
 *   <li><b>reactions.rules.signals</b> (gauge): emotes with at least one loaded rule</li>
 * </ul>
 */
@Service
public class ReactionMetricsService {

    private static final Logger log = LoggerFactory.getLogger(ReactionMetricsService.class);

    private final Map<ReactionKind, Counter> performedCounters = new EnumMap<>(ReactionKind.class);
    private final Counter rewardsGrantedCounter;

    public ReactionMetricsService(MeterRegistry meterRegistry, RuleStore ruleStore) {
        for (ReactionKind kind : ReactionKind.values()) {
            performedCounters.put(
                    kind,
                    Counter.builder("reactions.performed")
                            .description("Reactions that produced an emote or text")
                            .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                            .register(meterRegistry));
        }

        this.rewardsGrantedCounter = Counter.builder("reactions.rewards.granted")
                .description("Daily relationship rewards granted by reactions")
                .register(meterRegistry);

        meterRegistry.gauge("reactions.rules.signals", ruleStore, store -> store.current()
                .signals()
                .size());
    }

    @EventListener
    @Order(20)
    public void onReactionPerformed(ReactionPerformedEvent event) {
        ReactionOutcome outcome = event.getOutcome();
        performedCounters.get(outcome.getKind()).increment();
        if (outcome.isRewarded()) {
            rewardsGrantedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onRulesReloaded(RulesReloadedEvent event) {
        log.debug("Rule book now covers {} emotes", event.getRuleBook().signals().size());
    }
}
