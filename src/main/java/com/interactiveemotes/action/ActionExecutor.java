package com.interactiveemotes.action;

import com.interactiveemotes.condition.ReactionEngineConfig;
import com.interactiveemotes.domain.model.FactSnapshot;
import com.interactiveemotes.domain.model.ReactionAction;
import com.interactiveemotes.domain.model.ReactionOutcome;
import com.interactiveemotes.event.EventPublisherHelper;
import com.interactiveemotes.port.AnimationPort;
import com.interactiveemotes.port.Localization;
import com.interactiveemotes.port.SignalPort;
import com.interactiveemotes.port.SoundPort;
import com.interactiveemotes.port.TextPort;
import com.interactiveemotes.reward.RewardGate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Plays out a matched {@link ReactionAction} on a target as an asynchronous, timed sequence.
 *
 * <p><b>Sequence:</b>
 * <ol>
 *   <li>pause for {@code emoteDelayMs} plus a random jitter below {@code emoteDelayJitterMs}</li>
 *   <li>pick a primary choice; {@code anim_} values go to the {@link AnimationPort}, anything
 *       else to the {@link SignalPort}</li>
 *   <li>pick a text choice</li>
 *   <li>if both were resolved, pause {@code signalTextPauseMs}</li>
 *   <li>localize the text, split it on {@code textSplitter} and show each fragment with
 *       {@code fragmentPauseMs} between fragments, substituting tokens per fragment</li>
 *   <li>if anything was shown, try the daily reward, play the reply sound when it was granted,
 *       log the outcome and publish a {@code ReactionPerformedEvent}</li>
 * </ol>
 *
 * <p><b>Concurrency:</b> a target runs at most one sequence at a time. The busy flag is taken
 * before the first pause and released when the sequence ends, whatever the outcome; a call for
 * a busy target is dropped. Pauses do not block a thread, see {@link PauseScheduler}.
 *
 * <p><b>Errors:</b> port failures are logged and the sequence carries on with the next step.
 * The returned future never completes exceptionally.
 */
@Service
public class ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);

    private final ReactionEngineConfig reactionEngineConfig;
    private final ChoiceResolver choiceResolver;
    private final TextTokenParser textTokenParser;
    private final ReactionGuard reactionGuard;
    private final PauseScheduler pauseScheduler;
    private final SignalPort signalPort;
    private final AnimationPort animationPort;
    private final TextPort textPort;
    private final SoundPort soundPort;
    private final Localization localization;
    private final RewardGate rewardGate;
    private final EventPublisherHelper eventPublisherHelper;

    public ActionExecutor(
            ReactionEngineConfig reactionEngineConfig,
            ChoiceResolver choiceResolver,
            TextTokenParser textTokenParser,
            ReactionGuard reactionGuard,
            PauseScheduler pauseScheduler,
            SignalPort signalPort,
            AnimationPort animationPort,
            TextPort textPort,
            SoundPort soundPort,
            Localization localization,
            RewardGate rewardGate,
            EventPublisherHelper eventPublisherHelper) {
        this.reactionEngineConfig = reactionEngineConfig;
        this.choiceResolver = choiceResolver;
        this.textTokenParser = textTokenParser;
        this.reactionGuard = reactionGuard;
        this.pauseScheduler = pauseScheduler;
        this.signalPort = signalPort;
        this.animationPort = animationPort;
        this.textPort = textPort;
        this.soundPort = soundPort;
        this.localization = localization;
        this.rewardGate = rewardGate;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * Starts the reaction sequence. Returns a future that completes when the sequence has
     * finished (or immediately, if the target was busy).
     */
    public CompletableFuture<Void> execute(ReactionRequest request) {
        String targetId = request.targetId();
        if (request.action().isEmpty()) {
            log.debug("Nothing to perform on target {} for {} reaction", targetId, request.kind());
            return CompletableFuture.completedFuture(null);
        }
        if (!reactionGuard.tryAcquire(targetId)) {
            log.debug("Target {} is busy, dropping {} reaction", targetId, request.kind());
            return CompletableFuture.completedFuture(null);
        }

        ReactionRun run = new ReactionRun(request);
        CompletableFuture<Void> sequence;
        try {
            sequence = pauseScheduler
                    .pause(initialDelayMs())
                    .thenRun(run::performPrimary)
                    .thenCompose(ignored -> run.pauseBeforeText())
                    .thenCompose(ignored -> run.showText())
                    .thenRun(run::settle);
        } catch (RuntimeException e) {
            sequence = CompletableFuture.failedFuture(e);
        }

        return sequence.<Void>handle((ignored, error) -> {
            reactionGuard.release(targetId);
            if (error != null) {
                log.error("Reaction sequence for target {} failed: {}", targetId, error.getMessage(), error);
            }
            return null;
        });
    }

    private long initialDelayMs() {
        int jitter = choiceResolver.nextJitter(reactionEngineConfig.getEmoteDelayJitterMs());
        return reactionEngineConfig.getEmoteDelayMs() + jitter;
    }

    List<String> splitFragments(String localized) {
        String splitter = reactionEngineConfig.getTextSplitter();
        if (splitter == null || splitter.isEmpty() || !localized.contains(splitter)) {
            return List.of(localized);
        }
        return List.of(localized.split(Pattern.quote(splitter), -1));
    }

    /** Mutable progress of one sequence. Steps run one after another, never concurrently. */
    private final class ReactionRun {

        private final ReactionRequest request;
        private final FactSnapshot target;
        private final List<String> shownFragments = new ArrayList<>();
        private String performedSignal;
        private String textKey;

        ReactionRun(ReactionRequest request) {
            this.request = request;
            this.target = request.target();
        }

        void performPrimary() {
            String choice = choiceResolver
                    .resolveChoice(request.action().getPrimaryChoices())
                    .orElse(null);
            if (choice == null) {
                return;
            }

            String prefix = reactionEngineConfig.getAnimationPrefix();
            try {
                if (prefix != null && !prefix.isEmpty() && choice.startsWith(prefix)) {
                    if (!target.isActor()) {
                        log.debug("Target {} cannot play animation {}", target.getTargetId(), choice);
                        return;
                    }
                    animationPort.performNamed(target.getTargetId(), choice.substring(prefix.length()));
                } else {
                    signalPort.perform(target.getTargetId(), choice);
                }
                performedSignal = choice;
            } catch (RuntimeException e) {
                log.warn("Failed to perform {} on target {}: {}", choice, target.getTargetId(), e.getMessage());
            }
        }

        CompletableFuture<Void> pauseBeforeText() {
            textKey = choiceResolver.resolveChoice(request.action().getTextChoices()).orElse(null);
            if (performedSignal != null && textKey != null) {
                return pauseScheduler.pause(reactionEngineConfig.getSignalTextPauseMs());
            }
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> showText() {
            if (textKey == null) {
                return CompletableFuture.completedFuture(null);
            }
            if (!target.isActor()) {
                log.debug("Target {} cannot show text {}", target.getTargetId(), textKey);
                return CompletableFuture.completedFuture(null);
            }

            String localized;
            try {
                localized = localization.resolve(textKey);
            } catch (RuntimeException e) {
                log.warn(
                        "Could not resolve text key {} for target {}: {}",
                        textKey,
                        target.getTargetId(),
                        e.getMessage());
                return CompletableFuture.completedFuture(null);
            }

            List<String> fragments = splitFragments(localized);
            CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
            for (int i = 0; i < fragments.size(); i++) {
                String fragment = fragments.get(i);
                chain = chain.thenRun(() -> showFragment(fragment));
                if (i < fragments.size() - 1) {
                    long pauseMs = reactionEngineConfig.getFragmentPauseMs();
                    chain = chain.thenCompose(ignored -> pauseScheduler.pause(pauseMs));
                }
            }
            return chain;
        }

        private void showFragment(String fragment) {
            String parsed = textTokenParser.parse(fragment, request.initiator(), target);
            try {
                textPort.show(target.getTargetId(), parsed);
                shownFragments.add(parsed);
            } catch (RuntimeException e) {
                log.warn("Failed to show text on target {}: {}", target.getTargetId(), e.getMessage());
            }
        }

        void settle() {
            if (performedSignal == null && shownFragments.isEmpty()) {
                log.debug("Nothing shown for {} reaction on target {}", request.kind(), target.getTargetId());
                return;
            }

            int rewardAmount = grantReward();
            if (rewardAmount > 0 && reactionEngineConfig.isPlayReplySound()) {
                try {
                    soundPort.play(reactionEngineConfig.getReplySoundId());
                } catch (RuntimeException e) {
                    log.warn("Failed to play reply sound: {}", e.getMessage());
                }
            }

            ReactionOutcome outcome = ReactionOutcome.builder()
                    .kind(request.kind())
                    .initiatorId(request.initiator().getId())
                    .targetId(target.getTargetId())
                    .signal(performedSignal)
                    .text(String.join(" ", shownFragments))
                    .rewardAmount(rewardAmount)
                    .build();

            log.info(
                    "Emote {} reaction -> target={}, signal={}, text=\"{}\", reward={}",
                    outcome.getKind(),
                    outcome.getTargetId(),
                    outcome.getSignal(),
                    outcome.getText(),
                    outcome.getRewardAmount());

            eventPublisherHelper.publishReactionPerformed(ActionExecutor.this, outcome);
        }

        private int grantReward() {
            int amount = reactionEngineConfig.getRewardAmount();
            try {
                return rewardGate.tryGrant(request.initiator(), target, amount) ? amount : 0;
            } catch (RuntimeException e) {
                log.warn(
                        "Reward grant failed for {} -> {}: {}",
                        request.initiator().getId(),
                        target.getTargetId(),
                        e.getMessage());
                return 0;
            }
        }
    }
}
