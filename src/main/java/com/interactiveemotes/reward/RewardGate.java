package com.interactiveemotes.reward;

import com.interactiveemotes.condition.ReactionEngineConfig;
import com.interactiveemotes.domain.model.FactSnapshot;
import com.interactiveemotes.domain.model.InitiatorProfile;
import com.interactiveemotes.event.DayStartedEvent;
import com.interactiveemotes.port.NotificationPort;
import com.interactiveemotes.port.RelationshipPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Grants the relationship reward for a reaction at most once per (initiator, target) per day.
 *
 * <p>No reward is granted when the amount is not positive, the target is not a full actor, or
 * the initiator has no relationship record with the target. Companion (pet) targets are exempt
 * from the record requirement.
 *
 * <p>The ledger entry is written before the relationship port is called, so a port failure
 * still uses up the day's reward for that pair.
 */
@Service
public class RewardGate {

    private static final Logger log = LoggerFactory.getLogger(RewardGate.class);

    private final ReactionEngineConfig reactionEngineConfig;
    private final RewardLedger rewardLedger;
    private final RelationshipPort relationshipPort;
    private final NotificationPort notificationPort;

    public RewardGate(
            ReactionEngineConfig reactionEngineConfig,
            RewardLedger rewardLedger,
            RelationshipPort relationshipPort,
            NotificationPort notificationPort) {
        this.reactionEngineConfig = reactionEngineConfig;
        this.rewardLedger = rewardLedger;
        this.relationshipPort = relationshipPort;
        this.notificationPort = notificationPort;
    }

    public boolean tryGrant(InitiatorProfile initiator, FactSnapshot target, int amount) {
        if (amount <= 0 || !target.isActor()) {
            return false;
        }

        String initiatorId = initiator.getId();
        String targetId = target.getTargetId();

        if (!target.isCompanion() && !relationshipPort.hasRelationship(initiatorId, targetId)) {
            log.debug("No relationship between {} and {}, no reward", initiatorId, targetId);
            return false;
        }

        if (!rewardLedger.record(initiatorId, targetId)) {
            log.debug("{} already rewarded for {} today", initiatorId, targetId);
            return false;
        }

        relationshipPort.grant(initiatorId, targetId, amount);

        if (reactionEngineConfig.isShowRewardMessage() && initiator.isLocal()) {
            notificationPort.notify(initiatorId, "+" + amount + " " + displayNameOf(target));
        }
        return true;
    }

    @EventListener
    public void onDayStarted(DayStartedEvent event) {
        int cleared = rewardLedger.size();
        rewardLedger.clear();
        log.info("New day started at {}, cleared {} reward ledger entries", event.getStartedAt(), cleared);
    }

    private String displayNameOf(FactSnapshot target) {
        return target.getDisplayName() != null ? target.getDisplayName() : target.getTargetName();
    }
}
