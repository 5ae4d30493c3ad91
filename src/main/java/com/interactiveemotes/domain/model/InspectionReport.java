package com.interactiveemotes.domain.model;

import com.interactiveemotes.domain.enums.ActorType;
import lombok.Builder;
import lombok.Value;

/**
 * Prediction of how a target would react to a signal, without running anything.
 */
@Value
@Builder
public class InspectionReport {

    String signalId;
    String targetId;
    String targetName;
    ActorType actorType;
    String petType;
    int relationshipScore;
    boolean spouse;
    boolean dateable;

    boolean signalHasRules;

    boolean immediateMatch;
    ReactionAction immediateAction;

    boolean comboAvailable;
    Integer comboTriggerCount;
    ReactionAction comboAction;

    /** Current streak of the initiator towards this target (0 when none). */
    int currentStreak;
}
