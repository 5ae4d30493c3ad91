package com.interactiveemotes.domain.model;

import com.interactiveemotes.domain.enums.ActorType;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only bundle of world and actor facts used to evaluate rule conditions
 * for a single (initiator, target) pair.
 *
 * <p>Produced by a {@code FactProvider}. Distance filtering has already happened
 * by the time a snapshot reaches the engine; {@code distanceTiles} is kept for logging.
 */
@Value
@Builder(toBuilder = true)
public class FactSnapshot {

    String targetId;
    /** Internal name rules match against with {@code Name}. */
    String targetName;
    String displayName;

    /** Full actor (can speak, has relationships). False for generic animals. */
    boolean actor;

    @Builder.Default
    ActorType actorType = ActorType.OTHER;

    @Builder.Default
    String petType = "NotAPet";

    boolean spouse;
    boolean dateable;

    int relationshipScore;

    /** The target's own partner, used by the %spouse token. Null if none. */
    String partnerName;

    String season;
    String weather;

    double distanceTiles;

    public boolean isCompanion() {
        return actorType == ActorType.PET;
    }
}
