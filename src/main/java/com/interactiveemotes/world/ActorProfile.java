package com.interactiveemotes.world;

import com.interactiveemotes.domain.enums.ActorType;
import lombok.Builder;
import lombok.Value;

/**
 * Host-registered description of a potential reaction target and where it stands.
 */
@Value
@Builder(toBuilder = true)
public class ActorProfile {

    String id;
    String name;
    String displayName;

    /** False for generic animals that can only show bubbles. */
    @Builder.Default
    boolean actor = true;

    @Builder.Default
    ActorType actorType = ActorType.OTHER;

    @Builder.Default
    String petType = "NotAPet";

    boolean dateable;

    /** Initiator this target is married to, if any. */
    String spouseOf;

    String partnerName;

    double x;
    double y;
}
