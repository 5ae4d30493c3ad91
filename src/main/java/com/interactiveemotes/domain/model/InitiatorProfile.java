package com.interactiveemotes.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * The actor who performed the signal. Supplies the values for dynamic text tokens.
 */
@Value
@Builder(toBuilder = true)
public class InitiatorProfile {

    String id;
    String name;
    /** Farm or organization name, substituted for {@code %farm}. */
    String teamName;
    String favoriteThing;
    /** Name of the initiator's companion, or null if they have none. */
    String companionName;

    @Builder.Default
    boolean male = true;

    /** Local initiators see reward notifications. */
    @Builder.Default
    boolean local = true;

    public boolean hasCompanion() {
        return companionName != null && !companionName.isEmpty();
    }
}
