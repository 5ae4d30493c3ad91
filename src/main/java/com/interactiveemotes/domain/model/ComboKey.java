package com.interactiveemotes.domain.model;

/** Identifies the streak of one initiator towards one target. */
public record ComboKey(String initiatorId, String targetId) {

    public static ComboKey of(InitiatorProfile initiator, FactSnapshot target) {
        return new ComboKey(initiator.getId(), target.getTargetId());
    }
}
