package com.interactiveemotes.world;

import com.interactiveemotes.domain.model.InitiatorProfile;

/** An initiator together with the tile it stands on. */
public record InitiatorPlacement(InitiatorProfile profile, double x, double y) {

    public double distanceTo(ActorProfile actor) {
        return Math.hypot(actor.getX() - x, actor.getY() - y);
    }
}
