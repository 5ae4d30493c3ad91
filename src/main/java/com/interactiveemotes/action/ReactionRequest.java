package com.interactiveemotes.action;

import com.interactiveemotes.domain.enums.ReactionKind;
import com.interactiveemotes.domain.model.FactSnapshot;
import com.interactiveemotes.domain.model.InitiatorProfile;
import com.interactiveemotes.domain.model.ReactionAction;

/** A matched action, ready to be played out on a target. */
public record ReactionRequest(
        InitiatorProfile initiator, FactSnapshot target, ReactionAction action, ReactionKind kind) {

    public String targetId() {
        return target.getTargetId();
    }
}
