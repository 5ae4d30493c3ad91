package com.interactiveemotes.domain.model;

import com.interactiveemotes.domain.enums.ReactionKind;
import lombok.Builder;
import lombok.Value;

/** What a finished reaction actually showed, and whether it paid a reward. */
@Value
@Builder
public class ReactionOutcome {

    ReactionKind kind;
    String initiatorId;
    String targetId;
    /** The emote or {@code anim_} value performed, or null. */
    String signal;
    /** All text fragments shown, space-joined, or empty. */
    String text;
    int rewardAmount;

    public boolean isRewarded() {
        return rewardAmount > 0;
    }
}
