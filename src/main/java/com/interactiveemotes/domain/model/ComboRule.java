package com.interactiveemotes.domain.model;

import lombok.Builder;
import lombok.Value;

/** A rule that fires once the same signal has been repeated enough times. */
@Value
@Builder
public class ComboRule implements Rule {

    Condition condition;

    /** Streak length required in PER_COMBO mode. Null falls back to the global target. */
    Integer triggerCount;

    @Builder.Default
    ReactionAction action = ReactionAction.NONE;

    String definitionError;
}
