package com.interactiveemotes.domain.model;

import lombok.Builder;
import lombok.Value;

/** A rule for an immediate, first-signal reaction. */
@Value
@Builder
public class ReactionRule implements Rule {

    Condition condition;

    @Builder.Default
    ReactionAction action = ReactionAction.NONE;

    String definitionError;
}
