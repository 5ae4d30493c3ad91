package com.interactiveemotes.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * What a target does when a rule fires: an emote (or {@code anim_} animation) and/or a text key.
 * Either field may be empty.
 */
@Value
@Builder
public class ReactionAction {

    public static final ReactionAction NONE = ReactionAction.builder().build();

    @Builder.Default
    OneOrMany<String> primaryChoices = OneOrMany.none();

    @Builder.Default
    OneOrMany<String> textChoices = OneOrMany.none();

    public static ReactionAction signal(String signalId) {
        return ReactionAction.builder().primaryChoices(OneOrMany.one(signalId)).build();
    }

    public boolean isEmpty() {
        return primaryChoices.isEmpty() && textChoices.isEmpty();
    }
}
