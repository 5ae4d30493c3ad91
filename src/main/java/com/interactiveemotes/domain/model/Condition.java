package com.interactiveemotes.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Optional predicate fields of a rule, implicitly AND-ed. A null field imposes no constraint.
 *
 * <p>A condition parsed from malformed data carries a {@code definitionError} and
 * never matches.
 */
@Value
@Builder(toBuilder = true)
public class Condition {

    String name;
    Boolean isSpouse;
    Boolean isDateable;
    Boolean isBaby;

    /** Inclusive lower bound on the relationship score. */
    Integer friendshipAtLeast;
    /** Exclusive upper bound on the relationship score. */
    Integer friendshipBelow;

    @Builder.Default
    OneOrMany<String> actorTypes = OneOrMany.none();

    String petType;
    String season;
    String weather;

    String definitionError;

    public static Condition malformed(String reason) {
        return Condition.builder().definitionError(reason).build();
    }

    public boolean isMalformed() {
        return definitionError != null;
    }

    /** True if any field that only makes sense for full actors is set. */
    public boolean hasActorOnlyFields() {
        return name != null
                || isSpouse != null
                || isDateable != null
                || friendshipAtLeast != null
                || friendshipBelow != null;
    }
}
