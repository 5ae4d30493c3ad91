package com.interactiveemotes.domain.model;

/**
 * Common shape of immediate and combo rules, so both lists share one matcher.
 */
public interface Rule {

    /** Null means the rule always matches. */
    Condition getCondition();

    ReactionAction getAction();

    /** Non-null when the rule's action could not be parsed. Such a rule never matches. */
    String getDefinitionError();
}
