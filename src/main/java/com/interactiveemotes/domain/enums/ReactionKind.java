package com.interactiveemotes.domain.enums;

/** Which rule list produced a reaction. */
public enum ReactionKind {
    IMMEDIATE,
    COMBO
}
