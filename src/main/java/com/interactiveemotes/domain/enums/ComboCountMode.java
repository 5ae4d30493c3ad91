package com.interactiveemotes.domain.enums;

/**
 * How the streak length required for a combo is chosen.
 * PER_COMBO uses each rule's TriggerCount, falling back to the global target.
 * FIXED always uses the global target.
 */
public enum ComboCountMode {
    PER_COMBO,
    FIXED
}
