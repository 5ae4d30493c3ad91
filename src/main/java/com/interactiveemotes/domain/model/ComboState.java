package com.interactiveemotes.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Streak progress of one initiator towards one target.
 *
 * <p>Instances live in the {@code ComboStateStore} and are only mutated inside its
 * atomic compute calls; callers receive copies.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ComboState {

    private String lastSignal;
    private int streakCount;
    /** The effective threshold the streak was last compared against (0 before any comparison). */
    private int resetThreshold;
    private long lastTimestamp;

    public ComboState copy() {
        return new ComboState(lastSignal, streakCount, resetThreshold, lastTimestamp);
    }
}
