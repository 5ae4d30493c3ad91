package com.interactiveemotes.combo;

import com.interactiveemotes.domain.model.ComboKey;
import com.interactiveemotes.domain.model.ComboState;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.springframework.stereotype.Component;

/**
 * Process-wide table of combo streaks keyed by (initiator, target).
 *
 * <p>Entries are created lazily and never removed; the table is bounded by the number of
 * distinct pairs that ever interacted. All mutation goes through {@link #update}, which runs
 * atomically per key. Rule reloads do not touch this table.
 */
@Component
public class ComboStateStore {

    private final Map<ComboKey, ComboState> states = new ConcurrentHashMap<>();

    /**
     * Atomically applies {@code updater} to the state for {@code key} (null on first use)
     * and returns a copy of the result.
     */
    public ComboState update(ComboKey key, UnaryOperator<ComboState> updater) {
        ComboState updated = states.compute(key, (k, existing) -> updater.apply(existing));
        return updated.copy();
    }

    public Optional<ComboState> find(ComboKey key) {
        return Optional.ofNullable(states.get(key)).map(ComboState::copy);
    }

    public int size() {
        return states.size();
    }
}
