package com.interactiveemotes.reward;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Targets each initiator has already been rewarded for today.
 *
 * <p>Monotonic within a day: entries are only added, and the whole ledger is cleared at the
 * day boundary.
 */
@Component
public class RewardLedger {

    private final Map<String, Set<String>> rewardedToday = new ConcurrentHashMap<>();

    /**
     * Records the pair. Returns false if it was already recorded today.
     */
    public boolean record(String initiatorId, String targetId) {
        return rewardedToday
                .computeIfAbsent(initiatorId, k -> ConcurrentHashMap.newKeySet())
                .add(targetId);
    }

    public boolean contains(String initiatorId, String targetId) {
        Set<String> targets = rewardedToday.get(initiatorId);
        return targets != null && targets.contains(targetId);
    }

    public void clear() {
        rewardedToday.clear();
    }

    public int size() {
        return rewardedToday.values().stream().mapToInt(Set::size).sum();
    }
}
