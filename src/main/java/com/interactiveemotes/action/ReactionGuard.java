package com.interactiveemotes.action;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Busy flags per target. A target holds at most one running reaction; a second attempt
 * while busy is dropped, not queued.
 */
@Component
public class ReactionGuard {

    private final Set<String> busyTargets = ConcurrentHashMap.newKeySet();

    /** Marks the target busy. Returns false if it already was. */
    public boolean tryAcquire(String targetId) {
        return busyTargets.add(targetId);
    }

    public void release(String targetId) {
        busyTargets.remove(targetId);
    }

    public boolean isBusy(String targetId) {
        return busyTargets.contains(targetId);
    }
}
