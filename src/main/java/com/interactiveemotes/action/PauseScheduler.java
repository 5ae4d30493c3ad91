package com.interactiveemotes.action;

import java.util.concurrent.CompletableFuture;

/**
 * Timed suspension points of a reaction sequence. The returned future completes once the
 * pause has elapsed; no thread is blocked while waiting.
 */
public interface PauseScheduler {

    CompletableFuture<Void> pause(long millis);
}
