package com.interactiveemotes.action;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Resumes the sequence on the reaction executor after the pause, using
 * {@link CompletableFuture#delayedExecutor}.
 */
@Component
public class DelayedPauseScheduler implements PauseScheduler {

    private final Executor reactionExecutor;

    public DelayedPauseScheduler(@Qualifier("reactionExecutor") Executor reactionExecutor) {
        this.reactionExecutor = reactionExecutor;
    }

    @Override
    public CompletableFuture<Void> pause(long millis) {
        if (millis <= 0) {
            return CompletableFuture.runAsync(() -> {}, reactionExecutor);
        }
        Executor delayed = CompletableFuture.delayedExecutor(millis, TimeUnit.MILLISECONDS, reactionExecutor);
        return CompletableFuture.runAsync(() -> {}, delayed);
    }
}
