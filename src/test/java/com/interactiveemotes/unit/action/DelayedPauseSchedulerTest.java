package com.interactiveemotes.unit.action;

import static org.assertj.core.api.Assertions.assertThat;

import com.interactiveemotes.action.DelayedPauseScheduler;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DelayedPauseSchedulerTest {

    private ExecutorService executor;
    private DelayedPauseScheduler pauseScheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        pauseScheduler = new DelayedPauseScheduler(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Pause completes only after the delay has elapsed")
    void completesAfterDelay() throws Exception {
        long start = System.nanoTime();

        CompletableFuture<Void> pause = pauseScheduler.pause(150);
        assertThat(pause).isNotDone();
        pause.get(2, TimeUnit.SECONDS);

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(150);
    }

    @Test
    @DisplayName("Zero pause still resumes on the executor")
    void zeroPause() throws Exception {
        pauseScheduler.pause(0).get(2, TimeUnit.SECONDS);
    }
}
