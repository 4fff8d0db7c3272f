package com.example.proposalwatch.service.executor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ExecutionGuard Tests")
class ExecutionGuardTest {

    private final ExecutionGuard guard = new ExecutionGuard();

    @Test
    @DisplayName("Should run work when the guard is free")
    void shouldRunWhenFree() {
        assertThat(guard.tryRun(() -> "done")).contains("done");
        assertThat(guard.isBusy()).isFalse();
    }

    @Test
    @DisplayName("Should skip a second caller while the first one runs")
    void shouldSkipConcurrentCaller() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var executor = Executors.newSingleThreadExecutor();
        try {
            var first = executor.submit(() -> guard.tryRun(() -> {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "first";
            }));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(guard.isBusy()).isTrue();
            assertThat(guard.tryRun(() -> "second")).isEmpty();

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS)).contains("first");
            assertThat(guard.isBusy()).isFalse();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should release the guard when the work throws")
    void shouldReleaseOnException() {
        assertThatThrownBy(() -> guard.tryRun(() -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(guard.isBusy()).isFalse();
        assertThat(guard.tryRun(() -> 1)).contains(1);
    }
}
