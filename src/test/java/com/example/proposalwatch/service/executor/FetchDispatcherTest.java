package com.example.proposalwatch.service.executor;

import com.example.proposalwatch.config.AsyncConfig;
import com.example.proposalwatch.config.ProposalWatchProperties;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.provider.inmemory.InMemoryLockProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FetchDispatcher Tests")
class FetchDispatcherTest {

    private final Clock clock = Clock.systemUTC();
    private InMemoryLockProvider lockProvider;
    private FetchDispatcher dispatcher;
    private AtomicInteger runs;

    @BeforeEach
    void setUp() {
        lockProvider = new InMemoryLockProvider();
        dispatcher = new FetchDispatcher(new SyncTaskExecutor(), lockProvider, new ProposalWatchProperties(), clock);
        runs = new AtomicInteger();
    }

    @Test
    @DisplayName("Should run dispatched work under its job lock")
    void shouldRunWork() {
        assertThat(dispatcher.dispatch("fetch_default", runs::incrementAndGet)).isTrue();
        assertThat(runs).hasValue(1);
    }

    @Test
    @DisplayName("Should drop a firing while the same job is still running")
    void shouldSkipLockedJob() {
        // Given
        var held = lockProvider.lock(new LockConfiguration(Instant.now(), "fetch_abc",
                Duration.ofMinutes(5), Duration.ZERO));
        assertThat(held).isPresent();

        // When
        dispatcher.dispatch("fetch_abc", runs::incrementAndGet);
        dispatcher.dispatch("fetch_other", runs::incrementAndGet);

        // Then
        assertThat(runs).hasValue(1);
        held.get().unlock();
        dispatcher.dispatch("fetch_abc", runs::incrementAndGet);
        assertThat(runs).hasValue(2);
    }

    @Test
    @DisplayName("Should release the lock when the work throws")
    void shouldReleaseLockOnFailure() {
        dispatcher.dispatch("fetch_abc", () -> {
            throw new IllegalStateException("boom");
        });
        dispatcher.dispatch("fetch_abc", runs::incrementAndGet);

        assertThat(runs).hasValue(1);
    }

    @Test
    @DisplayName("Should refuse work after stop")
    void shouldRefuseAfterStop() {
        dispatcher.stop();

        assertThat(dispatcher.dispatch("fetch_default", runs::incrementAndGet)).isFalse();
        assertThat(dispatcher.isStopped()).isTrue();
        assertThat(runs).hasValue(0);
    }

    @Test
    @DisplayName("Should report work the pool rejects")
    void shouldReportRejection() {
        TaskExecutor saturated = task -> {
            throw new TaskRejectedException("pool exhausted");
        };
        var rejecting = new FetchDispatcher(saturated, lockProvider, new ProposalWatchProperties(), clock);

        assertThat(rejecting.dispatch("fetch_default", runs::incrementAndGet)).isFalse();
    }

    @Test
    @DisplayName("Should report work refused by the configured fetch pool")
    void shouldReportRejectionFromFetchPool() {
        // Given
        var properties = new ProposalWatchProperties();
        var pool = new AsyncConfig().fetchExecutor(properties);
        pool.initialize();
        pool.shutdown();
        var pooled = new FetchDispatcher(pool, lockProvider, properties, clock);

        // When / Then
        assertThat(pooled.dispatch("fetch_default", runs::incrementAndGet)).isFalse();
        assertThat(runs).hasValue(0);
    }
}
