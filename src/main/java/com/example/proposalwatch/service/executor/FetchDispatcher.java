package com.example.proposalwatch.service.executor;

import com.example.proposalwatch.config.ProposalWatchProperties;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Hands fetch work to the worker pool so the caller (tick loop, retry timer) never blocks on it.
 * <p>
 * Each dispatch holds a lock named after its job key while it runs; a dispatch whose job is
 * still running is dropped.
 */
@Slf4j
@Component
public class FetchDispatcher {

    private final TaskExecutor fetchExecutor;
    private final LockProvider lockProvider;
    private final Duration lockAtMostFor;
    private final Clock clock;

    private volatile boolean stopped;

    public FetchDispatcher(@Qualifier("fetchExecutor") TaskExecutor fetchExecutor,
                           LockProvider lockProvider,
                           ProposalWatchProperties properties,
                           Clock clock) {
        this.fetchExecutor = fetchExecutor;
        this.lockProvider = lockProvider;
        this.lockAtMostFor = Duration.ofMinutes(properties.getJobLockAtMostMinutes());
        this.clock = clock;
    }

    /**
     * @return false if the work was not accepted
     */
    public boolean dispatch(String jobKey, Runnable work) {
        if (stopped) {
            log.debug("Dispatcher stopped, not dispatching {}", jobKey);
            return false;
        }

        try {
            fetchExecutor.execute(() -> runLocked(jobKey, work));
            return true;
        } catch (TaskRejectedException e) {
            log.warn("Dispatch of {} rejected: {}", jobKey, e.getMessage());
            return false;
        }
    }

    /**
     * Stop accepting new work. Work already running is left alone.
     */
    public void stop() {
        stopped = true;
    }

    public boolean isStopped() {
        return stopped;
    }

    void runLocked(String jobKey, Runnable work) {
        var lockConfiguration = new LockConfiguration(clock.instant(), jobKey, lockAtMostFor, Duration.ZERO);
        var lock = lockProvider.lock(lockConfiguration);
        if (lock.isEmpty()) {
            log.info("Job {} is still running, skipping this firing", jobKey);
            return;
        }

        try {
            work.run();
        } catch (Exception e) {
            log.error("Job {} failed unexpectedly: {}", jobKey, e.getMessage(), e);
        } finally {
            lock.get().unlock();
        }
    }
}
