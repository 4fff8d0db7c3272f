package com.example.proposalwatch.service.executor;

import com.example.proposalwatch.service.window.RunBudgetState;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * In-memory state of one scheduler instance: a user schedule or the default schedule.
 */
public class ScheduleRuntime {

    @Getter
    private final String key;

    @Getter
    private final RunBudgetState budget = new RunBudgetState();

    private ScheduledFuture<?> pendingRetry;
    private Instant pendingRetryAt;

    private volatile boolean standingFailure;

    @Getter
    private volatile FetchRunResult lastResult;

    public ScheduleRuntime(String key) {
        this.key = key;
    }

    public synchronized void replacePendingRetry(ScheduledFuture<?> retry, Instant fireAt) {
        cancelPendingRetry();
        this.pendingRetry = retry;
        this.pendingRetryAt = fireAt;
    }

    /**
     * @return true if a retry was pending
     */
    public synchronized boolean cancelPendingRetry() {
        if (pendingRetry == null) {
            return false;
        }
        pendingRetry.cancel(false);
        pendingRetry = null;
        pendingRetryAt = null;
        return true;
    }

    /**
     * Forget the pending retry once it has started firing
     */
    synchronized void retryFired() {
        pendingRetry = null;
        pendingRetryAt = null;
    }

    public synchronized Instant getPendingRetryAt() {
        return pendingRetryAt;
    }

    public boolean isStandingFailure() {
        return standingFailure;
    }

    /**
     * @return true if the flag changed
     */
    synchronized boolean setStandingFailure(boolean value) {
        var changed = standingFailure != value;
        standingFailure = value;
        return changed;
    }

    void setLastResult(FetchRunResult lastResult) {
        this.lastResult = lastResult;
    }
}
