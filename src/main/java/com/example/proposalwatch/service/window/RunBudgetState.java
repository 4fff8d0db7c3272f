package com.example.proposalwatch.service.window;

import lombok.Getter;

import java.time.LocalDate;

/**
 * Per-instance daily run counter and consecutive failure count.
 * Mutated only by {@link RunBudgetTracker}, which synchronizes on the instance.
 */
@Getter
public class RunBudgetState {

    private int runsToday;
    private LocalDate lastRunDate;
    private int failedAttempts;

    void rollOver(LocalDate today) {
        if (!today.equals(lastRunDate)) {
            runsToday = 0;
            failedAttempts = 0;
            lastRunDate = today;
        }
    }

    void recordRun(boolean success) {
        runsToday++;
        failedAttempts = success ? 0 : failedAttempts + 1;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(runsToday, lastRunDate, failedAttempts);
    }

    @Getter
    public static class Snapshot {
        private final int runsToday;
        private final LocalDate lastRunDate;
        private final int failedAttempts;

        Snapshot(int runsToday, LocalDate lastRunDate, int failedAttempts) {
            this.runsToday = runsToday;
            this.lastRunDate = lastRunDate;
            this.failedAttempts = failedAttempts;
        }
    }
}
