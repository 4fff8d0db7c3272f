package com.example.proposalwatch.service.window;

import com.example.proposalwatch.domain.model.RunWindowConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Daily run budget and failure counting for scheduler instances.
 * <p>
 * Counters reset when the local date in the window's zone differs from the date of the last
 * observation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunBudgetTracker {

    private final WindowEvaluator windowEvaluator;

    /**
     * @return true while today's run count is below the configured maximum
     */
    public boolean checkDailyLimit(RunBudgetState state, RunWindowConfig config, Instant now) {
        synchronized (state) {
            state.rollOver(now.atZone(config.getZone()).toLocalDate());
            var max = config.getMaxRunsPerDay();
            return max == null || state.getRunsToday() < max;
        }
    }

    /**
     * Count one executed run.
     *
     * @return consecutive failed attempts after recording this run
     */
    public int recordRun(RunBudgetState state, RunWindowConfig config, boolean success, Instant now) {
        synchronized (state) {
            state.rollOver(now.atZone(config.getZone()).toLocalDate());
            state.recordRun(success);
            log.debug("Recorded {} run: runsToday={}, failedAttempts={}",
                    success ? "successful" : "failed", state.getRunsToday(), state.getFailedAttempts());
            return state.getFailedAttempts();
        }
    }

    public boolean shouldRunNow(RunBudgetState state, RunWindowConfig config, Instant now) {
        return windowEvaluator.isAdmissible(now, config) && checkDailyLimit(state, config, now);
    }
}
