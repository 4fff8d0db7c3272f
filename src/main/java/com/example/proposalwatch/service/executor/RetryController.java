package com.example.proposalwatch.service.executor;

import com.example.proposalwatch.config.MetricsConfig;
import com.example.proposalwatch.domain.model.RunWindowConfig;
import com.example.proposalwatch.service.alert.SlackAlertService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Schedules delayed retries after failed runs.
 * <p>
 * Per instance at most one retry is pending. The n-th consecutive failure schedules a retry
 * after {@code retry_delay_minutes * 2^(n-1)} minutes while n does not exceed
 * {@code retry_max_attempts}; beyond that the instance is flagged as a standing failure until a
 * run succeeds or the next scheduled trigger fires.
 */
@Slf4j
@Component
public class RetryController {

    private final TaskScheduler retryTaskScheduler;
    private final ScheduleRuntimeRegistry runtimeRegistry;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public RetryController(@Qualifier("retryTaskScheduler") TaskScheduler retryTaskScheduler,
                           ScheduleRuntimeRegistry runtimeRegistry,
                           SlackAlertService slackAlertService,
                           MetricsConfig metricsConfig,
                           Clock clock) {
        this.retryTaskScheduler = retryTaskScheduler;
        this.runtimeRegistry = runtimeRegistry;
        this.slackAlertService = slackAlertService;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Successful run: drop any pending retry and clear the standing failure
     */
    public void onSuccess(ScheduleRuntime runtime) {
        if (runtime.cancelPendingRetry()) {
            log.debug("Cancelled pending retry of {} after successful run", runtime.getKey());
        }
        clearStandingFailure(runtime);
    }

    /**
     * Failed run.
     *
     * @param failedAttempts consecutive failures including this one
     * @param retry          invoked when the retry fires
     */
    public void onFailure(ScheduleRuntime runtime, RunWindowConfig config, int failedAttempts,
                          FetchRunResult result, Runnable retry) {
        if (!config.isRetryOnFailure() || failedAttempts > config.getRetryMaxAttempts()) {
            runtime.cancelPendingRetry();
            enterStandingFailure(runtime, failedAttempts, result);
            return;
        }

        var delay = backoff(config, failedAttempts);
        var fireAt = clock.instant().plus(delay);
        Runnable task = () -> {
            runtime.retryFired();
            log.info("Retry #{} of {} firing", failedAttempts, runtime.getKey());
            retry.run();
        };

        runtime.replacePendingRetry(retryTaskScheduler.schedule(task, fireAt), fireAt);
        metricsConfig.recordRetry(runtime.getKey(), failedAttempts);
        log.info("Run of {} failed (attempt {}/{}), retrying in {} min at {}",
                runtime.getKey(), failedAttempts, config.getRetryMaxAttempts(), delay.toMinutes(), fireAt);
    }

    /**
     * The next regularly scheduled trigger fired, so the instance leaves standing failure
     */
    public void clearStandingFailure(ScheduleRuntime runtime) {
        if (runtime.setStandingFailure(false)) {
            log.info("Scheduler {} left standing failure", runtime.getKey());
            metricsConfig.setStandingFailures(runtimeRegistry.standingFailureCount());
        }
    }

    public void cancel(ScheduleRuntime runtime) {
        if (runtime.cancelPendingRetry()) {
            log.info("Cancelled pending retry of {}", runtime.getKey());
        }
    }

    /**
     * Cancel every pending retry. Used on shutdown.
     */
    public void cancelAll() {
        var cancelled = runtimeRegistry.all().stream()
                .filter(ScheduleRuntime::cancelPendingRetry)
                .count();
        if (cancelled > 0) {
            log.info("Cancelled {} pending retries", cancelled);
        }
    }

    public static Duration backoff(RunWindowConfig config, int failedAttempts) {
        var exponent = Math.max(0, Math.min(failedAttempts - 1, 20));
        return Duration.ofMinutes(config.getRetryDelayMinutes() * (1L << exponent));
    }

    private void enterStandingFailure(ScheduleRuntime runtime, int failedAttempts, FetchRunResult result) {
        if (!runtime.setStandingFailure(true)) {
            log.warn("Scheduler {} still failing after {} attempts", runtime.getKey(), failedAttempts);
            return;
        }

        log.error("Scheduler {} failed {} consecutive times, retries exhausted. Last error: {}",
                runtime.getKey(), failedAttempts, result.getErrorMessage());
        metricsConfig.recordStandingFailure(runtime.getKey());
        metricsConfig.setStandingFailures(runtimeRegistry.standingFailureCount());
        slackAlertService.sendStandingFailureAlert(runtime.getKey(), failedAttempts, result.getErrorMessage(),
                clock.instant());
    }
}
