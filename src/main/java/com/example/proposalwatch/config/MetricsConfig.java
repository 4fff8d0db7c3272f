package com.example.proposalwatch.config;

import com.example.proposalwatch.domain.enums.RunStatus;
import com.example.proposalwatch.domain.enums.RunTrigger;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics configuration for monitoring fetch runs and schedules.
 * <p>
 * Exposes Prometheus metrics for:
 * - Run outcomes and execution times
 * - Retries and standing failures
 * - Newly detected proposals
 * - Notification channel failures
 * - Registered jobs
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    private final AtomicLong registeredJobs = new AtomicLong(0);
    private final AtomicLong standingFailures = new AtomicLong(0);

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder("proposal_watch_registered_jobs", registeredJobs, AtomicLong::get)
                .description("Number of live job handles")
                .register(meterRegistry);

        Gauge.builder("proposal_watch_standing_failure_instances", standingFailures, AtomicLong::get)
                .description("Scheduler instances whose retries are exhausted")
                .register(meterRegistry);
    }

    public Timer.Sample startRunTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record a finished run and its outcome
     */
    public void recordRun(Timer.Sample sample, RunTrigger trigger, RunStatus status) {
        sample.stop(Timer.builder("proposal_watch_run_time")
                .tag("trigger", trigger.getCode())
                .tag("status", status.getCode())
                .description("Fetch run execution time")
                .register(meterRegistry));
        recordOutcome(trigger, status);
    }

    /**
     * Count a run outcome that never reached the fetch itself (skipped or aborted)
     */
    public void recordOutcome(RunTrigger trigger, RunStatus status) {
        meterRegistry.counter("proposal_watch_runs",
                "trigger", trigger.getCode(),
                "status", status.getCode()
        ).increment();
    }

    public void recordRetry(String instanceKey, int attemptNumber) {
        meterRegistry.counter("proposal_watch_retries",
                "instance", instanceKey,
                "attempt", String.valueOf(attemptNumber)
        ).increment();
    }

    public void recordStandingFailure(String instanceKey) {
        meterRegistry.counter("proposal_watch_standing_failures", "instance", instanceKey).increment();
    }

    public void recordNewProposals(String protocol, int count) {
        meterRegistry.counter("proposal_watch_new_proposals", "protocol", protocol).increment(count);
    }

    public void recordNotificationFailure(String channel) {
        meterRegistry.counter("proposal_watch_notification_failures", "channel", channel).increment();
    }

    public void setRegisteredJobs(long count) {
        registeredJobs.set(count);
    }

    public void setStandingFailures(long count) {
        standingFailures.set(count);
    }
}
