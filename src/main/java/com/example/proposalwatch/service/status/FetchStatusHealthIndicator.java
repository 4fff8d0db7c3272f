package com.example.proposalwatch.service.status;

import com.example.proposalwatch.domain.repository.LastCheckRepository;
import com.example.proposalwatch.service.executor.ExecutionGuard;
import com.example.proposalwatch.service.executor.FetchDispatcher;
import com.example.proposalwatch.service.executor.ScheduleRuntime;
import com.example.proposalwatch.service.executor.ScheduleRuntimeRegistry;
import com.example.proposalwatch.service.job.JobRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Exposes the watcher state as the {@code fetchStatus} health component.
 * <p>
 * Standing failures are reported as details and keep the component UP: the service is alive
 * and resumes with the next scheduled run.
 */
@Component
@RequiredArgsConstructor
public class FetchStatusHealthIndicator implements HealthIndicator {

    private final ScheduleRuntimeRegistry runtimeRegistry;
    private final JobRegistry jobRegistry;
    private final ExecutionGuard executionGuard;
    private final FetchDispatcher dispatcher;
    private final LastCheckRepository lastCheckRepository;

    @Override
    public Health health() {
        var builder = dispatcher.isStopped() ? Health.outOfService() : Health.up();

        var failing = runtimeRegistry.all().stream()
                .filter(ScheduleRuntime::isStandingFailure)
                .map(ScheduleRuntime::getKey)
                .sorted()
                .toList();

        builder.withDetail("jobs", jobRegistry.jobCount())
                .withDetail("fetchInProgress", executionGuard.isBusy())
                .withDetail("standingFailures", failing);

        lastCheckRepository.find().ifPresent(lastCheck -> builder
                .withDetail("lastCheck", lastCheck.getTimestamp())
                .withDetail("lastNewProposals", lastCheck.getNewProposalsCount()));

        return builder.build();
    }
}
