package com.example.proposalwatch.service.executor;

import com.example.proposalwatch.config.MetricsConfig;
import com.example.proposalwatch.config.ProposalWatchProperties;
import com.example.proposalwatch.domain.enums.RunStatus;
import com.example.proposalwatch.domain.enums.RunTrigger;
import com.example.proposalwatch.domain.model.FetchDelta;
import com.example.proposalwatch.domain.model.LastCheckRecord;
import com.example.proposalwatch.domain.model.RunWindowConfig;
import com.example.proposalwatch.domain.model.Schedule;
import com.example.proposalwatch.domain.repository.LastCheckRepository;
import com.example.proposalwatch.domain.repository.ScheduleRepository;
import com.example.proposalwatch.exception.DatasetReadException;
import com.example.proposalwatch.exception.RefreshFailureException;
import com.example.proposalwatch.exception.StoreWriteException;
import com.example.proposalwatch.service.notification.NotificationService;
import com.example.proposalwatch.service.refresh.DatasetRefresher;
import com.example.proposalwatch.service.refresh.ProtocolDatasetReader;
import com.example.proposalwatch.service.trigger.TriggerCompiler;
import com.example.proposalwatch.service.window.RunBudgetTracker;
import com.example.proposalwatch.service.window.RunWindowConfigFactory;
import com.example.proposalwatch.service.window.WindowEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Runs one fetch: re-validates the schedule, refreshes the datasets, detects new proposals,
 * notifies and records the outcome.
 * <p>
 * Flow:
 * 1. Reload the schedule (bound runs only) and re-check window and daily budget
 * 2. Enter the execution guard, or report SKIPPED_BUSY
 * 3. Snapshot proposal numbers, refresh, diff
 * 4. Notify on a non-empty delta and persist the last-check record
 * 5. Feed the outcome to the budget tracker and the retry controller
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FetchOrchestrator {

    private final ScheduleRepository scheduleRepository;
    private final LastCheckRepository lastCheckRepository;
    private final ProtocolDatasetReader datasetReader;
    private final DatasetRefresher datasetRefresher;
    private final NotificationService notificationService;
    private final ExecutionGuard executionGuard;
    private final WindowEvaluator windowEvaluator;
    private final RunBudgetTracker budgetTracker;
    private final RunWindowConfigFactory windowConfigFactory;
    private final RetryController retryController;
    private final ScheduleRuntimeRegistry runtimeRegistry;
    private final FetchDispatcher dispatcher;
    private final ProposalWatchProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * @param scheduleId schedule to run for, or null for the default schedule
     */
    public FetchRunResult run(String scheduleId, RunTrigger trigger) {
        var startedAt = clock.instant();
        var label = ScheduleRuntimeRegistry.keyOf(scheduleId);

        Schedule schedule = null;
        RunWindowConfig config;
        if (scheduleId != null) {
            var found = scheduleRepository.findById(scheduleId);
            if (found.isEmpty() || !found.get().isEnabled()) {
                log.info("Schedule {} no longer exists or is disabled, {} run aborted", scheduleId, trigger.getCode());
                metricsConfig.recordOutcome(trigger, RunStatus.ABORTED);
                return FetchRunResult.skipped(RunStatus.ABORTED, trigger, scheduleId, startedAt);
            }
            schedule = found.get();
            config = windowConfigFactory.forSchedule(schedule);
        } else {
            config = windowConfigFactory.forDefault();
        }

        var runtime = runtimeRegistry.get(scheduleId);

        if (trigger.isWindowChecked()) {
            if (!windowEvaluator.isAdmissible(startedAt, config)) {
                log.info("Run of {} at {} is outside its window, skipped", label, startedAt.atZone(config.getZone()));
                return finishSkipped(runtime, RunStatus.OUTSIDE_WINDOW, trigger, scheduleId, startedAt);
            }
            if (!budgetTracker.checkDailyLimit(runtime.getBudget(), config, startedAt)) {
                log.info("Daily run limit of {} reached for {}, skipped", config.getMaxRunsPerDay(), label);
                return finishSkipped(runtime, RunStatus.BUDGET_EXHAUSTED, trigger, scheduleId, startedAt);
            }
        }

        if (trigger == RunTrigger.SCHEDULED) {
            retryController.clearStandingFailure(runtime);
        }

        var protocols = protocolsFor(schedule);
        var sample = metricsConfig.startRunTimer();
        var outcome = executionGuard.tryRun(() -> fetch(scheduleId, trigger, protocols, startedAt));
        if (outcome.isEmpty()) {
            return finishSkipped(runtime, RunStatus.SKIPPED_BUSY, trigger, scheduleId, startedAt);
        }

        var result = outcome.get();
        result.setDurationMs(Duration.between(startedAt, clock.instant()).toMillis());
        metricsConfig.recordRun(sample, trigger, result.getStatus());
        afterRun(runtime, config, scheduleId, result);
        return result;
    }

    /**
     * Protocols checked for a schedule: its own chains, else the configured list
     */
    List<String> protocolsFor(Schedule schedule) {
        if (schedule != null && schedule.getChains() != null && !schedule.getChains().isEmpty()) {
            return new ArrayList<>(schedule.getChains());
        }
        return new ArrayList<>(properties.getProtocols());
    }

    /**
     * Any unexpected error from the collaborators fails the run so budget and retry still apply.
     */
    private FetchRunResult fetch(String scheduleId, RunTrigger trigger, List<String> protocols, Instant startedAt) {
        try {
            return fetchChanges(scheduleId, trigger, protocols, startedAt);
        } catch (RuntimeException e) {
            log.error("Fetch for {} failed unexpectedly: {}", ScheduleRuntimeRegistry.keyOf(scheduleId), e.getMessage(), e);
            return FetchRunResult.failure(trigger, scheduleId, startedAt, e);
        }
    }

    private FetchRunResult fetchChanges(String scheduleId, RunTrigger trigger, List<String> protocols,
                                        Instant startedAt) {
        log.info("Starting {} fetch for {} over {}", trigger.getCode(), ScheduleRuntimeRegistry.keyOf(scheduleId), protocols);

        var before = snapshot(protocols);

        try {
            datasetRefresher.refresh();
        } catch (RefreshFailureException e) {
            log.error("Fetch for {} failed: {}", ScheduleRuntimeRegistry.keyOf(scheduleId), e.getMessage());
            return FetchRunResult.failure(trigger, scheduleId, startedAt, e);
        }

        var delta = diff(before);

        if (!delta.isEmpty()) {
            delta.asMap().forEach((protocol, records) -> metricsConfig.recordNewProposals(protocol, records.size()));
            log.info("Found {} new proposals: {}", delta.totalCount(), delta);
            try {
                notificationService.notifyNewProposals(delta);
            } catch (Exception e) {
                log.error("Notification dispatch failed: {}", e.getMessage(), e);
            }
        } else {
            log.info("No new proposals");
        }

        try {
            lastCheckRepository.save(LastCheckRecord.of(delta, clock.instant()));
        } catch (StoreWriteException e) {
            log.error("Cannot record last check: {}", e.getMessage(), e);
            var failure = FetchRunResult.failure(trigger, scheduleId, startedAt, e);
            failure.setDelta(delta);
            return failure;
        }

        return FetchRunResult.builder()
                .status(delta.isEmpty() ? RunStatus.NO_CHANGES : RunStatus.COMPLETED)
                .trigger(trigger)
                .scheduleId(scheduleId)
                .delta(delta)
                .startedAt(startedAt)
                .build();
    }

    /**
     * Known proposal numbers per protocol. Unreadable protocols are left out of this run.
     */
    private Map<String, Set<Long>> snapshot(List<String> protocols) {
        var snapshot = new LinkedHashMap<String, Set<Long>>();
        for (var protocol : protocols) {
            try {
                snapshot.put(protocol, datasetReader.readIdentities(protocol));
            } catch (DatasetReadException e) {
                log.warn("Skipping {} for this run: {}", protocol, e.getMessage());
            }
        }
        return snapshot;
    }

    private FetchDelta diff(Map<String, Set<Long>> before) {
        var delta = FetchDelta.builder();
        before.forEach((protocol, known) -> {
            try {
                var added = new TreeSet<>(datasetReader.readIdentities(protocol));
                added.removeAll(known);
                if (!added.isEmpty()) {
                    delta.add(protocol, datasetReader.readRecords(protocol, added));
                }
            } catch (DatasetReadException e) {
                log.warn("Cannot diff {} after refresh: {}", protocol, e.getMessage());
            }
        });
        return delta.build();
    }

    private void afterRun(ScheduleRuntime runtime, RunWindowConfig config, String scheduleId, FetchRunResult result) {
        runtime.setLastResult(result);
        var now = clock.instant();
        var failedAttempts = budgetTracker.recordRun(runtime.getBudget(), config, result.isSuccess(), now);

        if (scheduleId != null) {
            try {
                if (!scheduleRepository.updateLastRun(scheduleId, now)) {
                    log.debug("Schedule {} was deleted during its run", scheduleId);
                }
            } catch (StoreWriteException e) {
                log.error("Cannot record last run of schedule {}: {}", scheduleId, e.getMessage());
            }
        }

        if (result.isSuccess()) {
            log.info("Fetch for {} finished: {} ({} new) in {}ms", runtime.getKey(),
                    result.getStatus().getDisplayName(), result.newProposalsCount(), result.getDurationMs());
            retryController.onSuccess(runtime);
        } else {
            var jobKey = scheduleId == null
                    ? TriggerCompiler.jobKey(TriggerCompiler.DEFAULT_SCHEDULE_ID)
                    : TriggerCompiler.jobKey(scheduleId);
            retryController.onFailure(runtime, config, failedAttempts, result,
                    () -> dispatcher.dispatch(jobKey, () -> run(scheduleId, RunTrigger.RETRY)));
        }
    }

    private FetchRunResult finishSkipped(ScheduleRuntime runtime, RunStatus status, RunTrigger trigger,
                                         String scheduleId, Instant startedAt) {
        var result = FetchRunResult.skipped(status, trigger, scheduleId, startedAt);
        runtime.setLastResult(result);
        metricsConfig.recordOutcome(trigger, status);
        return result;
    }
}
