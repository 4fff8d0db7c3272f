package com.example.proposalwatch.service;

import com.example.proposalwatch.config.NotificationProperties;
import com.example.proposalwatch.config.ProposalWatchProperties;
import com.example.proposalwatch.domain.enums.RunTrigger;
import com.example.proposalwatch.domain.model.RunWindowConfig;
import com.example.proposalwatch.domain.model.Schedule;
import com.example.proposalwatch.domain.repository.LastCheckRepository;
import com.example.proposalwatch.domain.repository.ScheduleRepository;
import com.example.proposalwatch.dto.RunPreview;
import com.example.proposalwatch.dto.ScheduleChangeResult;
import com.example.proposalwatch.dto.ScheduleStatus;
import com.example.proposalwatch.dto.WatcherStatus;
import com.example.proposalwatch.exception.ScheduleNotFoundException;
import com.example.proposalwatch.service.executor.ExecutionGuard;
import com.example.proposalwatch.service.executor.FetchDispatcher;
import com.example.proposalwatch.service.executor.FetchOrchestrator;
import com.example.proposalwatch.service.executor.FetchRunResult;
import com.example.proposalwatch.service.executor.ScheduleRuntime;
import com.example.proposalwatch.service.executor.ScheduleRuntimeRegistry;
import com.example.proposalwatch.service.job.JobBindingResult;
import com.example.proposalwatch.service.job.JobHandle;
import com.example.proposalwatch.service.job.JobRegistry;
import com.example.proposalwatch.service.trigger.TriggerCompiler;
import com.example.proposalwatch.service.trigger.TriggerDefinition;
import com.example.proposalwatch.service.trigger.TriggerProjector;
import com.example.proposalwatch.service.window.RunWindowConfigFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for managing schedules and inspecting the watcher.
 * <p>
 * Provides:
 * - Schedule creation, editing, enabling and deletion, each re-binding the schedule's jobs
 * - Manual checks
 * - Status and upcoming-run previews
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleManagementService {

    static final int MAX_PREVIEW_ENTRIES = 20;

    private static final DateTimeFormatter LOCAL_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final ScheduleRepository scheduleRepository;
    private final LastCheckRepository lastCheckRepository;
    private final JobRegistry jobRegistry;
    private final TriggerCompiler triggerCompiler;
    private final TriggerProjector triggerProjector;
    private final RunWindowConfigFactory windowConfigFactory;
    private final FetchOrchestrator orchestrator;
    private final FetchDispatcher dispatcher;
    private final ExecutionGuard executionGuard;
    private final ScheduleRuntimeRegistry runtimeRegistry;
    private final ProposalWatchProperties properties;
    private final NotificationProperties notificationProperties;
    private final Clock clock;

    // === Schedule changes ===

    /**
     * Store a new schedule under a fresh id and bind its jobs
     */
    public ScheduleChangeResult createSchedule(Schedule draft) {
        var schedule = draft.copy();
        schedule.setId(UUID.randomUUID().toString());
        schedule.setCreatedAt(clock.instant());
        schedule.setLastRun(null);

        var saved = scheduleRepository.save(schedule);
        log.info("Created schedule {} ({})", saved.getId(), saved.getName());
        return toResult(saved, jobRegistry.upsert(saved));
    }

    /**
     * Replace a schedule's editable fields. Id, creation time and last run are kept.
     */
    public ScheduleChangeResult updateSchedule(String scheduleId, Schedule changes) {
        var existing = scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));

        var schedule = changes.copy();
        schedule.setId(existing.getId());
        schedule.setCreatedAt(existing.getCreatedAt());
        schedule.setLastRun(existing.getLastRun());

        var saved = scheduleRepository.save(schedule);
        log.info("Updated schedule {} ({})", saved.getId(), saved.getName());
        return toResult(saved, jobRegistry.upsert(saved));
    }

    public ScheduleChangeResult setEnabled(String scheduleId, boolean enabled) {
        var schedule = scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));

        schedule.setEnabled(enabled);
        var saved = scheduleRepository.save(schedule);
        log.info("Schedule {} {}", scheduleId, enabled ? "enabled" : "disabled");
        return toResult(saved, jobRegistry.upsert(saved));
    }

    public void deleteSchedule(String scheduleId) {
        if (!scheduleRepository.deleteById(scheduleId)) {
            throw new ScheduleNotFoundException(scheduleId);
        }
        jobRegistry.delete(scheduleId);
        log.info("Deleted schedule {}", scheduleId);
    }

    /**
     * Re-bind every job from the store, e.g. after the store file was edited directly
     */
    public List<JobBindingResult> reloadSchedules() {
        return jobRegistry.refreshAll();
    }

    // === Queries ===

    public List<Schedule> listSchedules() {
        return scheduleRepository.findAll();
    }

    public Optional<Schedule> getSchedule(String scheduleId) {
        return scheduleRepository.findById(scheduleId);
    }

    // === Manual runs ===

    /**
     * Run a check now on the calling thread, ignoring window and budget.
     *
     * @param scheduleId schedule to check for, or null for the default protocols
     */
    public FetchRunResult checkNow(String scheduleId) {
        if (scheduleId != null && (ScheduleRuntimeRegistry.isReservedId(scheduleId)
                || scheduleRepository.findById(scheduleId).isEmpty())) {
            throw new ScheduleNotFoundException(scheduleId);
        }
        log.info("Manual check requested for {}", ScheduleRuntimeRegistry.keyOf(scheduleId));
        return orchestrator.run(scheduleId, RunTrigger.MANUAL);
    }

    // === Status ===

    public WatcherStatus getStatus() {
        var statuses = new ArrayList<ScheduleStatus>();

        var defaults = properties.getDefaultSchedule();
        statuses.add(buildStatus(ScheduleRuntimeRegistry.DEFAULT_KEY, "Default schedule", defaults.isEnabled(), null));
        for (var schedule : scheduleRepository.findAll()) {
            if (schedule.getId() != null) {
                statuses.add(buildStatus(schedule.getId(), schedule.getName(), schedule.isEnabled(), schedule.getId()));
            }
        }

        return WatcherStatus.builder()
                .running(!dispatcher.isStopped())
                .fetchInProgress(executionGuard.isBusy())
                .protocols(List.copyOf(properties.getProtocols()))
                .dataDir(properties.getDataDir())
                .schedulesFile(properties.getStore().getSchedulesFile())
                .notificationsEnabled(notificationProperties.isEnabled())
                .lastCheck(lastCheckRepository.find().orElse(null))
                .jobCount(jobRegistry.jobCount())
                .standingFailures(runtimeRegistry.standingFailureCount())
                .schedules(statuses)
                .generatedAt(clock.instant())
                .build();
    }

    /**
     * Upcoming admissible runs, at most {@value #MAX_PREVIEW_ENTRIES}
     *
     * @param scheduleId schedule to preview, or null for the default schedule
     */
    public List<RunPreview> previewRuns(String scheduleId, int count) {
        var limit = Math.max(0, Math.min(count, MAX_PREVIEW_ENTRIES));

        List<TriggerDefinition> triggers;
        RunWindowConfig config;
        if (scheduleId == null) {
            triggers = triggerCompiler.compileDefault(properties.getDefaultSchedule()).getTriggers();
            config = windowConfigFactory.forDefault();
        } else {
            var schedule = scheduleRepository.findById(scheduleId)
                    .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
            triggers = triggerCompiler.compile(schedule).getTriggers();
            config = windowConfigFactory.forSchedule(schedule);
        }

        return triggerProjector.nextRunTimes(config, triggers, clock.instant(), limit).stream()
                .map(time -> RunPreview.builder()
                        .instant(time.toInstant())
                        .localTime(LOCAL_TIME.format(time))
                        .dayOfWeek(time.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH))
                        .build())
                .toList();
    }

    private ScheduleStatus buildStatus(String key, String name, boolean enabled, String scheduleId) {
        var handles = jobRegistry.handlesOf(scheduleId);
        var nextRun = handles.stream()
                .map(JobHandle::getNextFireTime)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder())
                .orElse(null);

        var status = ScheduleStatus.builder()
                .key(key)
                .name(name)
                .enabled(enabled)
                .jobKeys(handles.stream().map(JobHandle::getJobKey).toList())
                .nextRunTime(nextRun);

        runtimeRegistry.find(scheduleId).ifPresent(runtime -> applyRuntime(status, runtime));
        return status.build();
    }

    private static void applyRuntime(ScheduleStatus.ScheduleStatusBuilder status, ScheduleRuntime runtime) {
        var budget = runtime.getBudget().snapshot();
        status.runsToday(budget.getRunsToday())
                .lastRunDate(budget.getLastRunDate())
                .failedAttempts(budget.getFailedAttempts())
                .standingFailure(runtime.isStandingFailure())
                .pendingRetryAt(runtime.getPendingRetryAt());

        var last = runtime.getLastResult();
        if (last != null) {
            status.lastStatus(last.getStatus().getCode())
                    .lastStartedAt(last.getStartedAt())
                    .lastError(last.getErrorMessage());
        }
    }

    private static ScheduleChangeResult toResult(Schedule schedule, JobBindingResult binding) {
        return ScheduleChangeResult.builder()
                .schedule(schedule)
                .jobKeys(new ArrayList<>(binding.getJobKeys()))
                .configErrors(binding.getErrors().stream().map(Throwable::getMessage).toList())
                .build();
    }
}
