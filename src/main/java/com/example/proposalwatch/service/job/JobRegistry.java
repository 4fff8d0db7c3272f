package com.example.proposalwatch.service.job;

import com.example.proposalwatch.config.MetricsConfig;
import com.example.proposalwatch.config.ProposalWatchProperties;
import com.example.proposalwatch.domain.model.Schedule;
import com.example.proposalwatch.domain.repository.ScheduleRepository;
import com.example.proposalwatch.exception.ScheduleConfigException;
import com.example.proposalwatch.service.executor.RetryController;
import com.example.proposalwatch.service.executor.ScheduleRuntimeRegistry;
import com.example.proposalwatch.service.trigger.TriggerCompilation;
import com.example.proposalwatch.service.trigger.TriggerCompiler;
import com.example.proposalwatch.service.window.RunWindowConfigFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the live jobs of every schedule, keyed by schedule id.
 * <p>
 * Binding always replaces the whole job set of a schedule, so binding the same schedule twice
 * leaves exactly the jobs of the second call.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobRegistry {

    private final ScheduleRepository scheduleRepository;
    private final TriggerCompiler triggerCompiler;
    private final RunWindowConfigFactory windowConfigFactory;
    private final RetryController retryController;
    private final ScheduleRuntimeRegistry runtimeRegistry;
    private final ProposalWatchProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final Map<String, List<JobHandle>> handles = new LinkedHashMap<>();

    /**
     * Replace the jobs of a schedule. Disabled schedules end up with none.
     */
    public synchronized JobBindingResult upsert(Schedule schedule) {
        var scheduleId = schedule.getId();
        if (ScheduleRuntimeRegistry.isReservedId(scheduleId)) {
            log.error("Schedule id '{}' is reserved for the default schedule, not binding it", scheduleId);
            var error = new ScheduleConfigException(scheduleId, "id", scheduleId, "reserved for the default schedule");
            return new JobBindingResult(scheduleId, List.of(), List.of(error));
        }

        var removed = handles.remove(scheduleId);
        if (removed != null) {
            log.debug("Removed {} job(s) of schedule {}", removed.size(), scheduleId);
        }

        if (!schedule.isEnabled()) {
            runtimeRegistry.find(scheduleId).ifPresent(retryController::cancel);
            log.info("Schedule {} is disabled, no jobs bound", scheduleId);
            updateGauge();
            return JobBindingResult.unbound(scheduleId);
        }

        var result = bind(scheduleId, triggerCompiler.compile(schedule), windowConfigFactory.resolveZone(schedule));
        log.info("Bound schedule {} ({}): {}", scheduleId, schedule.getName(), result.getJobKeys());
        return result;
    }

    /**
     * Remove every job of a schedule and cancel its pending retry.
     *
     * @return true if the schedule had jobs
     */
    public synchronized boolean delete(String scheduleId) {
        if (ScheduleRuntimeRegistry.isReservedId(scheduleId)) {
            log.warn("Refusing to unbind reserved schedule id '{}'", scheduleId);
            return false;
        }
        var removed = handles.remove(scheduleId);
        runtimeRegistry.remove(scheduleId).ifPresent(retryController::cancel);
        updateGauge();

        if (removed == null) {
            return false;
        }
        log.info("Unbound {} job(s) of schedule {}", removed.size(), scheduleId);
        return true;
    }

    /**
     * Reconcile with the schedule store: bind every stored schedule and drop jobs of schedules
     * that are gone. The default schedule is left alone.
     */
    public synchronized List<JobBindingResult> refreshAll() {
        var schedules = scheduleRepository.findAll();
        var storedIds = new HashSet<String>();
        var results = new ArrayList<JobBindingResult>();

        for (var schedule : schedules) {
            if (schedule.getId() == null) {
                log.warn("Ignoring stored schedule without id: {}", schedule.getName());
                continue;
            }
            storedIds.add(schedule.getId());
            results.add(upsert(schedule));
        }

        for (var scheduleId : new ArrayList<>(handles.keySet())) {
            if (!ScheduleRuntimeRegistry.DEFAULT_KEY.equals(scheduleId) && !storedIds.contains(scheduleId)) {
                delete(scheduleId);
            }
        }

        log.info("Reconciled {} stored schedule(s), {} job(s) live", schedules.size(), jobCount());
        return results;
    }

    /**
     * Bind the process-wide default schedule under {@code fetch_default}.
     */
    public synchronized JobBindingResult registerDefault() {
        handles.remove(ScheduleRuntimeRegistry.DEFAULT_KEY);

        var defaults = properties.getDefaultSchedule();
        if (!defaults.isEnabled()) {
            log.info("Default schedule is disabled");
            updateGauge();
            return JobBindingResult.unbound(null);
        }

        var result = bind(null, triggerCompiler.compileDefault(defaults), windowConfigFactory.getDefaultZone());
        log.info("Bound default schedule: {}", result.getJobKeys());
        return result;
    }

    /**
     * Handles whose fire time has come, each advanced past {@code now} before being returned.
     */
    public synchronized List<JobHandle> claimDue(Instant now) {
        var due = new ArrayList<JobHandle>();
        for (var scheduleHandles : handles.values()) {
            for (var handle : scheduleHandles) {
                if (handle.isDue(now)) {
                    handle.advance(now);
                    due.add(handle);
                }
            }
        }
        return due;
    }

    public synchronized List<JobHandle> handlesOf(String scheduleId) {
        return List.copyOf(handles.getOrDefault(ScheduleRuntimeRegistry.keyOf(scheduleId), List.of()));
    }

    public synchronized Optional<JobHandle> findJob(String jobKey) {
        return handles.values().stream()
                .flatMap(List::stream)
                .filter(handle -> handle.getJobKey().equals(jobKey))
                .findFirst();
    }

    public synchronized int jobCount() {
        return handles.values().stream().mapToInt(List::size).sum();
    }

    private JobBindingResult bind(String scheduleId, TriggerCompilation compilation, ZoneId zone) {
        var key = ScheduleRuntimeRegistry.keyOf(scheduleId);
        var boundAt = clock.instant();
        var jobs = new ArrayList<JobHandle>();
        for (var trigger : compilation.getTriggers()) {
            jobs.add(new JobHandle(scheduleId, trigger, zone, boundAt));
        }

        if (!jobs.isEmpty()) {
            handles.put(key, jobs);
        }
        updateGauge();

        var jobKeys = jobs.stream().map(JobHandle::getJobKey).toList();
        return new JobBindingResult(scheduleId, jobKeys, compilation.getErrors());
    }

    private void updateGauge() {
        metricsConfig.setRegisteredJobs(jobCount());
    }
}
