package com.example.proposalwatch.service.window;

import com.example.proposalwatch.config.ProposalWatchProperties;
import com.example.proposalwatch.domain.model.RunWindowConfig;
import com.example.proposalwatch.domain.model.Schedule;
import com.example.proposalwatch.exception.ScheduleConfigException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Builds {@link RunWindowConfig}s for the default schedule and for user schedules.
 * <p>
 * User schedules take weekdays-only, end time, zone and daily maximum from the schedule itself,
 * allow every weekday from midnight, and share the process-wide retry settings.
 */
@Slf4j
@Component
public class RunWindowConfigFactory {

    private static final Set<Integer> ALL_DAYS = Set.of(1, 2, 3, 4, 5, 6, 7);

    private final ProposalWatchProperties.DefaultSchedule defaults;

    @Getter
    private final ZoneId defaultZone;

    private final RunWindowConfig defaultConfig;

    public RunWindowConfigFactory(ProposalWatchProperties properties) {
        this.defaults = properties.getDefaultSchedule();
        this.defaultZone = parseZone("default", defaults.getTimezone());
        this.defaultConfig = RunWindowConfig.builder()
                .zone(defaultZone)
                .weekdaysOnly(defaults.isWeekdaysOnly())
                .enabledDays(new LinkedHashSet<>(defaults.getEnabledDays()))
                .startTime(parseTime("default", "start_time", defaults.getStartTime(), LocalTime.MIDNIGHT))
                .endTime(parseTime("default", "end_time", defaults.getEndTime(), null))
                .maxRunsPerDay(defaults.getMaxRunsPerDay())
                .retryOnFailure(defaults.isRetryOnFailure())
                .retryMaxAttempts(defaults.getRetryMaxAttempts())
                .retryDelayMinutes(defaults.getRetryDelayMinutes())
                .build();
    }

    public RunWindowConfig forDefault() {
        return defaultConfig;
    }

    public RunWindowConfig forSchedule(Schedule schedule) {
        return RunWindowConfig.builder()
                .zone(resolveZone(schedule))
                .weekdaysOnly(schedule.isWeekdaysOnlyEffective())
                .enabledDays(ALL_DAYS)
                .startTime(LocalTime.MIDNIGHT)
                .endTime(parseTime(schedule.getId(), "end_time", schedule.getEndTime(), null))
                .maxRunsPerDay(schedule.getMaxRunsPerDay())
                .retryOnFailure(defaults.isRetryOnFailure())
                .retryMaxAttempts(defaults.getRetryMaxAttempts())
                .retryDelayMinutes(defaults.getRetryDelayMinutes())
                .build();
    }

    /**
     * The schedule's zone, or the default zone when it is unset or unknown
     */
    public ZoneId resolveZone(Schedule schedule) {
        var timezone = schedule.getTimezone();
        if (timezone == null || timezone.isBlank()) {
            return defaultZone;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            var error = new ScheduleConfigException(schedule.getId(), "timezone", timezone, e);
            log.error("{}; using {}", error.getMessage(), defaultZone);
            return defaultZone;
        }
    }

    private static ZoneId parseZone(String owner, String timezone) {
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new ScheduleConfigException(owner, "timezone", timezone, e);
        }
    }

    /**
     * A malformed value is logged and treated as unset
     */
    private static LocalTime parseTime(String owner, String field, String value, LocalTime fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return TimeOfDay.parse(value);
        } catch (DateTimeException e) {
            var error = new ScheduleConfigException(owner, field, value, e);
            log.error("{}; ignoring it", error.getMessage());
            return fallback;
        }
    }
}
