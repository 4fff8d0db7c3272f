package com.example.proposalwatch.service.trigger;

import com.example.proposalwatch.config.ProposalWatchProperties;
import com.example.proposalwatch.domain.enums.TriggerMode;
import com.example.proposalwatch.domain.model.Schedule;
import com.example.proposalwatch.exception.ScheduleConfigException;
import com.example.proposalwatch.service.window.TimeOfDay;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Turns a schedule's authoritative trigger field into trigger definitions.
 * <p>
 * Job keys are {@code fetch_<id>} for interval and cron schedules and
 * {@code fetch_<id>_<HHMM>} per time for specific-times schedules. Malformed or missing fields
 * are reported as {@link ScheduleConfigException}s in the result and produce no trigger.
 */
@Slf4j
@Component
public class TriggerCompiler {

    public static final String DEFAULT_SCHEDULE_ID = "default";

    private static final String JOB_PREFIX = "fetch_";

    public TriggerCompilation compile(Schedule schedule) {
        var id = schedule.getId();
        var triggers = new ArrayList<TriggerDefinition>();
        var errors = new ArrayList<ScheduleConfigException>();

        if (schedule.getMode() == null) {
            errors.add(new ScheduleConfigException(id, "mode", null, "mode is required"));
        } else {
            switch (schedule.getMode()) {
                case INTERVAL -> compileInterval(schedule, triggers, errors);
                case CRON -> compileCron(schedule, triggers, errors);
                case SPECIFIC_TIMES -> compileTimes(schedule, triggers, errors);
            }
        }

        var compilation = new TriggerCompilation(id, triggers, errors);
        errors.forEach(error -> log.error("Config error: {}", error.getMessage()));
        if (compilation.isEmpty()) {
            log.warn("Schedule {} has no valid triggers, it will not run", id);
        }
        return compilation;
    }

    /**
     * Compile the process-wide default schedule under the id {@value #DEFAULT_SCHEDULE_ID}
     */
    public TriggerCompilation compileDefault(ProposalWatchProperties.DefaultSchedule defaults) {
        TriggerMode mode;
        try {
            mode = TriggerMode.fromCode(defaults.getMode());
        } catch (IllegalArgumentException e) {
            var error = new ScheduleConfigException(DEFAULT_SCHEDULE_ID, "mode", defaults.getMode(), e);
            log.error("Config error: {}", error.getMessage());
            return new TriggerCompilation(DEFAULT_SCHEDULE_ID, List.of(), List.of(error));
        }

        return compile(Schedule.builder()
                .id(DEFAULT_SCHEDULE_ID)
                .name("Default schedule")
                .mode(mode)
                .intervalMinutes(defaults.getIntervalMinutes())
                .cron(defaults.getCronExpression())
                .times(new ArrayList<>(defaults.getSpecificTimes()))
                .timezone(defaults.getTimezone())
                .build());
    }

    public static String jobKey(String scheduleId) {
        return JOB_PREFIX + scheduleId;
    }

    public static String jobKey(String scheduleId, LocalTime time) {
        return JOB_PREFIX + scheduleId + "_" + TimeOfDay.key(time);
    }

    private void compileInterval(Schedule schedule, List<TriggerDefinition> triggers,
                                 List<ScheduleConfigException> errors) {
        var minutes = schedule.getIntervalMinutes();
        if (minutes == null || minutes < 1) {
            errors.add(new ScheduleConfigException(schedule.getId(), "interval_minutes",
                    String.valueOf(minutes), "a positive number of minutes is required"));
            return;
        }
        triggers.add(new IntervalTrigger(jobKey(schedule.getId()), Duration.ofMinutes(minutes)));
    }

    private void compileCron(Schedule schedule, List<TriggerDefinition> triggers,
                             List<ScheduleConfigException> errors) {
        var expression = schedule.getCron();
        if (expression == null || expression.isBlank()) {
            errors.add(new ScheduleConfigException(schedule.getId(), "cron", expression,
                    "a cron expression is required"));
            return;
        }

        var trimmed = expression.trim();
        try {
            triggers.add(new CronTrigger(jobKey(schedule.getId()), trimmed, parseCron(trimmed)));
        } catch (IllegalArgumentException e) {
            errors.add(new ScheduleConfigException(schedule.getId(), "cron", expression, e));
        }
    }

    private void compileTimes(Schedule schedule, List<TriggerDefinition> triggers,
                              List<ScheduleConfigException> errors) {
        var times = schedule.getTimes();
        if (times == null || times.isEmpty()) {
            errors.add(new ScheduleConfigException(schedule.getId(), "times", null,
                    "at least one HH:MM time is required"));
            return;
        }

        var parsed = new TreeSet<LocalTime>();
        for (var value : times) {
            try {
                parsed.add(TimeOfDay.parse(value));
            } catch (DateTimeException e) {
                errors.add(new ScheduleConfigException(schedule.getId(), "times", value, e));
            }
        }
        for (var time : parsed) {
            triggers.add(new DailyTimeTrigger(jobKey(schedule.getId(), time), time));
        }
    }

    /**
     * Five standard fields (minute hour day month weekday) or a macro such as {@code @hourly}
     */
    private static CronExpression parseCron(String expression) {
        if (expression.startsWith("@")) {
            return CronExpression.parse(expression);
        }
        var fields = expression.split("\\s+");
        if (fields.length != 5) {
            throw new IllegalArgumentException("expected 5 fields but found " + fields.length);
        }
        return CronExpression.parse("0 " + expression);
    }
}
