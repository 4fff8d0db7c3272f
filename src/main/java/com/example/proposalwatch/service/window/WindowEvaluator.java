package com.example.proposalwatch.service.window;

import com.example.proposalwatch.domain.model.RunWindowConfig;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Decides whether a moment lies inside a run window. Pure: same inputs, same answer.
 */
@Component
public class WindowEvaluator {

    /**
     * All rules are evaluated in the window's zone:
     * weekdays-only rejects Saturday and Sunday, the ISO weekday must be enabled, and the time of
     * day truncated to the minute must lie within [start, end], where a missing end is unbounded.
     */
    public boolean isAdmissible(Instant now, RunWindowConfig config) {
        var local = now.atZone(config.getZone());
        var day = local.getDayOfWeek();

        if (config.isWeekdaysOnly() && (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY)) {
            return false;
        }

        if (config.getEnabledDays() != null && !config.getEnabledDays().contains(day.getValue())) {
            return false;
        }

        var timeOfDay = local.toLocalTime().truncatedTo(ChronoUnit.MINUTES);
        if (config.getStartTime() != null && timeOfDay.isBefore(config.getStartTime())) {
            return false;
        }
        return config.getEndTime() == null || !timeOfDay.isAfter(config.getEndTime());
    }
}
