package com.example.proposalwatch.service.trigger;

import com.example.proposalwatch.service.window.TimeOfDay;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Fires once a day at a fixed local time.
 */
@Getter
public class DailyTimeTrigger extends TriggerDefinition {

    private final LocalTime time;

    public DailyTimeTrigger(String jobKey, LocalTime time) {
        super(jobKey);
        this.time = time;
    }

    @Override
    public Instant firstFireAfter(Instant reference, ZoneId zone) {
        var date = reference.atZone(zone).toLocalDate();
        var candidate = date.atTime(time).atZone(zone).toInstant();
        if (!candidate.isAfter(reference)) {
            candidate = date.plusDays(1).atTime(time).atZone(zone).toInstant();
        }
        return candidate;
    }

    @Override
    public String describe() {
        return "daily at " + TimeOfDay.display(time);
    }
}
