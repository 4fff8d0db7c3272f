package com.example.proposalwatch.service.trigger;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Fires every fixed period, counted from the moment the job is bound.
 */
@Getter
public class IntervalTrigger extends TriggerDefinition {

    private final Duration interval;

    public IntervalTrigger(String jobKey, Duration interval) {
        super(jobKey);
        this.interval = interval;
    }

    @Override
    public Instant firstFireAfter(Instant reference, ZoneId zone) {
        return reference.plus(interval);
    }

    @Override
    public Instant nextFireAfter(Instant previousFire, Instant now, ZoneId zone) {
        if (previousFire.isAfter(now)) {
            return previousFire;
        }
        var periods = Duration.between(previousFire, now).toMillis() / interval.toMillis() + 1;
        return previousFire.plus(interval.multipliedBy(periods));
    }

    @Override
    public String describe() {
        return "every " + interval.toMinutes() + " min";
    }
}
