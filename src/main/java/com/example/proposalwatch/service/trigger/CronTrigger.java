package com.example.proposalwatch.service.trigger;

import lombok.Getter;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Fires on a five-field cron expression evaluated in the schedule's zone.
 */
@Getter
public class CronTrigger extends TriggerDefinition {

    private final String expression;
    private final CronExpression cron;

    public CronTrigger(String jobKey, String expression, CronExpression cron) {
        super(jobKey);
        this.expression = expression;
        this.cron = cron;
    }

    @Override
    public Instant firstFireAfter(Instant reference, ZoneId zone) {
        var next = cron.next(reference.atZone(zone));
        return next == null ? null : next.toInstant();
    }

    @Override
    public String describe() {
        return "cron " + expression;
    }
}
