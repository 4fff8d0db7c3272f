package com.example.proposalwatch.service.job;

import com.example.proposalwatch.service.trigger.TriggerDefinition;
import lombok.Getter;

import java.time.Instant;
import java.time.ZoneId;

/**
 * A live job: one trigger of one schedule plus its next fire time.
 */
@Getter
public class JobHandle {

    private final String jobKey;

    /**
     * Null for the default schedule
     */
    private final String scheduleId;

    private final TriggerDefinition trigger;
    private final ZoneId zone;

    private Instant nextFireTime;

    JobHandle(String scheduleId, TriggerDefinition trigger, ZoneId zone, Instant boundAt) {
        this.jobKey = trigger.getJobKey();
        this.scheduleId = scheduleId;
        this.trigger = trigger;
        this.zone = zone;
        this.nextFireTime = trigger.firstFireAfter(boundAt, zone);
    }

    boolean isDue(Instant now) {
        return nextFireTime != null && !now.isBefore(nextFireTime);
    }

    /**
     * Move past {@code now}. Firings missed while the process was busy collapse into the one
     * being dispatched.
     */
    void advance(Instant now) {
        nextFireTime = trigger.nextFireAfter(nextFireTime, now, zone);
    }
}
