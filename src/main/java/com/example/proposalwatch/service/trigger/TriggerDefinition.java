package com.example.proposalwatch.service.trigger;

import lombok.Getter;

import java.time.Instant;
import java.time.ZoneId;

/**
 * One compiled trigger of a schedule, bound to the job key it fires under.
 */
@Getter
public abstract class TriggerDefinition {

    private final String jobKey;

    protected TriggerDefinition(String jobKey) {
        this.jobKey = jobKey;
    }

    /**
     * First fire time strictly after {@code reference}, or null if the trigger never fires again
     */
    public abstract Instant firstFireAfter(Instant reference, ZoneId zone);

    /**
     * First fire time strictly after {@code now} in the sequence that produced {@code previousFire}.
     * Any firings between the two are skipped.
     */
    public Instant nextFireAfter(Instant previousFire, Instant now, ZoneId zone) {
        return firstFireAfter(now, zone);
    }

    public abstract String describe();

    @Override
    public String toString() {
        return jobKey + " [" + describe() + "]";
    }
}
