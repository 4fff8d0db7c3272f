package com.example.proposalwatch.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Set;

/**
 * Window, budget and retry settings for one scheduler instance. Immutable per evaluation.
 */
@Value
@Builder(toBuilder = true)
public class RunWindowConfig {

    ZoneId zone;

    boolean weekdaysOnly;

    /**
     * ISO weekdays, Monday = 1 to Sunday = 7
     */
    Set<Integer> enabledDays;

    LocalTime startTime;

    /**
     * Inclusive upper bound, null for none
     */
    LocalTime endTime;

    /**
     * Null for unlimited
     */
    Integer maxRunsPerDay;

    boolean retryOnFailure;

    int retryMaxAttempts;

    int retryDelayMinutes;
}
