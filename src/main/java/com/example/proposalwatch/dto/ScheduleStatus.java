package com.example.proposalwatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Runtime state of one scheduler instance
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleStatus {

    /**
     * Schedule id, or "default"
     */
    private String key;
    private String name;
    private boolean enabled;
    private List<String> jobKeys;
    private Instant nextRunTime;
    private int runsToday;
    private LocalDate lastRunDate;
    private int failedAttempts;
    private boolean standingFailure;
    private Instant pendingRetryAt;
    private String lastStatus;
    private Instant lastStartedAt;
    private String lastError;
}
