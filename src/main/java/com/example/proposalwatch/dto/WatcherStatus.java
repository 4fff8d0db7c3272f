package com.example.proposalwatch.dto;

import com.example.proposalwatch.domain.model.LastCheckRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Status response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WatcherStatus {

    private boolean running;
    private boolean fetchInProgress;
    private List<String> protocols;
    private String dataDir;
    private String schedulesFile;
    private boolean notificationsEnabled;
    private LastCheckRecord lastCheck;
    private int jobCount;
    private long standingFailures;
    private List<ScheduleStatus> schedules;
    private Instant generatedAt;
}
