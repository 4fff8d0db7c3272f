package com.example.proposalwatch.service.executor;

import com.example.proposalwatch.domain.enums.RunStatus;
import com.example.proposalwatch.domain.enums.RunTrigger;
import com.example.proposalwatch.domain.model.FetchDelta;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Represents the result of one fetch run.
 */
@Data
@Builder
public class FetchRunResult {

    private RunStatus status;

    private RunTrigger trigger;

    /**
     * Null for the default schedule
     */
    private String scheduleId;

    @Builder.Default
    private FetchDelta delta = FetchDelta.empty();

    private Instant startedAt;

    private long durationMs;

    private String errorMessage;

    /**
     * Error type/classification for analysis
     */
    private String errorType;

    public static FetchRunResult skipped(RunStatus status, RunTrigger trigger, String scheduleId, Instant startedAt) {
        return FetchRunResult.builder()
                .status(status)
                .trigger(trigger)
                .scheduleId(scheduleId)
                .startedAt(startedAt)
                .build();
    }

    public static FetchRunResult failure(RunTrigger trigger, String scheduleId, Instant startedAt, Exception e) {
        return FetchRunResult.builder()
                .status(RunStatus.FAILED)
                .trigger(trigger)
                .scheduleId(scheduleId)
                .startedAt(startedAt)
                .errorMessage(e.getMessage())
                .errorType(e.getClass().getSimpleName())
                .build();
    }

    public boolean isSuccess() {
        return status != null && status.isSuccess();
    }

    public int newProposalsCount() {
        return delta == null ? 0 : delta.totalCount();
    }
}
