package com.example.proposalwatch.exception;

import lombok.Getter;

/**
 * Exception when a schedule is not found
 */
@Getter
public class ScheduleNotFoundException extends RuntimeException {

    private final String scheduleId;

    public ScheduleNotFoundException(String scheduleId) {
        super(String.format("Schedule not found with id: %s", scheduleId));
        this.scheduleId = scheduleId;
    }
}
