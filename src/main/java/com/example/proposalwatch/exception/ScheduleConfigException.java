package com.example.proposalwatch.exception;

import lombok.Getter;

/**
 * Malformed or missing trigger, time or zone setting of a schedule
 */
@Getter
public class ScheduleConfigException extends RuntimeException {

    private final String scheduleId;
    private final String field;
    private final String value;

    public ScheduleConfigException(String scheduleId, String field, String value, String reason) {
        super(String.format("Schedule %s has invalid %s '%s': %s", scheduleId, field, value, reason));
        this.scheduleId = scheduleId;
        this.field = field;
        this.value = value;
    }

    public ScheduleConfigException(String scheduleId, String field, String value, Exception cause) {
        super(String.format("Schedule %s has invalid %s '%s': %s", scheduleId, field, value, cause.getMessage()), cause);
        this.scheduleId = scheduleId;
        this.field = field;
        this.value = value;
    }
}
