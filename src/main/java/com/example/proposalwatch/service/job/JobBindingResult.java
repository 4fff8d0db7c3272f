package com.example.proposalwatch.service.job;

import com.example.proposalwatch.exception.ScheduleConfigException;
import lombok.Getter;

import java.util.List;

/**
 * Job keys bound for a schedule and the configuration errors that kept triggers out.
 */
@Getter
public class JobBindingResult {

    private final String scheduleId;
    private final List<String> jobKeys;
    private final List<ScheduleConfigException> errors;

    public JobBindingResult(String scheduleId, List<String> jobKeys, List<ScheduleConfigException> errors) {
        this.scheduleId = scheduleId;
        this.jobKeys = List.copyOf(jobKeys);
        this.errors = List.copyOf(errors);
    }

    public static JobBindingResult unbound(String scheduleId) {
        return new JobBindingResult(scheduleId, List.of(), List.of());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
