package com.example.proposalwatch.dto;

import com.example.proposalwatch.domain.model.Schedule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of creating or changing a schedule: the stored schedule, the jobs now bound for it and
 * any configuration errors that kept triggers out.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleChangeResult {

    private Schedule schedule;

    @Builder.Default
    private List<String> jobKeys = new ArrayList<>();

    @Builder.Default
    private List<String> configErrors = new ArrayList<>();

    public boolean hasConfigErrors() {
        return configErrors != null && !configErrors.isEmpty();
    }
}
