package com.example.proposalwatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One upcoming run in a schedule preview
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunPreview {

    private Instant instant;

    /**
     * e.g. 2024-03-05 09:00:00 SGT
     */
    private String localTime;

    private String dayOfWeek;
}
