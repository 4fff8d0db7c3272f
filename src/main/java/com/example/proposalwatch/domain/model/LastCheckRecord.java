package com.example.proposalwatch.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary of the last completed check, overwritten by every completed run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class LastCheckRecord {

    private Instant timestamp;

    private int newProposalsCount;

    @Builder.Default
    private List<String> protocolsWithNew = new ArrayList<>();

    public static LastCheckRecord of(FetchDelta delta, Instant timestamp) {
        return LastCheckRecord.builder()
                .timestamp(timestamp)
                .newProposalsCount(delta.totalCount())
                .protocolsWithNew(new ArrayList<>(delta.protocols()))
                .build();
    }
}
