package com.example.proposalwatch.domain.model;

import com.example.proposalwatch.domain.enums.TriggerMode;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A user-authored fetch schedule, persisted in the schedule store.
 * <p>
 * {@code mode} selects which trigger field is authoritative. The other trigger fields are kept
 * when the mode changes but ignored while it stays switched.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Schedule {

    private String id;

    private String name;

    /**
     * Protocols this schedule checks. Empty means the configured default protocols.
     */
    @Builder.Default
    @JsonDeserialize(as = LinkedHashSet.class)
    private Set<String> chains = new LinkedHashSet<>();

    private TriggerMode mode;

    private Integer intervalMinutes;

    @JsonAlias("cron_expression")
    private String cron;

    /**
     * HH:MM entries for specific-times mode
     */
    @Builder.Default
    private List<String> times = new ArrayList<>();

    @Builder.Default
    private Boolean weekdaysOnly = true;

    /**
     * IANA zone id. Null falls back to the default schedule's zone.
     */
    private String timezone;

    private String endTime;

    @Builder.Default
    private boolean enabled = true;

    private Instant createdAt;

    private Instant lastRun;

    /**
     * Null means unlimited
     */
    private Integer maxRunsPerDay;

    @JsonIgnore
    public boolean isWeekdaysOnlyEffective() {
        return weekdaysOnly == null || weekdaysOnly;
    }

    /**
     * Copy that shares no mutable collections with this instance
     */
    public Schedule copy() {
        return toBuilder()
                .chains(chains == null ? new LinkedHashSet<>() : new LinkedHashSet<>(chains))
                .times(times == null ? new ArrayList<>() : new ArrayList<>(times))
                .build();
    }
}
