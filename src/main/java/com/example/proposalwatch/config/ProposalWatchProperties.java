package com.example.proposalwatch.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the proposal watcher.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "proposal-watch")
public class ProposalWatchProperties {

    /**
     * Directory holding the per-protocol dataset files
     */
    @NotBlank
    private String dataDir = "data";

    /**
     * Protocols checked when a schedule does not name its own chains
     */
    @NotEmpty
    private List<String> protocols = new ArrayList<>(List.of("ethereum", "tron", "bitcoin", "binance_smart_chain"));

    /**
     * Dataset file name per protocol, overriding the built-in mapping
     */
    private Map<String, String> protocolFiles = new HashMap<>();

    /**
     * Interval in milliseconds between evaluations of due jobs
     */
    @Min(1000)
    @Max(60000)
    private long tickIntervalMs = 30000;

    /**
     * Delay before the first evaluation after startup
     */
    @Min(0)
    private long tickInitialDelayMs = 5000;

    /**
     * Number of worker threads running fetches
     */
    @Min(1)
    private int fetchPoolSize = 2;

    /**
     * Upper bound for how long a single job keeps its lock
     */
    @Min(1)
    private int jobLockAtMostMinutes = 120;

    @Valid
    private Store store = new Store();

    @Valid
    private Refresh refresh = new Refresh();

    @Valid
    private DefaultSchedule defaultSchedule = new DefaultSchedule();

    @Data
    public static class Store {

        @NotBlank
        private String schedulesFile = "data/schedules.json";

        @NotBlank
        private String lastCheckFile = "data/fetcher_state.json";
    }

    @Data
    public static class Refresh {

        /**
         * Command regenerating all protocol datasets
         */
        @NotEmpty
        private List<String> command = new ArrayList<>(List.of("python3", "scripts/generate_all_data.py"));

        /**
         * Working directory of the refresh command
         */
        private String workingDir = ".";

        @Min(1)
        private int timeoutSeconds = 300;
    }

    /**
     * The process-wide schedule that runs without a persisted schedule record.
     */
    @Data
    public static class DefaultSchedule {

        private boolean enabled = true;

        /**
         * Run one check as soon as the application is ready
         */
        private boolean autoStart = false;

        /**
         * interval, cron or specific_times
         */
        @NotBlank
        private String mode = "interval";

        @Min(1)
        private int intervalMinutes = 60;

        private String cronExpression = "0 */1 * * *";

        private List<String> specificTimes = new ArrayList<>(List.of("09:00", "13:00", "17:00"));

        @NotBlank
        private String timezone = "Asia/Singapore";

        private String startTime = "09:00";

        private String endTime = "18:00";

        private boolean weekdaysOnly = true;

        private List<Integer> enabledDays = new ArrayList<>(List.of(1, 2, 3, 4, 5));

        @Min(1)
        private int maxRunsPerDay = 24;

        private boolean retryOnFailure = true;

        @Min(0)
        private int retryMaxAttempts = 3;

        @Min(1)
        private int retryDelayMinutes = 5;
    }
}
