package com.example.proposalwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Proposal Watch Application
 * <p>
 * Periodically refreshes the per-protocol proposal datasets, detects newly
 * published proposals and notifies the configured channels.
 * <p>
 * Features:
 * - Multiple persisted schedules (interval, cron, specific daily times)
 * - Time windows and daily run budgets per schedule
 * - Single process-wide execution guard around the fetch operation
 * - Retry with exponential backoff and Slack alerting once retries are exhausted
 * - Email, webhook, Slack and desktop notifications
 */
@EnableScheduling
@SpringBootApplication
public class ProposalWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProposalWatchApplication.class, args);
    }
}
