package com.example.proposalwatch.service.job;

import com.example.proposalwatch.domain.enums.RunTrigger;
import com.example.proposalwatch.service.executor.FetchDispatcher;
import com.example.proposalwatch.service.executor.FetchOrchestrator;
import com.example.proposalwatch.service.executor.RetryController;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Timer loop that finds due jobs and dispatches them to the fetch workers.
 * <p>
 * Flow:
 * 1. Tick runs on a fixed delay (e.g., every 30 seconds)
 * 2. Due job handles are claimed and advanced past now, coalescing missed firings
 * 3. Each due job is handed to the dispatcher; fetch work never runs on this thread
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobTickService {

    private final JobRegistry jobRegistry;
    private final FetchDispatcher dispatcher;
    private final FetchOrchestrator orchestrator;
    private final RetryController retryController;
    private final Clock clock;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${proposal-watch.tick-interval-ms:30000}",
            initialDelayString = "${proposal-watch.tick-initial-delay-ms:5000}")
    @SchedulerLock(name = "scheduleTick", lockAtLeastFor = "1s", lockAtMostFor = "5m")
    public void tick() {
        if (dispatcher.isStopped()) {
            return;
        }
        if (!isRunning.compareAndSet(false, true)) {
            log.debug("Previous tick still running, skipping");
            return;
        }

        try {
            var now = clock.instant();
            var due = jobRegistry.claimDue(now);
            if (due.isEmpty()) {
                log.trace("No jobs due at {}", now);
                return;
            }

            for (var handle : due) {
                log.info("Job {} is due, next fire at {}", handle.getJobKey(),
                        handle.getNextFireTime() == null ? "never" : handle.getNextFireTime().atZone(handle.getZone()));
                var scheduleId = handle.getScheduleId();
                dispatcher.dispatch(handle.getJobKey(), () -> orchestrator.run(scheduleId, RunTrigger.SCHEDULED));
            }
        } catch (Exception e) {
            log.error("Error in schedule tick: {}", e.getMessage(), e);
        } finally {
            isRunning.set(false);
        }
    }

    /**
     * Stop dispatching and drop pending retries. A run in progress finishes on its own.
     */
    @PreDestroy
    public void stop() {
        log.info("Stopping job dispatch");
        dispatcher.stop();
        retryController.cancelAll();
    }
}
