package com.example.proposalwatch.service.job;

import com.example.proposalwatch.config.ProposalWatchProperties;
import com.example.proposalwatch.domain.enums.RunTrigger;
import com.example.proposalwatch.service.alert.SlackAlertService;
import com.example.proposalwatch.service.executor.FetchDispatcher;
import com.example.proposalwatch.service.executor.FetchOrchestrator;
import com.example.proposalwatch.service.trigger.TriggerCompiler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Rebuilds all jobs from the schedule store when the application starts and, if configured,
 * runs one check right away.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobBootstrap implements ApplicationRunner {

    private final JobRegistry jobRegistry;
    private final FetchDispatcher dispatcher;
    private final FetchOrchestrator orchestrator;
    private final SlackAlertService slackAlertService;
    private final ProposalWatchProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        try {
            var results = new ArrayList<JobBindingResult>();
            results.add(jobRegistry.registerDefault());
            results.addAll(jobRegistry.refreshAll());
            reportConfigErrors(results);
        } catch (Exception e) {
            log.error("Failed to bind jobs at startup: {}", e.getMessage(), e);
            slackAlertService.sendErrorAlert("Job binding failed at startup", e.getMessage(), null);
        }

        var defaults = properties.getDefaultSchedule();
        if (defaults.isEnabled() && defaults.isAutoStart()) {
            log.info("Auto-start enabled, running initial check");
            dispatcher.dispatch(TriggerCompiler.jobKey(TriggerCompiler.DEFAULT_SCHEDULE_ID),
                    () -> orchestrator.run(null, RunTrigger.STARTUP));
        }
    }

    private void reportConfigErrors(List<JobBindingResult> results) {
        var failing = results.stream().filter(JobBindingResult::hasErrors).toList();
        if (failing.isEmpty()) {
            return;
        }

        var details = failing.stream()
                .flatMap(result -> result.getErrors().stream())
                .map(Throwable::getMessage)
                .collect(Collectors.joining("\n"));
        slackAlertService.sendErrorAlert("Schedule configuration errors",
                failing.size() + " schedule(s) have invalid trigger settings and run with fewer jobs", details);
    }
}
