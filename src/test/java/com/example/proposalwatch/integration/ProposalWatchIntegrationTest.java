package com.example.proposalwatch.integration;

import com.example.proposalwatch.domain.enums.RunStatus;
import com.example.proposalwatch.domain.enums.TriggerMode;
import com.example.proposalwatch.domain.model.Schedule;
import com.example.proposalwatch.domain.repository.LastCheckRepository;
import com.example.proposalwatch.service.ScheduleManagementService;
import com.example.proposalwatch.service.job.JobRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.MOCK,
        properties = {
                "proposal-watch.tick-interval-ms=60000",
                "proposal-watch.tick-initial-delay-ms=999999999",
                "proposal-watch.default-schedule.auto-start=false",
                "proposal-watch.refresh.command=sh,-c,exit 0",
                "slack.enabled=false"
        }
)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisabledOnOs(OS.WINDOWS)
@DisplayName("Proposal Watch Integration Tests")
class ProposalWatchIntegrationTest {

    private static final Path DATA_DIR;

    static {
        try {
            DATA_DIR = Files.createTempDirectory("proposal-watch-it");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @DynamicPropertySource
    static void storeProperties(DynamicPropertyRegistry registry) {
        registry.add("proposal-watch.data-dir", DATA_DIR::toString);
        registry.add("proposal-watch.store.schedules-file", () -> DATA_DIR.resolve("schedules.json").toString());
        registry.add("proposal-watch.store.last-check-file", () -> DATA_DIR.resolve("fetcher_state.json").toString());
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ScheduleManagementService scheduleManagementService;

    @Autowired
    private JobRegistry jobRegistry;

    @Autowired
    private LastCheckRepository lastCheckRepository;

    @Test
    @DisplayName("Should bind the default schedule at startup")
    void shouldBindDefaultSchedule() {
        assertThat(jobRegistry.findJob("fetch_default")).isPresent();
    }

    @Test
    @DisplayName("Should persist a new schedule and bind its sub-jobs")
    void shouldCreateSchedule() {
        // When
        var result = scheduleManagementService.createSchedule(Schedule.builder()
                .name("Twice a day")
                .mode(TriggerMode.SPECIFIC_TIMES)
                .times(List.of("09:00", "17:30"))
                .timezone("Europe/Berlin")
                .build());

        // Then
        var id = result.getSchedule().getId();
        assertThat(result.getJobKeys()).containsExactly("fetch_" + id + "_0900", "fetch_" + id + "_1730");
        assertThat(DATA_DIR.resolve("schedules.json")).exists();
        assertThat(scheduleManagementService.getSchedule(id)).isPresent();

        scheduleManagementService.deleteSchedule(id);
        assertThat(jobRegistry.handlesOf(id)).isEmpty();
    }

    @Test
    @DisplayName("Should run a manual check end to end")
    void shouldRunManualCheck() {
        var result = scheduleManagementService.checkNow(null);

        assertThat(result.getStatus()).isEqualTo(RunStatus.NO_CHANGES);
        assertThat(lastCheckRepository.find()).hasValueSatisfying(
                record -> assertThat(record.getNewProposalsCount()).isZero());
    }

    @Test
    @DisplayName("Should expose the watcher state as a health component")
    void shouldExposeHealth() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.fetchStatus.status").value("UP"))
                .andExpect(jsonPath("$.components.fetchStatus.details.jobs").isNumber());
    }
}
