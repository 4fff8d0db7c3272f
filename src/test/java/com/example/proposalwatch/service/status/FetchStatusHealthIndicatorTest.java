package com.example.proposalwatch.service.status;

import com.example.proposalwatch.domain.model.LastCheckRecord;
import com.example.proposalwatch.domain.repository.LastCheckRepository;
import com.example.proposalwatch.service.executor.ExecutionGuard;
import com.example.proposalwatch.service.executor.FetchDispatcher;
import com.example.proposalwatch.service.executor.ScheduleRuntime;
import com.example.proposalwatch.service.executor.ScheduleRuntimeRegistry;
import com.example.proposalwatch.service.job.JobRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FetchStatusHealthIndicator Tests")
class FetchStatusHealthIndicatorTest {

    @Mock
    private ScheduleRuntimeRegistry runtimeRegistry;

    @Mock
    private JobRegistry jobRegistry;

    @Mock
    private FetchDispatcher dispatcher;

    @Mock
    private LastCheckRepository lastCheckRepository;

    private FetchStatusHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        indicator = new FetchStatusHealthIndicator(runtimeRegistry, jobRegistry, new ExecutionGuard(), dispatcher,
                lastCheckRepository);
    }

    @Test
    @DisplayName("Should stay UP and list schedulers in standing failure")
    void shouldReportStandingFailures() {
        // Given
        var failing = mock(ScheduleRuntime.class);
        when(failing.isStandingFailure()).thenReturn(true);
        when(failing.getKey()).thenReturn("abc");
        var healthy = mock(ScheduleRuntime.class);
        when(healthy.isStandingFailure()).thenReturn(false);
        when(runtimeRegistry.all()).thenReturn(List.of(failing, healthy));
        when(jobRegistry.jobCount()).thenReturn(3);
        when(lastCheckRepository.find()).thenReturn(Optional.of(LastCheckRecord.builder()
                .timestamp(Instant.parse("2024-03-12T02:00:00Z"))
                .newProposalsCount(2)
                .build()));

        // When
        var health = indicator.health();

        // Then
        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("jobs", 3)
                .containsEntry("fetchInProgress", false)
                .containsEntry("standingFailures", List.of("abc"))
                .containsEntry("lastCheck", Instant.parse("2024-03-12T02:00:00Z"))
                .containsEntry("lastNewProposals", 2);
    }

    @Test
    @DisplayName("Should be OUT_OF_SERVICE once dispatching stopped")
    void shouldReportStopped() {
        when(dispatcher.isStopped()).thenReturn(true);
        when(runtimeRegistry.all()).thenReturn(List.of());
        when(lastCheckRepository.find()).thenReturn(Optional.empty());

        var health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
        assertThat(health.getDetails()).doesNotContainKey("lastCheck");
    }
}
