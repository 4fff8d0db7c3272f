package com.example.proposalwatch.domain.model;

import com.example.proposalwatch.domain.enums.TriggerMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Schedule Tests")
class ScheduleTest {

    @Test
    @DisplayName("Should default to enabled and weekdays only")
    void shouldApplyDefaults() {
        var schedule = Schedule.builder().id("abc").mode(TriggerMode.INTERVAL).intervalMinutes(30).build();

        assertThat(schedule.isEnabled()).isTrue();
        assertThat(schedule.isWeekdaysOnlyEffective()).isTrue();
        assertThat(schedule.getChains()).isEmpty();
    }

    @Test
    @DisplayName("Should treat a missing weekdays flag as weekdays only")
    void shouldTreatNullWeekdaysAsTrue() {
        var schedule = Schedule.builder().weekdaysOnly(null).build();

        assertThat(schedule.isWeekdaysOnlyEffective()).isTrue();
    }

    @Test
    @DisplayName("Should keep inactive trigger fields across a mode switch")
    void shouldKeepInactiveFields() {
        var schedule = Schedule.builder().id("abc").mode(TriggerMode.INTERVAL).intervalMinutes(30)
                .times(List.of("09:00")).build();

        var switched = schedule.toBuilder().mode(TriggerMode.SPECIFIC_TIMES).build();

        assertThat(switched.getIntervalMinutes()).isEqualTo(30);
        assertThat(switched.getTimes()).containsExactly("09:00");
    }

    @Test
    @DisplayName("Should copy without sharing collections")
    void shouldCopyDeeply() {
        var schedule = Schedule.builder().id("abc").times(List.of("09:00")).build();

        var copy = schedule.copy();
        copy.getTimes().add("17:00");
        copy.getChains().add("tron");

        assertThat(schedule.getTimes()).containsExactly("09:00");
        assertThat(schedule.getChains()).isEmpty();
        assertThat(copy).isNotSameAs(schedule);
    }
}
