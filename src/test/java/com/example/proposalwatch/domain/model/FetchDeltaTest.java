package com.example.proposalwatch.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FetchDelta Tests")
class FetchDeltaTest {

    @Test
    @DisplayName("Should keep protocols in insertion order and drop empty ones")
    void shouldBuildDelta() {
        var delta = FetchDelta.builder()
                .add("tron", List.of(new ProposalRecord(101, Map.of())))
                .add("bitcoin", List.of())
                .add("ethereum", List.of(new ProposalRecord(1, null), new ProposalRecord(2, null)))
                .build();

        assertThat(delta.protocols()).containsExactly("tron", "ethereum");
        assertThat(delta.totalCount()).isEqualTo(3);
        assertThat(delta.get("bitcoin")).isEmpty();
        assertThat(delta).hasToString("FetchDelta{tron=1, ethereum=2}");
    }

    @Test
    @DisplayName("Should collapse to the empty delta")
    void shouldBuildEmptyDelta() {
        var delta = FetchDelta.builder().add("bitcoin", List.of()).build();

        assertThat(delta.isEmpty()).isTrue();
        assertThat(delta).isSameAs(FetchDelta.empty());
    }

    @Test
    @DisplayName("Should summarise a delta as a last-check record")
    void shouldCreateLastCheckRecord() {
        var delta = FetchDelta.builder().add("ethereum", List.of(new ProposalRecord(4844, null))).build();
        var now = Instant.parse("2024-03-12T02:00:00Z");

        var record = LastCheckRecord.of(delta, now);

        assertThat(record.getTimestamp()).isEqualTo(now);
        assertThat(record.getNewProposalsCount()).isEqualTo(1);
        assertThat(record.getProtocolsWithNew()).containsExactly("ethereum");
    }
}
