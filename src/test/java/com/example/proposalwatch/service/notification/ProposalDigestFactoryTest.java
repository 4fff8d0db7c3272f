package com.example.proposalwatch.service.notification;

import com.example.proposalwatch.config.NotificationProperties;
import com.example.proposalwatch.domain.model.FetchDelta;
import com.example.proposalwatch.domain.model.ProposalRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProposalDigestFactory Tests")
class ProposalDigestFactoryTest {

    private static final Instant NOW = Instant.parse("2024-03-12T02:00:00Z");

    private ProposalDigestFactory factory;

    @BeforeEach
    void setUp() {
        factory = new ProposalDigestFactory(new NotificationProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static List<ProposalRecord> eips(int count) {
        var records = new ArrayList<ProposalRecord>();
        for (var i = 1; i <= count; i++) {
            records.add(new ProposalRecord(7000 + i, Map.of("type", "EIP", "title", "Proposal " + i,
                    "status", "Draft", "created", "2024-03-0" + i)));
        }
        return records;
    }

    @Test
    @DisplayName("Should summarise the delta per protocol")
    void shouldSummariseDelta() {
        // Given
        var delta = FetchDelta.builder()
                .add("ethereum", eips(2))
                .add("tron", List.of(new ProposalRecord(101, Map.of("type", "TIP", "title", "Resource model"))))
                .build();

        // When
        var digest = factory.create(delta);

        // Then
        assertThat(digest.getSubject()).isEqualTo("3 New Blockchain Proposals Detected");
        assertThat(digest.getSummary()).isEqualTo("Found 3 new proposals across 2 protocols");
        assertThat(digest.getTotalCount()).isEqualTo(3);
        assertThat(digest.getGeneratedAt()).isEqualTo(NOW);
        assertThat(digest.getFields()).containsExactly(
                new ProposalDigest.Field("ETHEREUM", "2 new proposals"),
                new ProposalDigest.Field("TRON", "1 new proposals"));
        assertThat(digest.getHtmlBody())
                .contains("<h3>ETHEREUM (2 new)</h3>")
                .contains("<strong>EIP-7001</strong>: Proposal 1")
                .contains("<strong>TIP-101</strong>: Resource model")
                .contains("Status: Unknown");
    }

    @Test
    @DisplayName("Should list at most five proposals per protocol")
    void shouldLimitProposalsPerProtocol() {
        var digest = factory.create(FetchDelta.builder().add("ethereum", eips(7)).build());

        assertThat(digest.getHtmlBody())
                .contains("EIP-7005")
                .doesNotContain("EIP-7006")
                .contains("...and 2 more");
    }

    @Test
    @DisplayName("Should escape and shorten titles")
    void shouldEscapeAndShortenTitles() {
        var longTitle = "<script>alert(1)</script>" + "x".repeat(100);
        var delta = FetchDelta.builder()
                .add("bitcoin", List.of(new ProposalRecord(340, Map.of("type", "BIP", "title", longTitle))))
                .build();

        var body = factory.create(delta).getHtmlBody();

        assertThat(body).contains("&lt;script&gt;alert(1)&lt;/script&gt;").doesNotContain("<script>");
        assertThat(body).doesNotContain("x".repeat(56));
        assertThat(body).contains("x".repeat(55));
    }
}
