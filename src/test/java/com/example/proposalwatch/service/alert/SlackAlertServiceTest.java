package com.example.proposalwatch.service.alert;

import com.example.proposalwatch.config.SlackProperties;
import com.slack.api.Slack;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import com.slack.api.webhook.WebhookResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SlackAlertService Tests")
class SlackAlertServiceTest {

    private static final String WEBHOOK_URL = "https://hooks.slack.com/services/T000/B000/XXXX";

    @Mock
    private Slack slack;

    @Mock
    private WebhookResponse response;

    private SlackProperties properties;
    private SlackAlertService alertService;

    @BeforeEach
    void setUp() {
        properties = new SlackProperties();
        properties.setEnabled(true);
        properties.setWebhookUrl(WEBHOOK_URL);
        alertService = new SlackAlertService(properties, slack);
    }

    @Test
    @DisplayName("Should post the standing failure alert")
    void shouldSendStandingFailureAlert() throws Exception {
        // Given
        when(response.getCode()).thenReturn(200);
        when(slack.send(eq(WEBHOOK_URL), any(Payload.class))).thenReturn(response);
        var captor = ArgumentCaptor.forClass(Payload.class);

        // When
        alertService.sendStandingFailureAlert("default", 4, "Dataset refresh timed out after 300 seconds",
                Instant.parse("2024-03-12T02:00:00Z"));

        // Then
        verify(slack).send(eq(WEBHOOK_URL), captor.capture());
        var attachment = captor.getValue().getAttachments().get(0);
        assertThat(attachment.getColor()).isEqualTo("danger");
        assertThat(attachment.getFields()).extracting(Field::getTitle)
                .containsExactly("Scheduler", "Failed Attempts", "Failed At", "Last Error");
        assertThat(attachment.getFields().get(1).getValue()).isEqualTo("4");
    }

    @Test
    @DisplayName("Should not call Slack when it is not configured")
    void shouldSkipWhenNotConfigured() {
        properties.setWebhookUrl(null);

        alertService.sendStandingFailureAlert("default", 4, "boom", Instant.now());
        alertService.sendErrorAlert("Schedule configuration errors", "1 schedule(s)", "details");

        verifyNoInteractions(slack);
    }

    @Test
    @DisplayName("Should swallow delivery failures of alerts")
    void shouldNotThrowOnDeliveryFailure() throws Exception {
        when(slack.send(anyString(), any(Payload.class))).thenThrow(new IOException("connection reset"));

        assertThatCode(() -> alertService.sendErrorAlert("Job binding failed at startup", "boom", null))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should shorten long text")
    void shouldTruncate() {
        assertThat(SlackAlertService.truncate("abcdefghij", 8)).isEqualTo("abcde...");
        assertThat(SlackAlertService.truncate("short", 8)).isEqualTo("short");
        assertThat(SlackAlertService.truncate(null, 8)).isEmpty();
    }
}
