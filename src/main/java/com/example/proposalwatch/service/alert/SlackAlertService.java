package com.example.proposalwatch.service.alert;

import com.example.proposalwatch.config.SlackProperties;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Sends operational alerts to Slack when a scheduler instance stops retrying
 * or when schedules cannot be bound at startup.
 * <p>
 * Alerts are sent asynchronously so the fetch path never waits on Slack.
 */
@Slf4j
@Service
public class SlackAlertService {

    private static final DateTimeFormatter FAILED_AT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneId.systemDefault());

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:proposal-watch}")
    private String applicationName = "proposal-watch";

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Alert that retries are exhausted and the instance is in standing failure.
     */
    @Async
    public void sendStandingFailureAlert(String instanceKey, int failedAttempts, String lastError, Instant failedAt) {
        if (!slackProperties.isConfigured()) {
            log.warn("Slack alerting not configured, scheduler {} entered standing failure without an alert", instanceKey);
            return;
        }
        post(buildStandingFailurePayload(instanceKey, failedAttempts, lastError, failedAt),
                "standing failure of " + instanceKey);
    }

    @Async
    public void sendErrorAlert(String title, String message, String details) {
        if (!slackProperties.isConfigured()) {
            log.warn("Slack alerting not configured, dropping alert: {}", title);
            return;
        }

        var fields = new ArrayList<Field>();
        if (details != null) {
            fields.add(field("Details", truncate(details, 500), false));
        }

        var attachment = Attachment.builder()
                .color("warning")
                .text(message)
                .fields(fields)
                .footer(applicationName)
                .ts(nowSeconds())
                .build();
        post(payload(":warning:", title, attachment), title);
    }

    Payload buildStandingFailurePayload(String instanceKey, int failedAttempts, String lastError, Instant failedAt) {
        var error = lastError == null ? "Unknown error" : lastError;

        var attachment = Attachment.builder()
                .color("danger")
                .title("Scheduler: " + instanceKey)
                .fields(List.of(
                        field("Scheduler", instanceKey, true),
                        field("Failed Attempts", String.valueOf(failedAttempts), true),
                        field("Failed At", FAILED_AT_FORMAT.format(failedAt), true),
                        field("Last Error", "```" + truncate(error, 400) + "```", false)))
                .footer(applicationName + " | Retrying resumes at the next scheduled run")
                .ts(nowSeconds())
                .build();
        return payload(":rotating_light:", "Proposal Fetch Retries Exhausted", attachment);
    }

    private Payload payload(String emoji, String headline, Attachment attachment) {
        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(emoji)
                .text(emoji + " *" + headline + "*")
                .attachments(List.of(attachment))
                .build();
    }

    private void post(Payload payload, String description) {
        try {
            var response = slack.send(slackProperties.getWebhookUrl(), payload);
            if (response == null || response.getCode() != 200) {
                log.error("Slack rejected alert for {}: {}", description,
                        response == null ? "no response" : response.getCode() + " " + response.getBody());
            } else {
                log.info("Slack alert sent for {}", description);
            }
        } catch (Exception e) {
            log.error("Failed to send Slack alert for {}: {}", description, e.getMessage(), e);
        }
    }

    private static Field field(String title, String value, boolean shortValue) {
        return Field.builder().title(title).value(value).valueShortEnough(shortValue).build();
    }

    private static String nowSeconds() {
        return String.valueOf(Instant.now().getEpochSecond());
    }

    static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength - 3) + "...";
    }
}
