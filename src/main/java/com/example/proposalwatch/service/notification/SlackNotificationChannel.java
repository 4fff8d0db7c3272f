package com.example.proposalwatch.service.notification;

import com.example.proposalwatch.config.SlackProperties;
import com.example.proposalwatch.exception.NotificationException;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Posts the digest to the Slack incoming webhook.
 */
@Slf4j
@Component
public class SlackNotificationChannel implements NotificationChannel {

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:proposal-watch}")
    private String applicationName = "proposal-watch";

    @Autowired
    public SlackNotificationChannel(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackNotificationChannel(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    @Override
    public String getName() {
        return "slack";
    }

    @Override
    public boolean isEnabled() {
        return slackProperties.isConfigured() && slackProperties.isNotifyProposals();
    }

    @Override
    public void send(ProposalDigest digest) {
        var payload = buildPayload(digest);
        try {
            var response = slack.send(slackProperties.getWebhookUrl(), payload);
            if (response.getCode() != 200) {
                throw new NotificationException(getName(),
                        "HTTP " + response.getCode() + ": " + response.getBody());
            }
        } catch (IOException e) {
            throw new NotificationException(getName(), e);
        }
    }

    Payload buildPayload(ProposalDigest digest) {
        var fields = digest.getFields().stream()
                .map(field -> Field.builder()
                        .title(field.getName())
                        .value(field.getValue())
                        .valueShortEnough(true)
                        .build())
                .toList();

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":bell:")
                .text(":bell: *" + ProposalDigest.TITLE + "*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("good")
                                .text(digest.getSummary())
                                .fields(fields)
                                .footer(applicationName)
                                .ts(String.valueOf(digest.getGeneratedAt().getEpochSecond()))
                                .build()
                ))
                .build();
    }
}
