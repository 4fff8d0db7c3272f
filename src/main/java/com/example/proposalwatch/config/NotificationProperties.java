package com.example.proposalwatch.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Notification channel configuration properties.
 * SMTP connection settings live under spring.mail.*.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "notifications")
public class NotificationProperties {

    /**
     * Master switch for new-proposal notifications
     */
    private boolean enabled = true;

    /**
     * Maximum proposals listed per protocol in a digest
     */
    @Min(1)
    private int maxProposalsPerProtocol = 5;

    @Valid
    private Email email = new Email();

    @Valid
    private Webhook webhook = new Webhook();

    @Valid
    private Desktop desktop = new Desktop();

    @Data
    public static class Email {
        private boolean enabled = false;
        private String from;
        private List<String> recipients = new ArrayList<>();
    }

    @Data
    public static class Webhook {
        private boolean enabled = false;

        /**
         * discord or generic
         */
        private String type = "discord";

        private String url;

        @Min(1)
        private int timeoutSeconds = 10;
    }

    @Data
    public static class Desktop {
        private boolean enabled = false;
    }
}
