package com.example.proposalwatch.service.notification;

import com.example.proposalwatch.config.NotificationProperties;
import com.example.proposalwatch.exception.NotificationException;
import jakarta.mail.MessagingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Sends the HTML digest by mail. SMTP settings come from {@code spring.mail.*}; without them no
 * mail sender exists and sending fails.
 */
@Slf4j
@Component
public class EmailNotificationChannel implements NotificationChannel {

    private final ObjectProvider<JavaMailSender> mailSender;
    private final NotificationProperties.Email properties;

    public EmailNotificationChannel(ObjectProvider<JavaMailSender> mailSender, NotificationProperties properties) {
        this.mailSender = mailSender;
        this.properties = properties.getEmail();
    }

    @Override
    public String getName() {
        return "email";
    }

    @Override
    public boolean isEnabled() {
        return properties.isEnabled() && properties.getRecipients() != null && !properties.getRecipients().isEmpty();
    }

    @Override
    public void send(ProposalDigest digest) {
        var sender = mailSender.getIfAvailable();
        if (sender == null) {
            throw new NotificationException(getName(), "no mail sender configured (spring.mail.host is not set)");
        }

        try {
            var message = sender.createMimeMessage();
            var helper = new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
            if (properties.getFrom() != null && !properties.getFrom().isBlank()) {
                helper.setFrom(properties.getFrom());
            }
            helper.setTo(properties.getRecipients().toArray(new String[0]));
            helper.setSubject(digest.getSubject());
            helper.setText(digest.getHtmlBody(), true);

            sender.send(message);
            log.debug("Digest mailed to {} recipient(s)", properties.getRecipients().size());
        } catch (MessagingException | MailException e) {
            throw new NotificationException(getName(), e);
        }
    }
}
