package com.example.proposalwatch.service.notification;

import com.example.proposalwatch.config.MetricsConfig;
import com.example.proposalwatch.config.NotificationProperties;
import com.example.proposalwatch.domain.model.FetchDelta;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Fans new-proposal digests out to every enabled channel.
 * <p>
 * A failing channel is logged and counted; it never stops the others and never fails the run.
 */
@Slf4j
@Service
public class NotificationService {

    private final List<NotificationChannel> channels;
    private final ProposalDigestFactory digestFactory;
    private final NotificationProperties properties;
    private final MetricsConfig metricsConfig;

    public NotificationService(List<NotificationChannel> channels,
                               ProposalDigestFactory digestFactory,
                               NotificationProperties properties,
                               MetricsConfig metricsConfig) {
        this.channels = channels;
        this.digestFactory = digestFactory;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void initialize() {
        for (var channel : channels) {
            log.info("Notification channel {}: {}", channel.getName(), channel.isEnabled() ? "enabled" : "disabled");
        }
    }

    /**
     * @return number of channels that accepted the digest
     */
    public int notifyNewProposals(FetchDelta delta) {
        if (delta.isEmpty()) {
            return 0;
        }
        if (!properties.isEnabled()) {
            log.info("Notifications disabled, {} new proposals not announced", delta.totalCount());
            return 0;
        }

        var digest = digestFactory.create(delta);
        var delivered = 0;
        for (var channel : channels) {
            if (!channel.isEnabled()) {
                continue;
            }
            try {
                channel.send(digest);
                delivered++;
                log.info("Sent digest of {} proposals via {}", digest.getTotalCount(), channel.getName());
            } catch (Exception e) {
                log.error("Notification via {} failed: {}", channel.getName(), e.getMessage(), e);
                metricsConfig.recordNotificationFailure(channel.getName());
            }
        }
        return delivered;
    }
}
