package com.example.proposalwatch.service.notification;

/**
 * One delivery route for proposal digests.
 * <p>
 * Channels are discovered as beans by {@link NotificationService}. Implementations should
 * report delivery problems as {@link com.example.proposalwatch.exception.NotificationException}.
 */
public interface NotificationChannel {

    /**
     * Short name used in logs and metrics
     */
    String getName();

    boolean isEnabled();

    void send(ProposalDigest digest);
}
