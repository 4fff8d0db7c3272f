package com.example.proposalwatch.exception;

import lombok.Getter;

/**
 * A notification channel failed to deliver a digest
 */
@Getter
public class NotificationException extends RuntimeException {

    private final String channel;

    public NotificationException(String channel, String message) {
        super(String.format("[%s] %s", channel, message));
        this.channel = channel;
    }

    public NotificationException(String channel, Exception cause) {
        super(String.format("[%s] %s", channel, cause.getMessage()), cause);
        this.channel = channel;
    }
}
