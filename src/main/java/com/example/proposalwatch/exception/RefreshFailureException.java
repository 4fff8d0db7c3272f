package com.example.proposalwatch.exception;

import lombok.Getter;

/**
 * The external dataset refresh did not complete
 */
@Getter
public class RefreshFailureException extends RuntimeException {

    private final Integer exitCode;
    private final boolean timedOut;
    private final String stderrExcerpt;

    public RefreshFailureException(int exitCode, String stderrExcerpt) {
        super(String.format("Dataset refresh exited with code %d: %s", exitCode, stderrExcerpt));
        this.exitCode = exitCode;
        this.timedOut = false;
        this.stderrExcerpt = stderrExcerpt;
    }

    public RefreshFailureException(long timeoutSeconds) {
        super(String.format("Dataset refresh timed out after %d seconds", timeoutSeconds));
        this.exitCode = null;
        this.timedOut = true;
        this.stderrExcerpt = null;
    }

    public RefreshFailureException(String message, Exception cause) {
        super(String.format("Dataset refresh could not run: %s", message), cause);
        this.exitCode = null;
        this.timedOut = false;
        this.stderrExcerpt = null;
    }
}
