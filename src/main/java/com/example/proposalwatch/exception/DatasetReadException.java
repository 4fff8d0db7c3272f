package com.example.proposalwatch.exception;

import lombok.Getter;

/**
 * A protocol dataset file could not be read or parsed
 */
@Getter
public class DatasetReadException extends RuntimeException {

    private final String protocol;
    private final String path;

    public DatasetReadException(String protocol, String path, Exception cause) {
        super(String.format("Cannot read dataset for %s from %s: %s", protocol, path, cause.getMessage()), cause);
        this.protocol = protocol;
        this.path = path;
    }

    public DatasetReadException(String protocol, String path, String reason) {
        super(String.format("Cannot read dataset for %s from %s: %s", protocol, path, reason));
        this.protocol = protocol;
        this.path = path;
    }
}
