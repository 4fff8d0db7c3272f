package com.example.proposalwatch.exception;

import lombok.Getter;

/**
 * Exception when a JSON store file cannot be replaced
 */
@Getter
public class StoreWriteException extends RuntimeException {

    private final String path;

    public StoreWriteException(String path, Exception cause) {
        super(String.format("Failed to write %s: %s", path, cause.getMessage()), cause);
        this.path = path;
    }
}
