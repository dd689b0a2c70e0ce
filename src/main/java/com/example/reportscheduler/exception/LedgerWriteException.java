package com.example.reportscheduler.exception;

import lombok.Getter;

/**
 * Exception for a storage write that still failed after every commit attempt
 */
@Getter
public class LedgerWriteException extends RuntimeException {

    private final String operation;
    private final int attempts;

    public LedgerWriteException(String operation, int attempts, Throwable cause) {
        super(String.format("Write '%s' failed after %d attempt(s): %s", operation, attempts, cause.getMessage()), cause);
        this.operation = operation;
        this.attempts = attempts;
    }
}
