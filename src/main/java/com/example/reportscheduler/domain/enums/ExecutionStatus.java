package com.example.reportscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle of a single execution attempt.
 * An execution starts RUNNING and moves to a terminal state exactly once.
 */
@Getter
@RequiredArgsConstructor
public enum ExecutionStatus {

    RUNNING("running", "Running"),

    SUCCESS("success", "Success"),

    FAILED("failed", "Failed");

    private final String code;
    private final String displayName;

    public static ExecutionStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown execution status code: " + code);
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
