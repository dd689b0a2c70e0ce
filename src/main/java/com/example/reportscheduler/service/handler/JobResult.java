package com.example.reportscheduler.service.handler;

import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Represents the outcome of a job body.
 * <p>
 * Contains what is recorded on the execution row: the summary of a success
 * or the message of a failure.
 */
@Data
@Builder
public class JobResult {

    private boolean success;

    private String errorMessage;

    /**
     * Error classification, the exception's simple class name when built from one
     */
    private String errorType;

    /**
     * Stored as the execution's result summary
     */
    @Builder.Default
    private Map<String, Object> summary = new HashMap<>();

    public static JobResult success(Map<String, Object> summary) {
        return JobResult.builder()
                .success(true)
                .summary(summary != null ? new HashMap<>(summary) : new HashMap<>())
                .build();
    }

    public static JobResult failure(String errorMessage) {
        return JobResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public static JobResult failure(Exception e) {
        var message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return JobResult.builder()
                .success(false)
                .errorMessage(message)
                .errorType(e.getClass().getSimpleName())
                .build();
    }

    public JobResult withSummary(String key, Object value) {
        if (this.summary == null) {
            this.summary = new HashMap<>();
        }
        this.summary.put(key, value);
        return this;
    }
}
