package com.example.reportscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for a job body that could not complete, e.g. a rejected mail delivery
 */
@Getter
public class JobExecutionException extends RuntimeException {

    private final UUID scheduleId;

    public JobExecutionException(UUID scheduleId, String message) {
        super(message);
        this.scheduleId = scheduleId;
    }

    public JobExecutionException(UUID scheduleId, String message, Exception cause) {
        super(message, cause);
        this.scheduleId = scheduleId;
    }
}
