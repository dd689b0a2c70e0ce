package com.example.reportscheduler.exception;

import lombok.Getter;

import java.util.List;

/**
 * Exception for a schedule definition that cannot be persisted
 */
@Getter
public class ScheduleValidationException extends RuntimeException {

    private final List<String> errors;

    public ScheduleValidationException(List<String> errors) {
        super("Invalid schedule: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public ScheduleValidationException(String error) {
        this(List.of(error));
    }
}
