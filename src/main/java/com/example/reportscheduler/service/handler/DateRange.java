package com.example.reportscheduler.service.handler;

import lombok.Value;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Inclusive range of calendar dates covered by a report
 */
@Value
public class DateRange {

    private static final DateTimeFormatter LONG_DATE = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.US);

    LocalDate startDate;
    LocalDate endDate;

    /**
     * e.g. {@code January 05, 2026 to January 11, 2026}
     */
    public String describe() {
        return LONG_DATE.format(startDate) + " to " + LONG_DATE.format(endDate);
    }

    @Override
    public String toString() {
        return startDate + " to " + endDate;
    }
}
