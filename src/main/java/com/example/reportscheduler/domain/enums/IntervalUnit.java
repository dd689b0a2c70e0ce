package com.example.reportscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Units accepted by interval triggers.
 */
@Getter
@RequiredArgsConstructor
public enum IntervalUnit {

    MINUTES("minutes", ChronoUnit.MINUTES, false),
    HOURS("hours", ChronoUnit.HOURS, false),
    DAYS("days", ChronoUnit.DAYS, true),
    WEEKS("weeks", ChronoUnit.WEEKS, true);

    private final String code;
    private final ChronoUnit chronoUnit;

    /**
     * Calendar units are added in local time so the wall-clock time of day is kept across DST changes
     */
    private final boolean calendarBased;

    /**
     * Lenient lookup used by the trigger calculator, which must never throw
     */
    public static Optional<IntervalUnit> find(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (var unit : values()) {
            if (unit.getCode().equalsIgnoreCase(code.trim())) {
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }

    public static IntervalUnit fromCode(String code) {
        return find(code).orElseThrow(() -> new IllegalArgumentException("Unknown interval unit: " + code));
    }
}
