package com.example.reportscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of reporting windows a report job can cover.
 * Every window is anchored to "today" in the schedule's timezone.
 */
@Getter
@RequiredArgsConstructor
public enum DateRangeKind {

    PREVIOUS_DAY("previous_day", "Previous Day"),
    PREVIOUS_WEEK("previous_week", "Previous Week"),
    PREVIOUS_2_WEEKS("previous_2_weeks", "Previous 2 Weeks"),
    PREVIOUS_MONTH("previous_month", "Previous Month"),
    PREVIOUS_7_DAYS("previous_7_days", "Previous 7 Days"),
    PREVIOUS_14_DAYS("previous_14_days", "Previous 14 Days"),
    PREVIOUS_30_DAYS("previous_30_days", "Previous 30 Days");

    private final String code;
    private final String displayName;

    public static DateRangeKind fromCode(String code) {
        for (var kind : values()) {
            if (kind.getCode().equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown date range type: " + code);
    }
}
