package com.example.reportscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How a schedule's fire times are described.
 */
@Getter
@RequiredArgsConstructor
public enum TriggerKind {

    /**
     * Five-field cron expression
     */
    CRON("cron"),

    /**
     * Fixed period, optionally phase-locked to an anchor time
     */
    INTERVAL("interval");

    private final String code;

    public static TriggerKind fromCode(String code) {
        for (var kind : values()) {
            if (kind.getCode().equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown trigger kind: " + code);
    }
}
