package com.example.reportscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Types of recurring jobs a schedule can run.
 * Each job type maps to exactly one handler implementation.
 */
@Getter
@RequiredArgsConstructor
public enum JobType {

    /**
     * Tip report for all employees over a date range
     */
    TIP_REPORT("tip_report", "Tip Report", true),

    /**
     * Consolidated daily balance report over a date range
     */
    DAILY_BALANCE_REPORT("daily_balance_report", "Daily Balance Report", true),

    /**
     * Tip report for a single employee, requires an employee reference
     */
    EMPLOYEE_TIP_REPORT("employee_tip_report", "Employee Tip Report", true),

    /**
     * Snapshot of the application database
     */
    BACKUP("backup", "Database Backup", false);

    private final String code;
    private final String displayName;

    /**
     * Whether the job produces a report over a date range
     */
    private final boolean report;

    /**
     * Find JobType by its code value
     */
    public static JobType fromCode(String code) {
        for (var type : values()) {
            if (type.getCode().equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown job type code: " + code);
    }

    public boolean requiresEmployee() {
        return this == EMPLOYEE_TIP_REPORT;
    }
}
