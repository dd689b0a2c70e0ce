package com.example.reportscheduler.dto;

import com.example.reportscheduler.domain.enums.DateRangeKind;
import com.example.reportscheduler.domain.enums.JobType;
import com.example.reportscheduler.domain.enums.TriggerKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for schedule data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleResponse {

    private UUID id;
    private String name;
    private JobType jobType;
    private TriggerKind triggerKind;
    private String cronExpression;
    private String intervalUnit;
    private Integer intervalValue;
    private LocalDateTime anchorTime;
    private String timezone;

    /**
     * Human readable trigger, e.g. cron[0 9 * * 1]
     */
    private String triggerDescription;

    private DateRangeKind dateRangeKind;
    private List<String> recipients;
    private boolean bypassOptIn;
    private boolean attachArtifact;
    private String employeeRef;
    private boolean active;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastRunAt;
    private Instant nextRunAt;

    /**
     * Most recent executions, newest first
     */
    private List<TaskExecutionResponse> recentExecutions;
}
