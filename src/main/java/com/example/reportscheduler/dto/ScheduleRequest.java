package com.example.reportscheduler.dto;

import com.example.reportscheduler.domain.enums.DateRangeKind;
import com.example.reportscheduler.domain.enums.JobType;
import com.example.reportscheduler.domain.enums.TriggerKind;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for creating or replacing a schedule
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 200)
    private String name;

    @NotNull(message = "Job type is required")
    private JobType jobType;

    @NotNull(message = "Trigger kind is required")
    private TriggerKind triggerKind;

    /**
     * Five fields: minute hour day month weekday, for cron triggers
     */
    private String cronExpression;

    /**
     * minutes, hours, days or weeks, for interval triggers
     */
    private String intervalUnit;

    private Integer intervalValue;

    /**
     * Optional phase anchor of an interval trigger, wall-clock time in {@link #timezone}
     */
    private LocalDateTime anchorTime;

    /**
     * IANA zone id, the service default when omitted
     */
    private String timezone;

    /**
     * Required for report job types
     */
    private DateRangeKind dateRangeKind;

    @Builder.Default
    private List<@Email(message = "Recipient must be a valid email address") String> recipients = new ArrayList<>();

    private boolean bypassOptIn;

    @Builder.Default
    private boolean attachArtifact = true;

    /**
     * Required for employee tip reports
     */
    private String employeeRef;

    @Builder.Default
    private boolean active = true;
}
