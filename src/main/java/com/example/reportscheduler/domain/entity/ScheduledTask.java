package com.example.reportscheduler.domain.entity;

import com.example.reportscheduler.domain.enums.DateRangeKind;
import com.example.reportscheduler.domain.enums.JobType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Persisted definition of a recurring job: what to run and when.
 * <p>
 * next_run_at mirrors the trigger scheduler's live value and is re-synced on every administrative read.
 */
@Entity
@Table(name = "scheduled_tasks", indexes = {
        @Index(name = "idx_schedule_active", columnList = "is_active"),
        @Index(name = "idx_schedule_job_type", columnList = "job_type")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduledTask {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    /**
     * Type of job to run - determines which handler processes it
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false, length = 50)
    private JobType jobType;

    @Embedded
    private TriggerDefinition trigger;

    /**
     * Reporting window, null for backups
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "date_range_kind", length = 30)
    private DateRangeKind dateRangeKind;

    /**
     * Explicit recipients, order preserved
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "recipients")
    @Builder.Default
    private List<String> recipients = new ArrayList<>();

    /**
     * Send only to the explicit recipients, ignoring opted-in subscribers
     */
    @Column(name = "bypass_opt_in", nullable = false)
    @Builder.Default
    private boolean bypassOptIn = false;

    @Column(name = "attach_artifact", nullable = false)
    @Builder.Default
    private boolean attachArtifact = true;

    /**
     * Employee the report is generated for, only for employee tip reports
     */
    @Column(name = "employee_ref", length = 100)
    private String employeeRef;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Column(name = "next_run_at")
    private Instant nextRunAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.recipients == null) {
            this.recipients = new ArrayList<>();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // === Helper Methods ===

    public String getTimezone() {
        return trigger != null ? trigger.getTimezone() : null;
    }
}
