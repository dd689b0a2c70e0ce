package com.example.reportscheduler.domain.entity;

import com.example.reportscheduler.domain.enums.JobType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Installed trigger owned by the trigger scheduler.
 * <p>
 * The id equals the schedule id. Rows are written only by the scheduler, in transactions of their own.
 */
@Entity
@Table(name = "scheduler_jobs", indexes = {
        @Index(name = "idx_scheduler_job_next_fire", columnList = "next_fire_time")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SchedulerJob {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false, length = 50)
    private JobType jobType;

    @Embedded
    private TriggerDefinition trigger;

    /**
     * Arguments handed to the job handler on every fire
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "job_args")
    @Builder.Default
    private Map<String, Object> args = new HashMap<>();

    /**
     * Null when the trigger will never fire again
     */
    @Column(name = "next_fire_time")
    private Instant nextFireTime;

    @Column(name = "last_fire_time")
    private Instant lastFireTime;

    /**
     * Bumped by every write, including the loop's bulk updates
     */
    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public boolean isDue(Instant now) {
        return nextFireTime != null && !nextFireTime.isAfter(now);
    }
}
