package com.example.reportscheduler.domain.entity;

import com.example.reportscheduler.domain.enums.ExecutionStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One execution attempt of a schedule.
 * Created RUNNING at fire time and moved to a terminal status exactly once.
 */
@Entity
@Table(name = "task_executions", indexes = {
        @Index(name = "idx_execution_schedule_started", columnList = "schedule_id, started_at"),
        @Index(name = "idx_execution_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Reference to the schedule, without a database foreign key
     */
    @Column(name = "schedule_id", nullable = false)
    private UUID scheduleId;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    /**
     * Null while running
     */
    @Column(name = "completed_at")
    private Instant completedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ExecutionStatus status;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result_summary")
    private Map<String, Object> resultSummary;

    public boolean isRunning() {
        return status == ExecutionStatus.RUNNING;
    }

    /**
     * Duration in milliseconds, null while running
     */
    public Long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
