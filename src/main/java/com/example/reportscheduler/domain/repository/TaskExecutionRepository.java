package com.example.reportscheduler.domain.repository;

import com.example.reportscheduler.domain.entity.TaskExecution;
import com.example.reportscheduler.domain.enums.ExecutionStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for TaskExecution entity
 */
@Repository
public interface TaskExecutionRepository extends JpaRepository<TaskExecution, UUID> {

    /**
     * Most recent executions of a schedule, newest first
     */
    List<TaskExecution> findByScheduleIdOrderByStartedAtDesc(UUID scheduleId, Pageable pageable);

    List<TaskExecution> findByScheduleIdAndStatusNotOrderByStartedAtDesc(UUID scheduleId, ExecutionStatus status);

    long countByStatus(ExecutionStatus status);

    /**
     * Executions left running by a process that is no longer alive
     */
    @Query("""
            SELECT e FROM TaskExecution e
            WHERE e.status = com.example.reportscheduler.domain.enums.ExecutionStatus.RUNNING
              AND e.startedAt < :before
            ORDER BY e.startedAt
            """)
    List<TaskExecution> findRunningStartedBefore(@Param("before") Instant before);

    @Modifying
    @Query("""
            DELETE FROM TaskExecution e
            WHERE e.scheduleId = :scheduleId
            """)
    int deleteByScheduleId(@Param("scheduleId") UUID scheduleId);

    /**
     * Delete executions whose schedule no longer exists
     */
    @Modifying
    @Query("""
            DELETE FROM TaskExecution e
            WHERE NOT EXISTS (SELECT 1 FROM ScheduledTask t WHERE t.id = e.scheduleId)
            """)
    int deleteOrphans();

    @Modifying
    @Query("""
            DELETE FROM TaskExecution e
            WHERE e.id IN :ids
            """)
    int deleteByIdIn(@Param("ids") Collection<UUID> ids);
}
