package com.example.reportscheduler.domain.repository;

import com.example.reportscheduler.domain.entity.ScheduledTask;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for ScheduledTask entity
 */
@Repository
public interface ScheduledTaskRepository extends JpaRepository<ScheduledTask, UUID> {

    List<ScheduledTask> findAllByOrderByCreatedAtDesc();

    long countByActiveTrue();

    /**
     * Update last_run_at without touching the rest of the definition
     */
    @Modifying
    @Query("""
            UPDATE ScheduledTask t
            SET t.lastRunAt = :runAt
            WHERE t.id = :id
            """)
    int updateLastRunAt(@Param("id") UUID id, @Param("runAt") Instant runAt);

    /**
     * Update next_run_at without touching the rest of the definition
     */
    @Modifying
    @Query("""
            UPDATE ScheduledTask t
            SET t.nextRunAt = :nextRunAt
            WHERE t.id = :id
            """)
    int updateNextRunAt(@Param("id") UUID id, @Param("nextRunAt") Instant nextRunAt);
}
