package com.example.reportscheduler.domain.repository;

import com.example.reportscheduler.domain.entity.SchedulerJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for the trigger scheduler's job table
 */
@Repository
public interface SchedulerJobRepository extends JpaRepository<SchedulerJob, UUID> {

    /**
     * Jobs whose next fire time has been reached, earliest first
     */
    @Query("""
            SELECT j FROM SchedulerJob j
            WHERE j.nextFireTime IS NOT NULL
              AND j.nextFireTime <= :now
            ORDER BY j.nextFireTime
            """)
    List<SchedulerJob> findDue(@Param("now") Instant now);

    List<SchedulerJob> findAllByOrderByNextFireTimeAsc();

    /**
     * Move a fired job to its next fire time.
     * Matches nothing when the job was uninstalled or reinstalled since it was read.
     */
    @Modifying
    @Query("""
            UPDATE SchedulerJob j
            SET j.nextFireTime = :next, j.lastFireTime = :fired, j.updatedAt = :now, j.version = j.version + 1
            WHERE j.id = :id AND j.nextFireTime = :expected
            """)
    int advance(@Param("id") UUID id, @Param("expected") Instant expected, @Param("next") Instant next,
                @Param("fired") Instant fired, @Param("now") Instant now);

    /**
     * Move a job to a new fire time without recording a fire, used for misfires
     */
    @Modifying
    @Query("""
            UPDATE SchedulerJob j
            SET j.nextFireTime = :next, j.updatedAt = :now, j.version = j.version + 1
            WHERE j.id = :id AND j.nextFireTime = :expected
            """)
    int reschedule(@Param("id") UUID id, @Param("expected") Instant expected, @Param("next") Instant next,
                   @Param("now") Instant now);
}
