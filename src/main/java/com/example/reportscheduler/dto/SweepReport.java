package com.example.reportscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * What a consistency sweep found and repaired
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SweepReport {

    private String trigger;
    private Instant startedAt;
    private long durationMs;

    private int orphansRemoved;
    private int triggersReinstalled;
    private int staleJobsRemoved;
    private int stuckExecutionsFailed;

    /**
     * Number of persisted schedules, left unchanged by the sweep
     */
    private long scheduleCount;

    /**
     * Steps that failed, the sweep carries on past them
     */
    @Builder.Default
    private List<String> failures = new ArrayList<>();

    public boolean isClean() {
        return failures.isEmpty();
    }
}
