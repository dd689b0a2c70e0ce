package com.example.reportscheduler.dto;

import com.example.reportscheduler.domain.enums.JobType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Installed triggers compared against the persisted schedules, for troubleshooting
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStateDump {

    private boolean schedulerRunning;
    private String defaultTimezone;
    private Instant generatedAt;
    private List<UUID> inFlight;
    private List<JobState> jobs;

    /**
     * Active schedules with no installed trigger
     */
    private List<UUID> activeSchedulesWithoutJob;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class JobState {
        private UUID scheduleId;
        private String jobKey;
        private JobType jobType;
        private String trigger;
        private Instant nextFireTime;
        private Instant lastFireTime;
        private boolean scheduleExists;
        private boolean scheduleActive;
        private Instant persistedNextRunAt;

        /**
         * Whether the persisted next_run_at agrees with the scheduler
         */
        private boolean inSync;
    }
}
