package com.example.reportscheduler.service.handler;

import com.example.reportscheduler.domain.enums.JobType;

/**
 * Interface for job handlers.
 * <p>
 * Each job type has exactly one handler implementation. Handlers run the job body only:
 * recording the execution, metrics and alerting are done by the caller.
 */
public interface JobHandler {

    JobType getJobType();

    /**
     * Run the job body. Any exception is turned into a failed execution by the caller.
     */
    JobResult execute(JobContext context) throws Exception;

    /**
     * Check that a context carries what this handler needs (optional override)
     *
     * @throws IllegalArgumentException if validation fails
     */
    default void validate(JobContext context) {
    }
}
