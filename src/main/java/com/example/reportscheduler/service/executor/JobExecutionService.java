package com.example.reportscheduler.service.executor;

import com.example.reportscheduler.config.MetricsConfig;
import com.example.reportscheduler.domain.enums.JobType;
import com.example.reportscheduler.domain.repository.ScheduledTaskRepository;
import com.example.reportscheduler.service.alert.SlackAlertService;
import com.example.reportscheduler.service.handler.JobContext;
import com.example.reportscheduler.service.handler.JobHandlerRegistry;
import com.example.reportscheduler.service.handler.JobResult;
import com.example.reportscheduler.service.ledger.CommitRetryExecutor;
import com.example.reportscheduler.service.ledger.ExecutionLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;

/**
 * Service responsible for running one fire of a schedule.
 * <p>
 * Handles:
 * - Recording the execution start and its terminal status
 * - Handler invocation
 * - last_run_at update after a success
 * - Metrics recording
 * - Alert triggering for failures
 * <p>
 * Never throws: whatever goes wrong is logged, so the worker thread and the timing loop are unaffected.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobExecutionService {

    private final JobHandlerRegistry handlerRegistry;
    private final ExecutionLedger executionLedger;
    private final ScheduledTaskRepository scheduleRepository;
    private final CommitRetryExecutor commitRetryExecutor;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;

    /**
     * Run a job with full lifecycle management
     *
     * @return true if the job body succeeded
     */
    public boolean run(JobContext context) {
        var scheduleId = context.getScheduleId();

        UUID executionId;
        try {
            executionId = executionLedger.recordStart(scheduleId);
        } catch (RuntimeException e) {
            log.error("Could not record start of schedule {} ('{}'), run skipped: {}", scheduleId, context.getName(), e.getMessage());
            return false;
        }

        log.info("Starting execution {} of schedule {} (type: {}, name: '{}')",
                executionId, scheduleId, context.getJobType(), context.getName());

        var timerSample = metricsConfig.startExecutionTimer();
        var startTime = Instant.now();

        JobResult result;
        try {
            var handler = handlerRegistry.getHandlerOrThrow(context.getJobType());
            result = handler.execute(context);
            if (result == null) {
                result = JobResult.failure("Handler returned no result");
            }
        } catch (Exception e) {
            log.error("Execution {} of schedule {} threw: {}", executionId, scheduleId, e.getMessage(), e);
            result = JobResult.failure(e);
        }

        var durationMs = Instant.now().toEpochMilli() - startTime.toEpochMilli();
        metricsConfig.recordExecution(timerSample, context.getJobType(), result.isSuccess());

        if (result.isSuccess()) {
            handleSuccess(context, executionId, result, durationMs);
        } else {
            handleFailure(context, executionId, result, durationMs);
        }
        return result.isSuccess();
    }

    /**
     * Record a fire whose stored arguments could not be turned into a job context as a failed execution
     */
    public void recordUnrunnable(UUID scheduleId, JobType jobType, String errorMessage) {
        try {
            var executionId = executionLedger.recordStart(scheduleId);
            executionLedger.recordFailure(executionId, errorMessage);
        } catch (RuntimeException e) {
            log.error("Unrunnable fire of schedule {} could not be recorded: {}", scheduleId, e.getMessage());
        }
        slackAlertService.sendJobFailureAlert(scheduleId, "schedule " + scheduleId, jobType, errorMessage);
    }

    private void handleSuccess(JobContext context, UUID executionId, JobResult result, long durationMs) {
        log.info("Execution {} of schedule {} completed successfully in {}ms", executionId, context.getScheduleId(), durationMs);

        try {
            executionLedger.recordSuccess(executionId, result.getSummary());
        } catch (RuntimeException e) {
            // the job's side effects already happened, only the record is missing
            log.error("Success of execution {} could not be recorded: {}", executionId, e.getMessage());
            return;
        }

        try {
            var now = Instant.now();
            commitRetryExecutor.commitWithRetry("recordRun",
                    () -> scheduleRepository.updateLastRunAt(context.getScheduleId(), now));
        } catch (RuntimeException e) {
            log.warn("Could not update last run of schedule {}: {}", context.getScheduleId(), e.getMessage());
        }
    }

    private void handleFailure(JobContext context, UUID executionId, JobResult result, long durationMs) {
        log.warn("Execution {} of schedule {} failed after {}ms: {}",
                executionId, context.getScheduleId(), durationMs, result.getErrorMessage());

        try {
            executionLedger.recordFailure(executionId, result.getErrorMessage());
        } catch (RuntimeException e) {
            log.error("Failure of execution {} could not be recorded: {}", executionId, e.getMessage());
        }

        slackAlertService.sendJobFailureAlert(context.getScheduleId(), context.getName(), context.getJobType(),
                result.getErrorMessage());
    }
}
