package com.example.reportscheduler.config;

import com.example.reportscheduler.domain.enums.ExecutionStatus;
import com.example.reportscheduler.domain.enums.JobType;
import com.example.reportscheduler.domain.repository.ScheduledTaskRepository;
import com.example.reportscheduler.domain.repository.SchedulerJobRepository;
import com.example.reportscheduler.domain.repository.TaskExecutionRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics configuration for monitoring scheduler health and performance.
 * <p>
 * Exposes Prometheus metrics for:
 * - Executions by status
 * - Active schedules and installed jobs
 * - Fires, misfires and suppressed overlaps
 * - Commit retries and ledger failures
 * - Execution times
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final ScheduledTaskRepository scheduleRepository;
    private final TaskExecutionRepository executionRepository;
    private final SchedulerJobRepository jobRepository;

    private final ConcurrentHashMap<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (var status : ExecutionStatus.values()) {
            var key = "status_" + status.getCode();
            gaugeValues.put(key, new AtomicLong(0));

            Gauge.builder("report_scheduler_executions", gaugeValues.get(key), AtomicLong::get)
                    .tag("status", status.getCode())
                    .description("Number of recorded executions by status")
                    .register(meterRegistry);
        }

        gaugeValues.put("active_schedules", new AtomicLong(0));
        Gauge.builder("report_scheduler_active_schedules", gaugeValues.get("active_schedules"), AtomicLong::get)
                .description("Number of active schedules")
                .register(meterRegistry);

        gaugeValues.put("installed_jobs", new AtomicLong(0));
        Gauge.builder("report_scheduler_installed_jobs", gaugeValues.get("installed_jobs"), AtomicLong::get)
                .description("Number of triggers installed in the scheduler")
                .register(meterRegistry);
    }

    /**
     * Periodically update gauge metrics from database
     */
    @Scheduled(fixedDelayString = "${task-scheduler.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            for (var status : ExecutionStatus.values()) {
                gaugeValues.get("status_" + status.getCode()).set(executionRepository.countByStatus(status));
            }
            gaugeValues.get("active_schedules").set(scheduleRepository.countByActiveTrue());
            gaugeValues.get("installed_jobs").set(jobRepository.count());
        } catch (RuntimeException e) {
            log.warn("Could not refresh scheduler gauges: {}", e.getMessage());
        }
    }

    public Timer.Sample startExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordExecution(Timer.Sample sample, JobType jobType, boolean success) {
        sample.stop(Timer.builder("report_scheduler_execution_time")
                .tag("type", jobType.getCode())
                .tag("success", String.valueOf(success))
                .description("Job execution time")
                .register(meterRegistry));
    }

    public void recordFire(JobType jobType) {
        meterRegistry.counter("report_scheduler_fires", "type", jobType.getCode()).increment();
    }

    public void recordMisfire(JobType jobType) {
        meterRegistry.counter("report_scheduler_misfires", "type", jobType.getCode()).increment();
    }

    public void recordSuppressedOverlap(JobType jobType) {
        meterRegistry.counter("report_scheduler_suppressed_overlaps", "type", jobType.getCode()).increment();
    }

    public void recordRejectedSubmission(JobType jobType) {
        meterRegistry.counter("report_scheduler_rejected_submissions", "type", jobType.getCode()).increment();
    }

    public void recordCommitRetry() {
        meterRegistry.counter("report_scheduler_commit_retries").increment();
    }

    public void recordVerificationFallback() {
        meterRegistry.counter("report_scheduler_verification_fallbacks").increment();
    }

    public void recordLedgerFailure(String operation) {
        meterRegistry.counter("report_scheduler_ledger_failures",
                "operation", operation != null ? operation : "unknown"
        ).increment();
    }
}
