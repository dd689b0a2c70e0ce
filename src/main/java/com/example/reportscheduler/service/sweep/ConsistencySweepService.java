package com.example.reportscheduler.service.sweep;

import com.example.reportscheduler.config.TaskSchedulerProperties;
import com.example.reportscheduler.domain.entity.ScheduledTask;
import com.example.reportscheduler.domain.repository.ScheduledTaskRepository;
import com.example.reportscheduler.domain.repository.TaskExecutionRepository;
import com.example.reportscheduler.dto.SweepReport;
import com.example.reportscheduler.service.ledger.CommitRetryExecutor;
import com.example.reportscheduler.service.ledger.ExecutionLedger;
import com.example.reportscheduler.service.scheduler.TriggerSchedulerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reconciles persisted schedules, installed triggers and the execution ledger.
 * <p>
 * Runs once at startup before the trigger loop starts, then periodically and on demand.
 * Each step is independent: a failing step is recorded in the report and the sweep carries on.
 * Schedules themselves are never modified apart from their next_run_at.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConsistencySweepService {

    static final String INTERRUPTED_MESSAGE = "Execution interrupted by process restart";

    private final ScheduledTaskRepository scheduleRepository;
    private final TaskExecutionRepository executionRepository;
    private final TriggerSchedulerService triggerScheduler;
    private final ExecutionLedger executionLedger;
    private final CommitRetryExecutor commitRetryExecutor;
    private final TaskSchedulerProperties properties;

    /**
     * Running rows older than this were started by a previous process
     */
    private final Instant processStartedAt = Instant.now();

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        sweep("startup");

        if (properties.isAutoStart()) {
            triggerScheduler.start();
        } else {
            log.info("Trigger loop auto start disabled");
        }
    }

    @Scheduled(fixedDelayString = "${task-scheduler.sweep-interval-ms:3600000}",
            initialDelayString = "${task-scheduler.sweep-interval-ms:3600000}")
    @SchedulerLock(name = "consistencySweep", lockAtLeastFor = "10s", lockAtMostFor = "10m")
    public void scheduledSweep() {
        sweep("periodic");
    }

    /**
     * Run all repair steps once
     */
    public SweepReport sweep(String trigger) {
        var startedAt = Instant.now();
        var report = SweepReport.builder().trigger(trigger).startedAt(startedAt).build();
        log.info("Starting {} consistency sweep", trigger);

        // Executions whose schedule is gone
        try {
            report.setOrphansRemoved(commitRetryExecutor.commitWithRetry("deleteOrphans", executionRepository::deleteOrphans));
        } catch (RuntimeException e) {
            fail(report, "deleteOrphans", e);
        }

        // Snapshot installed jobs before reading schedules so a concurrent create is seen in the store
        var installedJobs = triggerScheduler.installedJobs();
        var schedules = scheduleRepository.findAll().stream()
                .collect(Collectors.toMap(ScheduledTask::getId, Function.identity()));
        report.setScheduleCount(schedules.size());

        // Every active schedule has its trigger installed
        for (var listed : schedules.values()) {
            if (!listed.isActive()) {
                continue;
            }
            try {
                // Deleted or toggled off since the listing
                var current = scheduleRepository.findById(listed.getId()).filter(ScheduledTask::isActive);
                if (current.isEmpty()) {
                    continue;
                }
                var schedule = current.get();
                var next = triggerScheduler.install(schedule).orElse(null);
                if (!Objects.equals(next, schedule.getNextRunAt())) {
                    commitRetryExecutor.commitWithRetry("syncNextRun",
                            () -> scheduleRepository.updateNextRunAt(schedule.getId(), next));
                }
                report.setTriggersReinstalled(report.getTriggersReinstalled() + 1);
            } catch (RuntimeException e) {
                fail(report, "install " + listed.getId(), e);
            }
        }

        // No trigger outlives its schedule or stays installed while inactive
        for (var job : installedJobs) {
            var schedule = schedules.get(job.getId());
            if (schedule != null && schedule.isActive()) {
                continue;
            }
            try {
                // Created or toggled on since the listing
                if (scheduleRepository.findById(job.getId()).filter(ScheduledTask::isActive).isPresent()) {
                    continue;
                }
                if (triggerScheduler.uninstall(job.getId())) {
                    report.setStaleJobsRemoved(report.getStaleJobsRemoved() + 1);
                }
            } catch (RuntimeException e) {
                fail(report, "uninstall " + job.getId(), e);
            }
        }

        // Runs left behind by a crash or hard stop
        try {
            for (var execution : executionRepository.findRunningStartedBefore(processStartedAt)) {
                try {
                    executionLedger.recordFailure(execution.getId(), INTERRUPTED_MESSAGE);
                    report.setStuckExecutionsFailed(report.getStuckExecutionsFailed() + 1);
                } catch (RuntimeException e) {
                    fail(report, "failStuck " + execution.getId(), e);
                }
            }
        } catch (RuntimeException e) {
            fail(report, "findStuck", e);
        }

        report.setDurationMs(Duration.between(startedAt, Instant.now()).toMillis());
        log.info("Consistency sweep finished in {}ms: {} orphan(s) removed, {} trigger(s) installed, {} stale job(s) removed, {} stuck execution(s) failed, {} failure(s)",
                report.getDurationMs(), report.getOrphansRemoved(), report.getTriggersReinstalled(),
                report.getStaleJobsRemoved(), report.getStuckExecutionsFailed(), report.getFailures().size());
        return report;
    }

    Instant getProcessStartedAt() {
        return processStartedAt;
    }

    private void fail(SweepReport report, String step, RuntimeException e) {
        log.error("Consistency sweep step {} failed: {}", step, e.getMessage(), e);
        report.getFailures().add(step + ": " + e.getMessage());
    }
}
