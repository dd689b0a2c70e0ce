package com.example.reportscheduler.service.scheduler;

import com.example.reportscheduler.config.MetricsConfig;
import com.example.reportscheduler.config.TaskSchedulerProperties;
import com.example.reportscheduler.domain.entity.ScheduledTask;
import com.example.reportscheduler.domain.entity.SchedulerJob;
import com.example.reportscheduler.domain.entity.TriggerDefinition;
import com.example.reportscheduler.domain.enums.JobType;
import com.example.reportscheduler.domain.repository.SchedulerJobRepository;
import com.example.reportscheduler.service.executor.JobExecutionService;
import com.example.reportscheduler.service.handler.JobContext;
import com.example.reportscheduler.service.handler.JobHandlerRegistry;
import com.example.reportscheduler.service.ledger.CommitRetryExecutor;
import com.example.reportscheduler.service.trigger.IntervalSpec;
import com.example.reportscheduler.service.trigger.TriggerCalculator;
import com.example.reportscheduler.service.trigger.TriggerSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Durable trigger scheduler.
 * <p>
 * Installed triggers live in the scheduler_jobs table and survive restarts. A single-threaded
 * loop picks up due jobs every tick and hands them to the bounded worker pool:
 * - A fire later than the misfire grace window is skipped, never run twice
 * - At most one execution per schedule is in flight, overlapping fires are suppressed
 * - The job row is advanced before the body is submitted, so a crash loses a fire rather than repeating it
 * <p>
 * Not auto-started: the startup consistency sweep starts the loop once storage is reconciled.
 */
@Slf4j
@Service
public class TriggerSchedulerService implements SmartLifecycle {

    private static final int MAX_INSTALL_ATTEMPTS = 3;

    private final SchedulerJobRepository jobRepository;
    private final TriggerCalculator triggerCalculator;
    private final JobHandlerRegistry handlerRegistry;
    private final JobExecutionService jobExecutionService;
    private final CommitRetryExecutor commitRetryExecutor;
    private final TaskSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final ThreadPoolTaskExecutor workerExecutor;
    private final ThreadPoolTaskScheduler loopScheduler;

    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> loopFuture;

    public TriggerSchedulerService(SchedulerJobRepository jobRepository,
                                   TriggerCalculator triggerCalculator,
                                   JobHandlerRegistry handlerRegistry,
                                   JobExecutionService jobExecutionService,
                                   CommitRetryExecutor commitRetryExecutor,
                                   TaskSchedulerProperties properties,
                                   MetricsConfig metricsConfig,
                                   @Qualifier("jobWorkerExecutor") ThreadPoolTaskExecutor workerExecutor,
                                   @Qualifier("triggerLoopScheduler") ThreadPoolTaskScheduler loopScheduler) {
        this.jobRepository = jobRepository;
        this.triggerCalculator = triggerCalculator;
        this.handlerRegistry = handlerRegistry;
        this.jobExecutionService = jobExecutionService;
        this.commitRetryExecutor = commitRetryExecutor;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.workerExecutor = workerExecutor;
        this.loopScheduler = loopScheduler;
    }

    // === Installation ===

    /**
     * Install or replace the trigger of a schedule from its persisted definition
     *
     * @return the next fire time, empty when the trigger never fires
     */
    public Optional<Instant> install(ScheduledTask schedule) {
        var context = JobContext.of(schedule);
        handlerRegistry.getHandlerOrThrow(schedule.getJobType()).validate(context);
        return install(schedule.getId(), schedule.getTrigger().toSpec(), schedule.getJobType(), context.toArgs());
    }

    /**
     * Install or replace a trigger. Idempotent: reinstalling an unchanged trigger keeps its pending fire time.
     *
     * @throws IllegalArgumentException when no handler is registered for the job type
     */
    public Optional<Instant> install(UUID scheduleId, TriggerSpec trigger, JobType jobType, Map<String, Object> args) {
        handlerRegistry.getHandlerOrThrow(jobType);

        var now = Instant.now();
        SchedulerJob job = null;
        for (var attempt = 1; job == null; attempt++) {
            try {
                job = upsertJob(scheduleId, trigger, jobType, args, now);
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= MAX_INSTALL_ATTEMPTS) {
                    throw e;
                }
                log.debug("Job {} fired while being installed, retrying", scheduleId);
            }
        }

        if (job.getNextFireTime() == null) {
            log.warn("Trigger of schedule {} has no future fire time and will never run", scheduleId);
        } else {
            log.info("Installed trigger for schedule {} ({}), next fire at {}", scheduleId, jobType, job.getNextFireTime());
        }
        return Optional.ofNullable(job.getNextFireTime());
    }

    private SchedulerJob upsertJob(UUID scheduleId, TriggerSpec trigger, JobType jobType, Map<String, Object> args,
                                   Instant now) {
        return commitRetryExecutor.commitWithRetry("install", () -> {
            var existing = jobRepository.findById(scheduleId);
            var unchanged = existing
                    .filter(j -> j.getJobType() == jobType && j.getNextFireTime() != null)
                    .filter(j -> Objects.equals(j.getTrigger().toSpec(), trigger))
                    .isPresent();

            var target = existing.orElseGet(() -> SchedulerJob.builder().id(scheduleId).build());
            target.setJobType(jobType);
            target.setTrigger(TriggerDefinition.of(trigger));
            target.setArgs(args != null ? new HashMap<>(args) : new HashMap<>());
            if (!unchanged) {
                target.setNextFireTime(triggerCalculator.nextRun(trigger, now).map(ZonedDateTime::toInstant).orElse(null));
            }
            return jobRepository.save(target);
        });
    }

    /**
     * Remove a trigger. Running executions are not cancelled.
     *
     * @return true when a trigger was removed
     */
    public boolean uninstall(UUID scheduleId) {
        var removed = commitRetryExecutor.commitWithRetry("uninstall", () -> {
            if (!jobRepository.existsById(scheduleId)) {
                return false;
            }
            jobRepository.deleteById(scheduleId);
            return true;
        });

        if (removed) {
            log.info("Uninstalled trigger for schedule {}", scheduleId);
        }
        return removed;
    }

    /**
     * Live next fire time, empty when not installed or never firing again
     */
    public Optional<Instant> getNextFireTime(UUID scheduleId) {
        return jobRepository.findById(scheduleId).map(SchedulerJob::getNextFireTime);
    }

    public List<SchedulerJob> installedJobs() {
        return jobRepository.findAllByOrderByNextFireTimeAsc();
    }

    public boolean isInFlight(UUID scheduleId) {
        return inFlight.contains(scheduleId);
    }

    public Set<UUID> inFlightSchedules() {
        return Set.copyOf(inFlight);
    }

    // === Timing loop ===

    /**
     * One pass of the timing loop: fire, skip or suppress every due job
     *
     * @return number of jobs submitted to the worker pool
     */
    public int tick(Instant now) {
        var due = jobRepository.findDue(now);
        var submitted = 0;
        for (var job : due) {
            try {
                if (processDue(job, now)) {
                    submitted++;
                }
            } catch (RuntimeException e) {
                log.error("Could not process due job {}: {}", job.getId(), e.getMessage(), e);
            }
        }
        return submitted;
    }

    private boolean processDue(SchedulerJob job, Instant now) {
        var scheduleId = job.getId();
        var dueAt = job.getNextFireTime();
        var next = computeNextFire(job, dueAt, now);

        var lateness = Duration.between(dueAt, now);
        if (lateness.getSeconds() > properties.getMisfireGraceSeconds()) {
            log.warn("Schedule {} missed its fire at {} by {}s, skipping to {}", scheduleId, dueAt, lateness.getSeconds(), next);
            metricsConfig.recordMisfire(job.getJobType());
            commitRetryExecutor.commitWithRetry("reschedule", () -> jobRepository.reschedule(scheduleId, dueAt, next, now));
            return false;
        }

        int updated = commitRetryExecutor.commitWithRetry("advance", () -> jobRepository.advance(scheduleId, dueAt, next, dueAt, now));
        if (updated == 0) {
            log.debug("Job {} changed while firing, skipped", scheduleId);
            return false;
        }

        JobContext context;
        try {
            context = JobContext.fromArgs(scheduleId, job.getJobType(), job.getArgs(), dueAt);
        } catch (RuntimeException e) {
            log.error("Stored arguments of schedule {} are unusable, fire at {} failed: {}", scheduleId, dueAt, e.getMessage(), e);
            jobExecutionService.recordUnrunnable(scheduleId, job.getJobType(), "Invalid job arguments: " + e.getMessage());
            return false;
        }

        if (!inFlight.add(scheduleId)) {
            log.warn("Schedule {} is still running, fire at {} suppressed", scheduleId, dueAt);
            metricsConfig.recordSuppressedOverlap(job.getJobType());
            return false;
        }

        try {
            workerExecutor.execute(() -> runJob(context));
        } catch (TaskRejectedException e) {
            inFlight.remove(scheduleId);
            log.error("Worker pool full, fire of schedule {} at {} dropped", scheduleId, dueAt);
            metricsConfig.recordRejectedSubmission(job.getJobType());
            return false;
        }

        metricsConfig.recordFire(job.getJobType());
        log.debug("Fired schedule {} due at {}, next fire at {}", scheduleId, dueAt, next);
        return true;
    }

    private void runJob(JobContext context) {
        try {
            jobExecutionService.run(context);
        } catch (RuntimeException e) {
            log.error("Job of schedule {} escaped its handler: {}", context.getScheduleId(), e.getMessage(), e);
        } finally {
            inFlight.remove(context.getScheduleId());
        }
    }

    /**
     * Next fire strictly after now. Interval triggers without an anchor keep the phase of the fire that was due.
     */
    private Instant computeNextFire(SchedulerJob job, Instant dueAt, Instant now) {
        var spec = job.getTrigger().toSpec();
        if (spec instanceof IntervalSpec interval && interval.getAnchorTime() == null) {
            var zone = triggerCalculator.resolveZone(interval.getTimezone()).orElse(triggerCalculator.getDefaultZone());
            spec = IntervalSpec.builder()
                    .unit(interval.getUnit())
                    .value(interval.getValue())
                    .anchorTime(dueAt.atZone(zone).toLocalDateTime())
                    .timezone(interval.getTimezone())
                    .build();
        }
        return triggerCalculator.nextRun(spec, now).map(ZonedDateTime::toInstant).orElse(null);
    }

    // === Lifecycle ===

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        loopFuture = loopScheduler.scheduleWithFixedDelay(this::tickSafely, Duration.ofMillis(properties.getTickIntervalMs()));
        log.info("Trigger scheduler started, ticking every {}ms with {} worker(s)",
                properties.getTickIntervalMs(), properties.getWorkerPoolSize());
    }

    /**
     * Stop the loop, then wait for in-flight executions to finish
     */
    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        var future = loopFuture;
        if (future != null) {
            future.cancel(false);
        }

        var deadline = Instant.now().plusSeconds(properties.getShutdownAwaitSeconds());
        while (!inFlight.isEmpty() && Instant.now().isBefore(deadline)) {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        if (inFlight.isEmpty()) {
            log.info("Trigger scheduler stopped");
        } else {
            log.warn("Trigger scheduler stopped with {} execution(s) still running: {}", inFlight.size(), inFlight);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return false;
    }

    private void tickSafely() {
        try {
            tick(Instant.now());
        } catch (RuntimeException e) {
            log.error("Trigger loop tick failed: {}", e.getMessage(), e);
        }
    }
}
