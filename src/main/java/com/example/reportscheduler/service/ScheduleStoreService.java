package com.example.reportscheduler.service;

import com.example.reportscheduler.domain.entity.ScheduledTask;
import com.example.reportscheduler.domain.entity.TriggerDefinition;
import com.example.reportscheduler.domain.enums.JobType;
import com.example.reportscheduler.domain.repository.ScheduledTaskRepository;
import com.example.reportscheduler.domain.repository.TaskExecutionRepository;
import com.example.reportscheduler.dto.PreviewResponse;
import com.example.reportscheduler.dto.ScheduleRequest;
import com.example.reportscheduler.dto.ScheduleResponse;
import com.example.reportscheduler.dto.SchedulerStateDump;
import com.example.reportscheduler.dto.TaskExecutionResponse;
import com.example.reportscheduler.dto.TriggerPreviewRequest;
import com.example.reportscheduler.exception.ScheduleNotFoundException;
import com.example.reportscheduler.exception.ScheduleValidationException;
import com.example.reportscheduler.mapper.ScheduleMapper;
import com.example.reportscheduler.service.ledger.CommitRetryExecutor;
import com.example.reportscheduler.service.ledger.ExecutionLedger;
import com.example.reportscheduler.service.scheduler.TriggerSchedulerService;
import com.example.reportscheduler.service.trigger.TriggerCalculator;
import com.example.reportscheduler.service.trigger.TriggerSpec;
import com.example.reportscheduler.service.trigger.TriggerSpecValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service for managing schedule definitions.
 * <p>
 * Provides:
 * - Validated creation and replacement of schedules
 * - Activation toggling and deletion, kept in step with the trigger scheduler
 * - Listing with recent executions and a live next run time
 * - Trigger previews and a scheduler state dump
 * <p>
 * Every write goes through the commit retry layer in a transaction of its own.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleStoreService {

    static final int RECENT_EXECUTIONS = 5;
    static final int MAX_PREVIEW_COUNT = 50;
    static final String PREVIEW_FAILED = "Could not calculate schedule. Please check your schedule settings.";

    private final ScheduledTaskRepository scheduleRepository;
    private final TaskExecutionRepository executionRepository;
    private final ExecutionLedger executionLedger;
    private final TriggerSchedulerService triggerScheduler;
    private final TriggerSpecValidator triggerSpecValidator;
    private final TriggerCalculator triggerCalculator;
    private final CommitRetryExecutor commitRetryExecutor;
    private final ScheduleMapper scheduleMapper;

    // === Schedule Changes ===

    /**
     * Create a schedule and install its trigger when active
     *
     * @throws ScheduleValidationException when the definition is invalid, nothing is written
     */
    public ScheduleResponse create(ScheduleRequest request) {
        log.info("Creating {} schedule '{}'", request.getJobType(), request.getName());

        var spec = validate(request);
        var nextRun = firstRun(spec);

        var task = commitRetryExecutor.commitWithRetry("createSchedule", () -> {
            var entity = ScheduledTask.builder().build();
            apply(entity, request, spec);
            entity.setNextRunAt(request.isActive() ? nextRun : null);
            return scheduleRepository.save(entity);
        });

        if (task.isActive()) {
            installTrigger(task);
        }

        log.info("Created schedule {} '{}' ({})", task.getId(), task.getName(), task.getTrigger().describe());
        return toResponse(task);
    }

    /**
     * Replace a schedule's definition and reinstall its trigger
     */
    public ScheduleResponse update(UUID scheduleId, ScheduleRequest request) {
        log.info("Updating schedule {}", scheduleId);

        var spec = validate(request);
        var nextRun = firstRun(spec);

        var task = commitRetryExecutor.commitWithRetry("updateSchedule", () -> {
            var entity = scheduleRepository.findById(scheduleId).orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
            apply(entity, request, spec);
            entity.setNextRunAt(request.isActive() ? nextRun : null);
            return scheduleRepository.save(entity);
        });

        triggerScheduler.uninstall(scheduleId);
        if (task.isActive()) {
            installTrigger(task);
        }

        return toResponse(task);
    }

    /**
     * Flip a schedule between active and inactive. Execution history is untouched.
     */
    public ScheduleResponse toggle(UUID scheduleId) {
        var task = commitRetryExecutor.commitWithRetry("toggleSchedule", () -> {
            var entity = scheduleRepository.findById(scheduleId).orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
            entity.setActive(!entity.isActive());
            entity.setNextRunAt(entity.isActive() ? firstRun(entity.getTrigger().toSpec()) : null);
            return scheduleRepository.save(entity);
        });

        if (task.isActive()) {
            installTrigger(task);
        } else {
            triggerScheduler.uninstall(scheduleId);
        }

        log.info("Schedule {} is now {}", scheduleId, task.isActive() ? "active" : "inactive");
        return toResponse(task);
    }

    /**
     * Remove a schedule's trigger, then the schedule and its executions in one transaction.
     * An execution still running keeps going and is left for the consistency sweep.
     */
    public void delete(UUID scheduleId) {
        if (!scheduleRepository.existsById(scheduleId)) {
            throw new ScheduleNotFoundException(scheduleId);
        }

        triggerScheduler.uninstall(scheduleId);

        var removedExecutions = commitRetryExecutor.commitWithRetry("deleteSchedule", () -> {
            var removed = executionRepository.deleteByScheduleId(scheduleId);
            scheduleRepository.deleteById(scheduleId);
            return removed;
        });

        log.info("Deleted schedule {} with {} execution(s)", scheduleId, removedExecutions);
    }

    // === Schedule Retrieval ===

    /**
     * All schedules, newest first, each with its most recent executions
     */
    public List<ScheduleResponse> list() {
        return scheduleRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(this::syncNextRun)
                .map(this::toResponse)
                .toList();
    }

    public ScheduleResponse get(UUID scheduleId) {
        var task = scheduleRepository.findById(scheduleId).orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
        return toResponse(syncNextRun(task));
    }

    /**
     * Most recent executions of a schedule, newest first
     */
    public List<TaskExecutionResponse> executions(UUID scheduleId, int limit) {
        if (!scheduleRepository.existsById(scheduleId)) {
            throw new ScheduleNotFoundException(scheduleId);
        }
        return scheduleMapper.toExecutionResponses(executionLedger.recentExecutions(scheduleId, Math.max(limit, 1)));
    }

    /**
     * Next fire times of a candidate trigger
     *
     * @throws ScheduleValidationException when the trigger is invalid or never fires
     */
    public PreviewResponse preview(TriggerPreviewRequest request, int count) {
        var spec = triggerSpecValidator.validate(request.getTriggerKind(), request.getCronExpression(),
                request.getIntervalUnit(), request.getIntervalValue(), request.getAnchorTime(), request.getTimezone());

        var runs = triggerCalculator.computeNextRuns(spec, Instant.now(), Math.min(Math.max(count, 1), MAX_PREVIEW_COUNT));
        if (runs.isEmpty()) {
            throw new ScheduleValidationException(PREVIEW_FAILED);
        }

        return PreviewResponse.builder()
                .timezone(runs.get(0).getZone().getId())
                .nextRuns(runs)
                .build();
    }

    /**
     * Installed triggers side by side with the persisted schedules
     */
    public SchedulerStateDump debugDump() {
        var schedules = scheduleRepository.findAll().stream()
                .collect(Collectors.toMap(ScheduledTask::getId, Function.identity()));
        var jobs = triggerScheduler.installedJobs();
        var installed = new HashSet<UUID>();

        var states = new ArrayList<SchedulerStateDump.JobState>();
        for (var job : jobs) {
            installed.add(job.getId());
            var schedule = schedules.get(job.getId());
            states.add(SchedulerStateDump.JobState.builder()
                    .scheduleId(job.getId())
                    .jobKey("task_" + job.getId())
                    .jobType(job.getJobType())
                    .trigger(job.getTrigger().describe())
                    .nextFireTime(job.getNextFireTime())
                    .lastFireTime(job.getLastFireTime())
                    .scheduleExists(schedule != null)
                    .scheduleActive(schedule != null && schedule.isActive())
                    .persistedNextRunAt(schedule != null ? schedule.getNextRunAt() : null)
                    .inSync(schedule != null && Objects.equals(schedule.getNextRunAt(), job.getNextFireTime()))
                    .build());
        }

        var missing = schedules.values().stream()
                .filter(ScheduledTask::isActive)
                .map(ScheduledTask::getId)
                .filter(id -> !installed.contains(id))
                .toList();

        return SchedulerStateDump.builder()
                .schedulerRunning(triggerScheduler.isRunning())
                .defaultTimezone(triggerCalculator.getDefaultZone().getId())
                .generatedAt(Instant.now())
                .inFlight(List.copyOf(triggerScheduler.inFlightSchedules()))
                .jobs(states)
                .activeSchedulesWithoutJob(missing)
                .build();
    }

    /**
     * Align the persisted next_run_at with the scheduler's live value, writing only on change
     */
    ScheduledTask syncNextRun(ScheduledTask task) {
        var live = task.isActive() ? triggerScheduler.getNextFireTime(task.getId()).orElse(null) : null;
        if (!Objects.equals(live, task.getNextRunAt())) {
            try {
                commitRetryExecutor.commitWithRetry("syncNextRun", () -> scheduleRepository.updateNextRunAt(task.getId(), live));
                task.setNextRunAt(live);
            } catch (RuntimeException e) {
                log.warn("Could not sync next run of schedule {}: {}", task.getId(), e.getMessage());
            }
        }
        return task;
    }

    // === Helper Methods ===

    private TriggerSpec validate(ScheduleRequest request) {
        var errors = new ArrayList<String>();
        TriggerSpec spec = null;
        try {
            spec = triggerSpecValidator.validate(request.getTriggerKind(), request.getCronExpression(),
                    request.getIntervalUnit(), request.getIntervalValue(), request.getAnchorTime(), request.getTimezone());
        } catch (ScheduleValidationException e) {
            errors.addAll(e.getErrors());
        }

        var jobType = request.getJobType();
        if (jobType == null) {
            errors.add("jobType: is required");
        } else {
            if (jobType.isReport() && request.getDateRangeKind() == null) {
                errors.add("dateRangeKind: is required for " + jobType.getDisplayName());
            }
            if (jobType.requiresEmployee() && (request.getEmployeeRef() == null || request.getEmployeeRef().isBlank())) {
                errors.add("employeeRef: is required for " + jobType.getDisplayName());
            }
        }

        if (!errors.isEmpty()) {
            throw new ScheduleValidationException(errors);
        }
        return spec;
    }

    private void apply(ScheduledTask entity, ScheduleRequest request, TriggerSpec spec) {
        var jobType = request.getJobType();
        entity.setName(request.getName().trim());
        entity.setJobType(jobType);
        if (entity.getTrigger() == null) {
            entity.setTrigger(TriggerDefinition.of(spec));
        } else {
            entity.getTrigger().apply(spec);
        }
        entity.setDateRangeKind(jobType.isReport() ? request.getDateRangeKind() : null);
        entity.setRecipients(request.getRecipients() != null ? new ArrayList<>(request.getRecipients()) : new ArrayList<>());
        entity.setBypassOptIn(request.isBypassOptIn());
        entity.setAttachArtifact(request.isAttachArtifact());
        entity.setEmployeeRef(jobType == JobType.EMPLOYEE_TIP_REPORT ? request.getEmployeeRef().trim() : null);
        entity.setActive(request.isActive());
    }

    private Instant firstRun(TriggerSpec spec) {
        return triggerCalculator.nextRun(spec, Instant.now()).map(ZonedDateTime::toInstant).orElse(null);
    }

    /**
     * Install a trigger, leaving a failure for the next consistency sweep to repair
     */
    private void installTrigger(ScheduledTask task) {
        try {
            triggerScheduler.install(task);
            syncNextRun(task);
        } catch (RuntimeException e) {
            log.error("Could not install trigger of schedule {}, the next sweep will retry: {}", task.getId(), e.getMessage());
        }
    }

    private ScheduleResponse toResponse(ScheduledTask task) {
        var response = scheduleMapper.toResponse(task);
        response.setRecentExecutions(scheduleMapper.toExecutionResponses(
                executionLedger.recentExecutions(task.getId(), RECENT_EXECUTIONS)));
        return response;
    }
}
