package com.example.reportscheduler.controller;

import com.example.reportscheduler.dto.*;
import com.example.reportscheduler.service.ScheduleStoreService;
import com.example.reportscheduler.service.scheduler.TriggerSchedulerService;
import com.example.reportscheduler.service.sweep.ConsistencySweepService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API controller for schedule management.
 * <p>
 * Provides endpoints for:
 * - Creating, replacing, toggling and deleting schedules
 * - Listing schedules with their recent executions
 * - Previewing trigger fire times
 * - Running the consistency sweep and inspecting scheduler state
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/schedules")
@Tag(name = "Schedule Management", description = "APIs for managing report and backup schedules")
public class ScheduleController {

    private final ScheduleStoreService scheduleStoreService;
    private final ConsistencySweepService consistencySweepService;
    private final TriggerSchedulerService triggerSchedulerService;

    // === Schedule Changes ===

    @PostMapping
    @Operation(summary = "Create a schedule", description = "Create a schedule and install its trigger when active")
    @ResponseStatus(HttpStatus.CREATED)
    public ResponseEntity<ApiResponse<ScheduleResponse>> createSchedule(@Valid @RequestBody ScheduleRequest request) {
        log.info("API: Create {} schedule '{}'", request.getJobType(), request.getName());

        var response = scheduleStoreService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Schedule created successfully"));
    }

    @PutMapping("/{scheduleId}")
    @Operation(summary = "Replace a schedule", description = "Replace a schedule's definition and reinstall its trigger")
    public ResponseEntity<ApiResponse<ScheduleResponse>> updateSchedule(
            @Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId,
            @Valid @RequestBody ScheduleRequest request) {
        log.info("API: Update schedule {}", scheduleId);

        var response = scheduleStoreService.update(scheduleId, request);
        return ResponseEntity.ok(ApiResponse.success(response, "Schedule updated successfully"));
    }

    @PostMapping("/{scheduleId}/toggle")
    @Operation(summary = "Toggle a schedule", description = "Activate an inactive schedule or deactivate an active one")
    public ResponseEntity<ApiResponse<ScheduleResponse>> toggleSchedule(@Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId) {
        log.info("API: Toggle schedule {}", scheduleId);

        var response = scheduleStoreService.toggle(scheduleId);
        var message = response.isActive() ? "Schedule activated" : "Schedule deactivated";
        return ResponseEntity.ok(ApiResponse.success(response, message));
    }

    @DeleteMapping("/{scheduleId}")
    @Operation(summary = "Delete a schedule", description = "Delete a schedule together with its execution history")
    public ResponseEntity<ApiResponse<Void>> deleteSchedule(@Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId) {
        log.info("API: Delete schedule {}", scheduleId);

        scheduleStoreService.delete(scheduleId);
        return ResponseEntity.ok(ApiResponse.success(null, "Schedule deleted successfully"));
    }

    // === Schedule Retrieval ===

    @GetMapping
    @Operation(summary = "List schedules", description = "All schedules, newest first, with their recent executions")
    public ResponseEntity<ApiResponse<List<ScheduleResponse>>> listSchedules() {
        return ResponseEntity.ok(ApiResponse.success(scheduleStoreService.list()));
    }

    @GetMapping("/{scheduleId}")
    @Operation(summary = "Get schedule by ID", description = "Retrieve a schedule by its unique identifier")
    public ResponseEntity<ApiResponse<ScheduleResponse>> getSchedule(@Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId) {
        return ResponseEntity.ok(ApiResponse.success(scheduleStoreService.get(scheduleId)));
    }

    @GetMapping("/{scheduleId}/executions")
    @Operation(summary = "Get execution history", description = "Most recent executions of a schedule")
    public ResponseEntity<ApiResponse<List<TaskExecutionResponse>>> getExecutions(
            @Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId,
            @Parameter(description = "Maximum number of executions") @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(ApiResponse.success(scheduleStoreService.executions(scheduleId, limit)));
    }

    @PostMapping("/preview")
    @Operation(summary = "Preview a trigger", description = "Compute the next fire times of a trigger without saving it")
    public ResponseEntity<ApiResponse<PreviewResponse>> previewTrigger(
            @Valid @RequestBody TriggerPreviewRequest request,
            @Parameter(description = "Number of fire times") @RequestParam(defaultValue = "5") int count) {
        return ResponseEntity.ok(ApiResponse.success(scheduleStoreService.preview(request, count)));
    }

    // === Maintenance ===

    @PostMapping("/sweep")
    @Operation(summary = "Run consistency sweep", description = "Reconcile schedules, installed triggers and execution history")
    public ResponseEntity<ApiResponse<SweepReport>> runSweep() {
        log.info("API: Consistency sweep requested");

        var report = consistencySweepService.sweep("manual");
        var message = report.isClean() ? "Sweep completed" : String.format("Sweep completed with %d failure(s)", report.getFailures().size());
        return ResponseEntity.ok(ApiResponse.success(report, message));
    }

    @GetMapping("/debug/scheduler-state")
    @Operation(summary = "Scheduler state", description = "Installed triggers compared against persisted schedules")
    public ResponseEntity<ApiResponse<SchedulerStateDump>> schedulerState() {
        return ResponseEntity.ok(ApiResponse.success(scheduleStoreService.debugDump()));
    }

    // === Health Check ===

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check if the trigger loop is running")
    public ResponseEntity<ApiResponse<String>> healthCheck() {
        if (triggerSchedulerService.isRunning()) {
            return ResponseEntity.ok(ApiResponse.success("OK", "Trigger scheduler is running"));
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiResponse.error("Trigger scheduler is stopped"));
    }
}
