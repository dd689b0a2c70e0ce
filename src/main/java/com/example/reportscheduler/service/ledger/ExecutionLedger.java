package com.example.reportscheduler.service.ledger;

import com.example.reportscheduler.config.LedgerProperties;
import com.example.reportscheduler.config.MetricsConfig;
import com.example.reportscheduler.domain.entity.TaskExecution;
import com.example.reportscheduler.domain.enums.ExecutionStatus;
import com.example.reportscheduler.domain.repository.TaskExecutionRepository;
import com.example.reportscheduler.exception.LedgerWriteException;
import com.example.reportscheduler.service.alert.SlackAlertService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Durable record of execution attempts.
 * <p>
 * Handles:
 * - Inserting a RUNNING row when a job starts
 * - Moving the row to its terminal status, with optional read-back verification
 * - Retention of the most recent executions per schedule
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionLedger {

    static final int MAX_ERROR_LENGTH = 4000;

    private static final String SELECT_STATUS_SQL = "SELECT status FROM task_executions WHERE id = ?";

    private static final String FORCE_TERMINAL_SQL = """
            UPDATE task_executions
            SET status = ?, completed_at = ?, error_message = ?
            WHERE id = ?
            """;

    private final TaskExecutionRepository executionRepository;
    private final CommitRetryExecutor commitRetryExecutor;
    private final JdbcTemplate jdbcTemplate;
    private final LedgerProperties properties;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;

    /**
     * Insert a RUNNING execution for the schedule
     *
     * @return id of the new execution
     * @throws LedgerWriteException when the storage stays locked
     */
    public UUID recordStart(UUID scheduleId) {
        var execution = commitRetryExecutor.commitWithRetry("recordStart", () -> executionRepository.save(
                TaskExecution.builder()
                        .scheduleId(scheduleId)
                        .startedAt(Instant.now())
                        .status(ExecutionStatus.RUNNING)
                        .build()));

        log.debug("Recorded start of execution {} for schedule {}", execution.getId(), scheduleId);
        return execution.getId();
    }

    public void recordSuccess(UUID executionId, Map<String, Object> resultSummary) {
        recordTerminal(executionId, ExecutionStatus.SUCCESS, resultSummary, null);
    }

    public void recordFailure(UUID executionId, String errorMessage) {
        recordTerminal(executionId, ExecutionStatus.FAILED, null, errorMessage);
    }

    /**
     * Move an execution to its terminal status.
     * <p>
     * A row that no longer exists (its schedule was deleted mid-run) is logged and skipped.
     *
     * @throws LedgerWriteException when the storage stays locked; the failure is alerted before it is rethrown
     */
    public void recordTerminal(UUID executionId, ExecutionStatus status, Map<String, Object> resultSummary,
                               String errorMessage) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }

        var completedAt = Instant.now();
        var error = truncate(errorMessage);

        UUID scheduleId;
        try {
            scheduleId = commitRetryExecutor.commitWithRetry("recordTerminal", () -> {
                var execution = executionRepository.findById(executionId).orElse(null);
                if (execution == null) {
                    return null;
                }
                execution.setStatus(status);
                execution.setCompletedAt(completedAt);
                execution.setErrorMessage(error);
                execution.setResultSummary(resultSummary != null ? new HashMap<>(resultSummary) : null);
                executionRepository.save(execution);
                return execution.getScheduleId();
            });
        } catch (LedgerWriteException e) {
            log.error("Could not record {} for execution {}: {}", status.getCode(), executionId, e.getMessage());
            slackAlertService.sendLedgerFailureAlert("recordTerminal", executionId, status, e.getMessage());
            throw e;
        }

        if (scheduleId == null) {
            log.warn("Execution {} no longer exists, {} status not recorded", executionId, status.getCode());
            return;
        }

        if (properties.getVerification() == LedgerProperties.Verification.READ_BACK) {
            verifyTerminal(executionId, status, completedAt, error);
        }

        pruneQuietly(scheduleId);
    }

    /**
     * Most recent executions of a schedule, newest first
     */
    public List<TaskExecution> recentExecutions(UUID scheduleId, int limit) {
        return executionRepository.findByScheduleIdOrderByStartedAtDesc(scheduleId, PageRequest.of(0, Math.max(1, limit)));
    }

    /**
     * Delete all but the most recent terminal executions of a schedule, oldest first.
     * Running executions are never removed.
     *
     * @return number of executions deleted
     */
    public int prune(UUID scheduleId) {
        return commitRetryExecutor.commitWithRetry("prune", () -> {
            var terminal = executionRepository.findByScheduleIdAndStatusNotOrderByStartedAtDesc(scheduleId, ExecutionStatus.RUNNING);
            if (terminal.size() <= properties.getRetentionCount()) {
                return 0;
            }

            var expired = terminal.subList(properties.getRetentionCount(), terminal.size()).stream()
                    .map(TaskExecution::getId)
                    .toList();
            return executionRepository.deleteByIdIn(expired);
        });
    }

    // === Verification ===

    private void verifyTerminal(UUID executionId, ExecutionStatus expected, Instant completedAt, String error) {
        if (expected.name().equals(readStatus(executionId))) {
            return;
        }

        log.warn("Execution {} does not read back as {}, forcing the write", executionId, expected.getCode());
        metricsConfig.recordVerificationFallback();

        try {
            jdbcTemplate.update(FORCE_TERMINAL_SQL, expected.name(), Timestamp.from(completedAt), error, executionId);
        } catch (DataAccessException e) {
            log.error("Forced write of execution {} failed: {}", executionId, e.getMessage());
        }

        var actual = readStatus(executionId);
        if (!expected.name().equals(actual)) {
            log.error("Execution {} still reads back as {} instead of {}", executionId, actual, expected.getCode());
            metricsConfig.recordLedgerFailure("verifyTerminal");
            slackAlertService.sendLedgerFailureAlert("verifyTerminal", executionId, expected,
                    "Status reads back as " + actual + " after a forced write");
        }
    }

    private String readStatus(UUID executionId) {
        try {
            return jdbcTemplate.query(SELECT_STATUS_SQL, rs -> rs.next() ? rs.getString("status") : null, executionId);
        } catch (DataAccessException e) {
            log.warn("Could not read back execution {}: {}", executionId, e.getMessage());
            return null;
        }
    }

    private void pruneQuietly(UUID scheduleId) {
        try {
            var deleted = prune(scheduleId);
            if (deleted > 0) {
                log.debug("Pruned {} old execution(s) of schedule {}", deleted, scheduleId);
            }
        } catch (RuntimeException e) {
            log.warn("Could not prune executions of schedule {}: {}", scheduleId, e.getMessage());
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }
}
