package com.example.reportscheduler.service.ledger;

import com.example.reportscheduler.config.LedgerProperties;
import com.example.reportscheduler.config.MetricsConfig;
import com.example.reportscheduler.domain.entity.TaskExecution;
import com.example.reportscheduler.domain.enums.ExecutionStatus;
import com.example.reportscheduler.domain.repository.TaskExecutionRepository;
import com.example.reportscheduler.exception.LedgerWriteException;
import com.example.reportscheduler.service.alert.SlackAlertService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ExecutionLedger Tests")
class ExecutionLedgerTest {

    @Mock
    private TaskExecutionRepository executionRepository;

    @Mock
    private CommitRetryExecutor commitRetryExecutor;

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private SlackAlertService slackAlertService;

    @Mock
    private MetricsConfig metricsConfig;

    @Captor
    private ArgumentCaptor<Collection<UUID>> idsCaptor;

    private LedgerProperties properties;
    private ExecutionLedger ledger;

    private final UUID scheduleId = UUID.randomUUID();
    private final UUID executionId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        properties = new LedgerProperties();
        properties.setRetentionCount(7);
        properties.setVerification(LedgerProperties.Verification.NONE);
        ledger = new ExecutionLedger(executionRepository, commitRetryExecutor, jdbcTemplate, properties,
                slackAlertService, metricsConfig);

        lenient().when(commitRetryExecutor.commitWithRetry(anyString(), any(Supplier.class)))
                .thenAnswer(inv -> ((Supplier<?>) inv.getArgument(1)).get());
    }

    private TaskExecution running() {
        return TaskExecution.builder()
                .id(executionId)
                .scheduleId(scheduleId)
                .startedAt(Instant.now().minusSeconds(5))
                .status(ExecutionStatus.RUNNING)
                .build();
    }

    private List<TaskExecution> terminalExecutions(int count) {
        var executions = new ArrayList<TaskExecution>();
        var start = Instant.now();
        for (var i = 0; i < count; i++) {
            executions.add(TaskExecution.builder()
                    .id(UUID.randomUUID())
                    .scheduleId(scheduleId)
                    .startedAt(start.minusSeconds(60L * i))
                    .status(ExecutionStatus.SUCCESS)
                    .build());
        }
        return executions;
    }

    @Nested
    @DisplayName("recordStart Tests")
    class RecordStartTests {

        @Test
        @DisplayName("Should insert a running execution")
        void shouldInsertRunningExecution() {
            var captor = ArgumentCaptor.forClass(TaskExecution.class);
            when(executionRepository.save(captor.capture())).thenAnswer(inv -> {
                TaskExecution execution = inv.getArgument(0);
                execution.setId(executionId);
                return execution;
            });

            var id = ledger.recordStart(scheduleId);

            assertThat(id).isEqualTo(executionId);
            assertThat(captor.getValue().getStatus()).isEqualTo(ExecutionStatus.RUNNING);
            assertThat(captor.getValue().getScheduleId()).isEqualTo(scheduleId);
            assertThat(captor.getValue().getStartedAt()).isNotNull();
            assertThat(captor.getValue().getCompletedAt()).isNull();
        }

        @Test
        @DisplayName("Should propagate a ledger write failure")
        void shouldPropagateWriteFailure() {
            when(commitRetryExecutor.commitWithRetry(eq("recordStart"), any(Supplier.class)))
                    .thenThrow(new LedgerWriteException("recordStart", 5, new PessimisticLockingFailureException("locked")));

            assertThatThrownBy(() -> ledger.recordStart(scheduleId)).isInstanceOf(LedgerWriteException.class);
        }
    }

    @Nested
    @DisplayName("recordTerminal Tests")
    class RecordTerminalTests {

        @Test
        @DisplayName("Should record success with its summary")
        void shouldRecordSuccess() {
            var execution = running();
            when(executionRepository.findById(executionId)).thenReturn(Optional.of(execution));
            when(executionRepository.findByScheduleIdAndStatusNotOrderByStartedAtDesc(scheduleId, ExecutionStatus.RUNNING))
                    .thenReturn(List.of(execution));

            ledger.recordSuccess(executionId, Map.of("emails_sent", 2));

            assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
            assertThat(execution.getCompletedAt()).isNotNull();
            assertThat(execution.getResultSummary()).containsEntry("emails_sent", 2);
            assertThat(execution.getErrorMessage()).isNull();
            verify(executionRepository).save(execution);
            verify(executionRepository, never()).deleteByIdIn(any());
        }

        @Test
        @DisplayName("Should truncate long failure messages")
        void shouldTruncateErrorMessage() {
            var execution = running();
            when(executionRepository.findById(executionId)).thenReturn(Optional.of(execution));

            ledger.recordFailure(executionId, "x".repeat(10_000));

            assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(execution.getErrorMessage()).hasSize(ExecutionLedger.MAX_ERROR_LENGTH).endsWith("...");
        }

        @Test
        @DisplayName("Should reject a non-terminal status")
        void shouldRejectNonTerminalStatus() {
            assertThatThrownBy(() -> ledger.recordTerminal(executionId, ExecutionStatus.RUNNING, null, null))
                    .isInstanceOf(IllegalArgumentException.class);
            verifyNoInteractions(executionRepository);
        }

        @Test
        @DisplayName("Should skip an execution that no longer exists")
        void shouldSkipMissingExecution() {
            when(executionRepository.findById(executionId)).thenReturn(Optional.empty());

            ledger.recordFailure(executionId, "boom");

            verify(executionRepository, never()).save(any());
            verify(executionRepository, never()).findByScheduleIdAndStatusNotOrderByStartedAtDesc(any(), any());
        }

        @Test
        @DisplayName("Should alert and rethrow when the storage stays locked")
        void shouldAlertOnWriteFailure() {
            when(commitRetryExecutor.commitWithRetry(eq("recordTerminal"), any(Supplier.class)))
                    .thenThrow(new LedgerWriteException("recordTerminal", 5, new PessimisticLockingFailureException("locked")));

            assertThatThrownBy(() -> ledger.recordFailure(executionId, "boom")).isInstanceOf(LedgerWriteException.class);

            verify(slackAlertService).sendLedgerFailureAlert(eq("recordTerminal"), eq(executionId), eq(ExecutionStatus.FAILED), anyString());
        }
    }

    @Nested
    @DisplayName("Read-back Verification Tests")
    class VerificationTests {

        @BeforeEach
        void enableReadBack() {
            properties.setVerification(LedgerProperties.Verification.READ_BACK);
            when(executionRepository.findById(executionId)).thenReturn(Optional.of(running()));
        }

        @Test
        @DisplayName("Should accept a write that reads back correctly")
        void shouldAcceptMatchingReadBack() {
            when(jdbcTemplate.query(anyString(), any(ResultSetExtractor.class), eq(executionId))).thenReturn("SUCCESS");

            ledger.recordSuccess(executionId, Map.of());

            verify(jdbcTemplate, never()).update(anyString(), any(), any(), any(), any());
            verify(metricsConfig, never()).recordVerificationFallback();
        }

        @Test
        @DisplayName("Should force the write when the row reads back as running")
        void shouldForceWriteOnMismatch() {
            when(jdbcTemplate.query(anyString(), any(ResultSetExtractor.class), eq(executionId)))
                    .thenReturn("RUNNING", "FAILED");

            ledger.recordFailure(executionId, "boom");

            verify(metricsConfig).recordVerificationFallback();
            verify(jdbcTemplate).update(anyString(), eq("FAILED"), any(), eq("boom"), eq(executionId));
            verify(slackAlertService, never()).sendLedgerFailureAlert(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Should alert when the forced write does not stick")
        void shouldAlertWhenForcedWriteFails() {
            when(jdbcTemplate.query(anyString(), any(ResultSetExtractor.class), eq(executionId))).thenReturn("RUNNING");

            ledger.recordFailure(executionId, "boom");

            verify(metricsConfig).recordLedgerFailure("verifyTerminal");
            verify(slackAlertService).sendLedgerFailureAlert(eq("verifyTerminal"), eq(executionId), eq(ExecutionStatus.FAILED), anyString());
        }
    }

    @Nested
    @DisplayName("prune Tests")
    class PruneTests {

        @Test
        @DisplayName("Should keep only the most recent terminal executions")
        void shouldKeepMostRecent() {
            var executions = terminalExecutions(10);
            when(executionRepository.findByScheduleIdAndStatusNotOrderByStartedAtDesc(scheduleId, ExecutionStatus.RUNNING))
                    .thenReturn(executions);
            when(executionRepository.deleteByIdIn(idsCaptor.capture())).thenReturn(3);

            var deleted = ledger.prune(scheduleId);

            assertThat(deleted).isEqualTo(3);
            assertThat(idsCaptor.getValue()).containsExactly(
                    executions.get(7).getId(), executions.get(8).getId(), executions.get(9).getId());
        }

        @Test
        @DisplayName("Should delete nothing within the retention count")
        void shouldDeleteNothingWithinRetention() {
            when(executionRepository.findByScheduleIdAndStatusNotOrderByStartedAtDesc(scheduleId, ExecutionStatus.RUNNING))
                    .thenReturn(terminalExecutions(7));

            assertThat(ledger.prune(scheduleId)).isZero();
            verify(executionRepository, never()).deleteByIdIn(any());
        }
    }
}
