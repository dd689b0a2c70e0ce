package com.example.reportscheduler.service.ledger;

import com.example.reportscheduler.config.MetricsConfig;
import com.example.reportscheduler.exception.LedgerWriteException;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs storage writes in their own transaction and retries them while the database reports lock contention.
 * <p>
 * Every attempt is a fresh transaction, so a failed attempt is rolled back before the next one starts.
 * Once the attempts are exhausted a {@link LedgerWriteException} is raised; failures outside the
 * storage-locked class propagate unchanged after the first attempt.
 */
@Slf4j
@Component
public class CommitRetryExecutor {

    private final TransactionTemplate transactionTemplate;
    private final Retry retry;
    private final MetricsConfig metricsConfig;

    public CommitRetryExecutor(PlatformTransactionManager transactionManager, Retry storageCommitRetry,
                               MetricsConfig metricsConfig) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.retry = storageCommitRetry;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Run a write returning a value
     *
     * @param operation short name used in logs and in the raised exception
     * @param write     the write, executed inside a new transaction per attempt
     */
    public <T> T commitWithRetry(String operation, Supplier<T> write) {
        var attempts = new AtomicInteger();
        Supplier<T> transactional = () -> {
            attempts.incrementAndGet();
            return transactionTemplate.execute(status -> write.get());
        };

        try {
            return retry.executeSupplier(transactional);
        } catch (RuntimeException e) {
            if (StorageLockClassifier.isStorageLocked(e)) {
                log.error("Write '{}' still locked after {} attempt(s)", operation, attempts.get());
                metricsConfig.recordLedgerFailure(operation);
                throw new LedgerWriteException(operation, attempts.get(), e);
            }
            throw e;
        }
    }

    public void commitWithRetry(String operation, Runnable write) {
        commitWithRetry(operation, () -> {
            write.run();
            return null;
        });
    }
}
