package com.example.reportscheduler.config;

import com.example.reportscheduler.service.ledger.StorageLockClassifier;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Retry policy for storage writes that fail because the database is locked.
 * Only the storage-locked class of failure is retried, everything else propagates at once.
 */
@Slf4j
@Configuration
public class CommitRetryConfig {

    public static final String STORAGE_COMMIT_RETRY = "storageCommit";

    @Bean
    public Retry storageCommitRetry(LedgerProperties properties, MetricsConfig metricsConfig) {
        var config = RetryConfig.custom()
                .maxAttempts(properties.getMaxCommitAttempts())
                .intervalFunction(backoff(properties.getBackoffBaseMs()))
                .retryOnException(StorageLockClassifier::isStorageLocked)
                .build();

        var retry = Retry.of(STORAGE_COMMIT_RETRY, config);
        retry.getEventPublisher().onRetry(event -> {
            log.warn("Storage locked, retrying commit (attempt {}, waiting {})",
                    event.getNumberOfRetryAttempts(), event.getWaitInterval());
            metricsConfig.recordCommitRetry();
        });

        log.info("Configured commit retry: {} attempts, {}ms base backoff",
                properties.getMaxCommitAttempts(), properties.getBackoffBaseMs());
        return retry;
    }

    /**
     * Wait of base * 2^attempt after the given failed attempt, counting from 1
     */
    static IntervalFunction backoff(long baseMs) {
        return IntervalFunction.ofExponentialBackoff(2 * baseMs, 2.0);
    }
}
