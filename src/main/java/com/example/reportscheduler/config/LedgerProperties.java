package com.example.reportscheduler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the execution ledger and its commit retry layer.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "execution-ledger")
public class LedgerProperties {

    /**
     * Attempts per write before giving up, including the first one
     */
    @Min(1)
    private int maxCommitAttempts = 5;

    /**
     * Backoff before the second attempt, doubled for every further one
     */
    @Min(1)
    private long backoffBaseMs = 100;

    /**
     * Terminal executions kept per schedule
     */
    @Min(1)
    private int retentionCount = 7;

    @NotNull
    private Verification verification = Verification.READ_BACK;

    public enum Verification {
        /**
         * Re-read every terminal write and force-write it on mismatch
         */
        READ_BACK,

        /**
         * Trust the committed write
         */
        NONE
    }
}
