package com.example.reportscheduler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the trigger scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "task-scheduler")
public class TaskSchedulerProperties {

    /**
     * Interval in milliseconds between two runs of the timing loop
     */
    @Min(100)
    private long tickIntervalMs = 1000;

    /**
     * Number of worker threads running job bodies
     */
    @Min(1)
    private int workerPoolSize = 20;

    /**
     * Maximum number of fired jobs waiting for a free worker
     */
    @Min(1)
    private int workerQueueCapacity = 100;

    /**
     * Seconds a fire may be late before it is skipped as a misfire
     */
    @Min(0)
    private int misfireGraceSeconds = 300;

    /**
     * Zone used for schedules that do not name one
     */
    @NotBlank
    private String defaultTimezone = "America/Los_Angeles";

    /**
     * Start the timing loop once the startup sweep has completed
     */
    private boolean autoStart = true;

    /**
     * Interval in milliseconds between two periodic consistency sweeps
     */
    @Min(1000)
    private long sweepIntervalMs = 3_600_000;

    /**
     * Seconds the worker pool is given to drain on shutdown
     */
    @Min(0)
    private int shutdownAwaitSeconds = 60;

    /**
     * Interval in milliseconds between two refreshes of the gauge metrics
     */
    @Min(1000)
    private long metricsUpdateIntervalMs = 60_000;
}
