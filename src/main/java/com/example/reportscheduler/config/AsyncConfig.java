package com.example.reportscheduler.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools of the service.
 * <p>
 * - A single-threaded loop that decides what fires
 * - A bounded worker pool that runs job bodies
 * - A small pool for periodic maintenance and {@code @Async} alerts
 */
@Slf4j
@EnableAsync
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final TaskSchedulerProperties properties;

    /**
     * Worker pool for job bodies. Blocks on I/O so the timing loop never does.
     */
    @Bean(name = "jobWorkerExecutor")
    public ThreadPoolTaskExecutor jobWorkerExecutor() {
        log.info("Creating job worker pool with {} threads", properties.getWorkerPoolSize());

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkerPoolSize());
        executor.setMaxPoolSize(properties.getWorkerPoolSize());
        executor.setQueueCapacity(properties.getWorkerQueueCapacity());
        executor.setThreadNamePrefix("job-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(properties.getShutdownAwaitSeconds());
        executor.initialize();

        return executor;
    }

    /**
     * Single thread running the trigger loop
     */
    @Bean(name = "triggerLoopScheduler")
    public ThreadPoolTaskScheduler triggerLoopScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("trigger-loop-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();

        return scheduler;
    }

    /**
     * Scheduler used by {@code @Scheduled} methods such as the periodic sweep
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("maintenance-");
        scheduler.initialize();

        return scheduler;
    }

    /**
     * Task executor for Spring's @Async annotation, used for outbound alerts.
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("async-alert-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Alert rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        return executor;
    }
}
