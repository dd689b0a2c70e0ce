package com.example.reportscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Report Scheduler Service Application
 * <p>
 * Runs recurring reporting and backup jobs on cron or interval schedules.
 * <p>
 * Features:
 * - Persistent trigger table that survives restarts
 * - Single-threaded timing loop with a bounded worker pool
 * - Durable execution ledger with retry on storage lock contention
 * - Startup and periodic consistency sweep
 * - Slack alerting for failed executions and ledger write failures
 */
@EnableScheduling
@SpringBootApplication
public class ReportSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReportSchedulerApplication.class, args);
    }
}
