package com.example.reportscheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Slack configuration properties
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {
    private String webhookUrl;
    private String channel = "#report-scheduler-alerts";
    private boolean enabled = false;

    /**
     * Also alert on failed job executions, not only on ledger write failures
     */
    private boolean alertOnJobFailure = true;
}
