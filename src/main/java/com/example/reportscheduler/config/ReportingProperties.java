package com.example.reportscheduler.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings for the default report, mail and backup collaborators
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "reporting")
public class ReportingProperties {

    @NotBlank
    private String outputDir = "data/reports";

    @NotBlank
    private String backupDir = "data/backups";

    /**
     * Database file copied by the default backup service
     */
    private String backupSourceFile = "data/app.db";

    /**
     * Number of backup files kept in the backup directory
     */
    private int backupKeepCount = 7;

    private String mailFrom = "reports@localhost";

    /**
     * Opted-in subscriber addresses keyed by job type code
     */
    private Map<String, List<String>> subscribers = new HashMap<>();

    public List<String> subscribersFor(String jobTypeCode) {
        return subscribers.getOrDefault(jobTypeCode, new ArrayList<>());
    }
}
