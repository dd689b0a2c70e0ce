package com.example.reportscheduler.client;

import com.example.reportscheduler.domain.enums.JobType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Request/Response models for the report, mail and backup collaborators
 */
public class ClientModels {
    private ClientModels() {
    }

    // === Report Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReportRequest {
        private JobType jobType;
        private LocalDate startDate;
        private LocalDate endDate;

        /**
         * Only set for employee tip reports
         */
        private String employeeRef;
    }

    // === Mail Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MailMessage {
        @Builder.Default
        private List<String> recipients = new ArrayList<>();
        private String subject;
        private String body;

        /**
         * File to attach, null for none
         */
        private Path attachment;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MailResult {
        private boolean success;
        private String message;

        public static MailResult sent(int recipientCount) {
            return new MailResult(true, "Sent to " + recipientCount + " recipient(s)");
        }

        public static MailResult failed(String message) {
            return new MailResult(false, message);
        }
    }
}
