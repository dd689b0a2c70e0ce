package com.example.reportscheduler.service.alert;

import com.example.reportscheduler.config.SlackProperties;
import com.example.reportscheduler.domain.enums.ExecutionStatus;
import com.example.reportscheduler.domain.enums.JobType;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Service for sending alerts to Slack.
 * <p>
 * Two situations are alerted: an execution status that could not be recorded durably,
 * and a job that finished in failure.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:report-scheduler}")
    private String applicationName;

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Alert that an execution's status could not be written or verified.
     * The recorded status may disagree with what the job actually did.
     */
    @Async
    public void sendLedgerFailureAlert(String operation, UUID executionId, ExecutionStatus intendedStatus, String detail) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled. Ledger failure on '{}' for execution {} was not alerted.", operation, executionId);
            return;
        }

        var fields = new ArrayList<Field>();
        fields.add(shortField("Operation", operation));
        fields.add(shortField("Execution ID", executionId != null ? executionId.toString() : "n/a"));
        if (intendedStatus != null) {
            fields.add(shortField("Intended Status", intendedStatus.getDisplayName()));
        }
        fields.add(Field.builder()
                .title("Details")
                .value("```" + truncate(detail, 400) + "```")
                .valueShortEnough(false)
                .build());

        send(Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Execution Ledger Write Failed - Status May Be Wrong*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .fields(fields)
                                .footer(applicationName + " | Check the executions table for this schedule")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build(), "ledger failure");
    }

    /**
     * Alert that a scheduled job finished in failure
     */
    @Async
    public void sendJobFailureAlert(UUID scheduleId, String scheduleName, JobType jobType, String errorMessage) {
        if (!isConfigured() || !slackProperties.isAlertOnJobFailure()) {
            return;
        }

        send(Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":warning:")
                .text(":warning: *Scheduled Job Failed*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("warning")
                                .title(jobType.getDisplayName() + " - " + scheduleName)
                                .fields(List.of(
                                        shortField("Schedule ID", scheduleId.toString()),
                                        shortField("Job Type", jobType.getDisplayName()),
                                        Field.builder()
                                                .title("Error")
                                                .value(truncate(errorMessage, 300))
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName)
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build(), "job failure");
    }

    private void send(Payload payload, String kind) {
        try {
            var response = slack.send(slackProperties.getWebhookUrl(), payload);

            if (response.getCode() != 200) {
                log.error("Failed to send Slack {} alert. Response code: {}, body: {}", kind, response.getCode(), response.getBody());
            } else {
                log.info("Slack {} alert sent", kind);
            }
        } catch (Exception e) {
            log.error("Error sending Slack {} alert: {}", kind, e.getMessage(), e);
        }
    }

    private boolean isConfigured() {
        return slackProperties.isEnabled()
                && slackProperties.getWebhookUrl() != null
                && !slackProperties.getWebhookUrl().isBlank();
    }

    private Field shortField(String title, String value) {
        return Field.builder()
                .title(title)
                .value(value)
                .valueShortEnough(true)
                .build();
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
