package com.example.reportscheduler.service.handler;

import com.example.reportscheduler.client.ClientModels.MailMessage;
import com.example.reportscheduler.client.ClientModels.ReportRequest;
import com.example.reportscheduler.client.Mailer;
import com.example.reportscheduler.client.ReportGenerator;
import com.example.reportscheduler.exception.JobExecutionException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.time.Instant;
import java.util.HashMap;

/**
 * Shared flow of the report jobs: resolve the date range, generate the artifact,
 * mail it to the resolved recipients.
 */
@Slf4j
public abstract class AbstractReportJobHandler implements JobHandler {

    private final ReportGenerator reportGenerator;
    private final Mailer mailer;
    private final DateRangeResolver dateRangeResolver;
    private final RecipientResolver recipientResolver;

    protected AbstractReportJobHandler(ReportGenerator reportGenerator, Mailer mailer,
                                       DateRangeResolver dateRangeResolver, RecipientResolver recipientResolver) {
        this.reportGenerator = reportGenerator;
        this.mailer = mailer;
        this.dateRangeResolver = dateRangeResolver;
        this.recipientResolver = recipientResolver;
    }

    @Override
    public void validate(JobContext context) {
        if (context.getDateRangeKind() == null) {
            throw new IllegalArgumentException("A date range is required for " + getJobType().getDisplayName());
        }
    }

    @Override
    public JobResult execute(JobContext context) throws Exception {
        validate(context);

        var range = dateRangeResolver.resolve(context.getDateRangeKind(), Instant.now(), context.getTimezone());
        log.info("Running {} '{}' for {}", getJobType().getDisplayName(), context.getName(), range);

        var artifact = reportGenerator.generate(ReportRequest.builder()
                .jobType(getJobType())
                .startDate(range.getStartDate())
                .endDate(range.getEndDate())
                .employeeRef(context.getEmployeeRef())
                .build());

        if (artifact == null || !Files.exists(artifact)) {
            throw new JobExecutionException(context.getScheduleId(), "Report file not found: " + artifact);
        }

        var recipients = recipientResolver.resolve(context);
        if (recipients.isEmpty()) {
            log.info("No recipients for '{}', report generated but not sent", context.getName());
        } else {
            var title = reportTitle(context);
            var result = mailer.send(MailMessage.builder()
                    .recipients(recipients)
                    .subject(String.format("[Scheduled] %s - %s", title, range.describe()))
                    .body(buildBody(title, range, context.isAttachArtifact()))
                    .attachment(context.isAttachArtifact() ? artifact : null)
                    .build());

            if (!result.isSuccess()) {
                throw new JobExecutionException(context.getScheduleId(), "Email sending failed: "
                        + (result.getMessage() != null ? result.getMessage() : "Unknown error"));
            }
        }

        var summary = new HashMap<String, Object>();
        summary.put("artifact", artifact.getFileName().toString());
        summary.put("date_range", range.toString());
        summary.put("emails_sent", recipients.size());
        return JobResult.success(summary);
    }

    /**
     * Title used in the mail subject and body
     */
    protected String reportTitle(JobContext context) {
        return getJobType().getDisplayName();
    }

    private String buildBody(String title, DateRange range, boolean attached) {
        if (attached) {
            return String.format("Attached is the scheduled %s for %s.", title, range.describe());
        }
        return String.format("The scheduled %s for %s has been generated.", title, range.describe());
    }
}
