package com.example.reportscheduler.service.handler;

import com.example.reportscheduler.client.BackupService;
import com.example.reportscheduler.client.ClientModels.MailMessage;
import com.example.reportscheduler.client.Mailer;
import com.example.reportscheduler.domain.enums.JobType;
import com.example.reportscheduler.exception.JobExecutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Locale;

/**
 * Handler for backup jobs.
 * <p>
 * Takes a database snapshot, then notifies the resolved recipients, if any.
 * The snapshot itself is never mailed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackupJobHandler implements JobHandler {

    private static final DateTimeFormatter LONG_DATE = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.US);

    private final BackupService backupService;
    private final Mailer mailer;
    private final RecipientResolver recipientResolver;

    @Override
    public JobType getJobType() {
        return JobType.BACKUP;
    }

    @Override
    public JobResult execute(JobContext context) throws Exception {
        log.info("Running backup '{}'", context.getName());

        var snapshot = backupService.snapshot();
        if (snapshot == null || !Files.exists(snapshot)) {
            throw new JobExecutionException(context.getScheduleId(), "Backup file not found: " + snapshot);
        }
        var size = Files.size(snapshot);

        var recipients = recipientResolver.resolve(context);
        if (!recipients.isEmpty()) {
            var result = mailer.send(MailMessage.builder()
                    .recipients(recipients)
                    .subject(String.format("[Scheduled] %s - %s", getJobType().getDisplayName(), LONG_DATE.format(LocalDate.now())))
                    .body(String.format("Backup %s was created (%d bytes).", snapshot.getFileName(), size))
                    .build());

            if (!result.isSuccess()) {
                throw new JobExecutionException(context.getScheduleId(), "Email sending failed: "
                        + (result.getMessage() != null ? result.getMessage() : "Unknown error"));
            }
        }

        var summary = new HashMap<String, Object>();
        summary.put("artifact", snapshot.getFileName().toString());
        summary.put("size_bytes", size);
        summary.put("emails_sent", recipients.size());
        return JobResult.success(summary);
    }
}
