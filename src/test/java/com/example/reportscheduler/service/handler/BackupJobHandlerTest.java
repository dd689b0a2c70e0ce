package com.example.reportscheduler.service.handler;

import com.example.reportscheduler.client.BackupService;
import com.example.reportscheduler.client.ClientModels.MailMessage;
import com.example.reportscheduler.client.ClientModels.MailResult;
import com.example.reportscheduler.client.Mailer;
import com.example.reportscheduler.domain.enums.JobType;
import com.example.reportscheduler.exception.JobExecutionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("BackupJobHandler Tests")
class BackupJobHandlerTest {

    @Mock
    private BackupService backupService;

    @Mock
    private Mailer mailer;

    @Mock
    private RecipientResolver recipientResolver;

    @InjectMocks
    private BackupJobHandler handler;

    @TempDir
    Path tempDir;

    private final JobContext context = JobContext.builder()
            .scheduleId(UUID.randomUUID())
            .jobType(JobType.BACKUP)
            .name("Nightly backup")
            .build();

    @Test
    @DisplayName("Should snapshot the database and report its size")
    void shouldSnapshotDatabase() throws Exception {
        var snapshot = Files.write(tempDir.resolve("backup_20260105_020000.db"), new byte[128]);
        when(backupService.snapshot()).thenReturn(snapshot);
        when(recipientResolver.resolve(context)).thenReturn(List.of());

        var result = handler.execute(context);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSummary())
                .containsEntry("artifact", "backup_20260105_020000.db")
                .containsEntry("size_bytes", 128L)
                .containsEntry("emails_sent", 0);
        verifyNoInteractions(mailer);
    }

    @Test
    @DisplayName("Should notify recipients without attaching the snapshot")
    void shouldNotifyRecipients() throws Exception {
        var snapshot = Files.write(tempDir.resolve("backup_20260105_020000.db"), new byte[16]);
        var mailCaptor = ArgumentCaptor.forClass(MailMessage.class);
        when(backupService.snapshot()).thenReturn(snapshot);
        when(recipientResolver.resolve(context)).thenReturn(List.of("ops@example.com"));
        when(mailer.send(mailCaptor.capture())).thenReturn(MailResult.sent(1));

        handler.execute(context);

        assertThat(mailCaptor.getValue().getSubject()).startsWith("[Scheduled] Database Backup - ");
        assertThat(mailCaptor.getValue().getAttachment()).isNull();
    }

    @Test
    @DisplayName("Should fail when the notification cannot be sent")
    void shouldFailWhenNotificationFails() throws Exception {
        var snapshot = Files.write(tempDir.resolve("backup.db"), new byte[16]);
        when(backupService.snapshot()).thenReturn(snapshot);
        when(recipientResolver.resolve(context)).thenReturn(List.of("ops@example.com"));
        when(mailer.send(any())).thenReturn(MailResult.failed(null));

        assertThatThrownBy(() -> handler.execute(context))
                .isInstanceOf(JobExecutionException.class)
                .hasMessageContaining("Unknown error");
    }

    @Test
    @DisplayName("Should propagate a missing database file")
    void shouldPropagateMissingSource() throws Exception {
        when(backupService.snapshot()).thenThrow(new NoSuchFileException("data/app.db"));

        assertThatThrownBy(() -> handler.execute(context)).isInstanceOf(NoSuchFileException.class);
        verifyNoInteractions(recipientResolver, mailer);
    }
}
