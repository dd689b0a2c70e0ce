package com.example.reportscheduler.service.handler;

import com.example.reportscheduler.client.ClientModels.MailMessage;
import com.example.reportscheduler.client.ClientModels.MailResult;
import com.example.reportscheduler.client.ClientModels.ReportRequest;
import com.example.reportscheduler.client.Mailer;
import com.example.reportscheduler.client.ReportGenerator;
import com.example.reportscheduler.domain.enums.DateRangeKind;
import com.example.reportscheduler.domain.enums.JobType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmployeeTipReportJobHandler Tests")
class EmployeeTipReportJobHandlerTest {

    @Mock
    private ReportGenerator reportGenerator;

    @Mock
    private Mailer mailer;

    @Mock
    private DateRangeResolver dateRangeResolver;

    @Mock
    private RecipientResolver recipientResolver;

    @TempDir
    Path tempDir;

    private EmployeeTipReportJobHandler handler;

    private final JobContext context = JobContext.builder()
            .scheduleId(UUID.randomUUID())
            .jobType(JobType.EMPLOYEE_TIP_REPORT)
            .name("Alice biweekly")
            .dateRangeKind(DateRangeKind.PREVIOUS_2_WEEKS)
            .employeeRef("EMP-42")
            .attachArtifact(true)
            .build();

    @BeforeEach
    void setUp() {
        handler = new EmployeeTipReportJobHandler(reportGenerator, mailer, dateRangeResolver, recipientResolver);
    }

    @Test
    @DisplayName("Should pass the employee to the generator and name them in the subject")
    void shouldReportForEmployee() throws Exception {
        var artifact = Files.writeString(tempDir.resolve("employee_tip_report_EMP-42.csv"), "header\n");
        var requestCaptor = ArgumentCaptor.forClass(ReportRequest.class);
        var mailCaptor = ArgumentCaptor.forClass(MailMessage.class);
        when(dateRangeResolver.resolve(any(), any(Instant.class), any()))
                .thenReturn(new DateRange(LocalDate.of(2025, 12, 29), LocalDate.of(2026, 1, 11)));
        when(reportGenerator.generate(requestCaptor.capture())).thenReturn(artifact);
        when(recipientResolver.resolve(context)).thenReturn(List.of("alice@example.com"));
        when(mailer.send(mailCaptor.capture())).thenReturn(MailResult.sent(1));

        var result = handler.execute(context);

        assertThat(result.isSuccess()).isTrue();
        assertThat(requestCaptor.getValue().getEmployeeRef()).isEqualTo("EMP-42");
        assertThat(mailCaptor.getValue().getSubject())
                .isEqualTo("[Scheduled] Employee Tip Report (EMP-42) - December 29, 2025 to January 11, 2026");
    }

    @Test
    @DisplayName("Should require an employee reference")
    void shouldRequireEmployeeRef() {
        var anonymous = context.toBuilder().employeeRef(" ").build();

        assertThatThrownBy(() -> handler.execute(anonymous))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Employee reference is required");
        verifyNoInteractions(reportGenerator, mailer);
    }
}
