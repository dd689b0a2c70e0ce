package com.example.reportscheduler.service.handler;

import com.example.reportscheduler.domain.entity.ScheduledTask;
import com.example.reportscheduler.domain.entity.TriggerDefinition;
import com.example.reportscheduler.domain.enums.DateRangeKind;
import com.example.reportscheduler.domain.enums.JobType;
import com.example.reportscheduler.service.trigger.CronSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JobContext Tests")
class JobContextTest {

    @Test
    @DisplayName("Should carry a schedule's settings through the trigger argument map")
    void shouldRebuildFromArgs() {
        var task = ScheduledTask.builder()
                .id(UUID.randomUUID())
                .name("Monthly balance")
                .jobType(JobType.DAILY_BALANCE_REPORT)
                .trigger(TriggerDefinition.of(CronSpec.fromExpression("0 7 1 * *", "America/Chicago")))
                .dateRangeKind(DateRangeKind.PREVIOUS_MONTH)
                .recipients(List.of("cfo@example.com"))
                .bypassOptIn(true)
                .attachArtifact(false)
                .build();
        var fireTime = Instant.parse("2026-02-01T13:00:00Z");

        var original = JobContext.of(task);
        var rebuilt = JobContext.fromArgs(task.getId(), task.getJobType(), original.toArgs(), fireTime);

        assertThat(rebuilt.getName()).isEqualTo("Monthly balance");
        assertThat(rebuilt.getDateRangeKind()).isEqualTo(DateRangeKind.PREVIOUS_MONTH);
        assertThat(rebuilt.getRecipients()).containsExactly("cfo@example.com");
        assertThat(rebuilt.isBypassOptIn()).isTrue();
        assertThat(rebuilt.isAttachArtifact()).isFalse();
        assertThat(rebuilt.getTimezone()).isEqualTo("America/Chicago");
        assertThat(rebuilt.getScheduledFireTime()).isEqualTo(fireTime);
        assertThat(rebuilt.toBuilder().scheduledFireTime(null).build()).isEqualTo(original);
    }

    @Test
    @DisplayName("Should tolerate missing or malformed arguments")
    void shouldTolerateMissingArgs() {
        var args = new HashMap<String, Object>();
        args.put(JobContext.ARG_RECIPIENTS, "not-a-list");

        var context = JobContext.fromArgs(UUID.randomUUID(), JobType.BACKUP, args, null);

        assertThat(context.getRecipients()).isEmpty();
        assertThat(context.getDateRangeKind()).isNull();
        assertThat(JobContext.fromArgs(UUID.randomUUID(), JobType.BACKUP, null, null).getName()).isNull();
    }
}
