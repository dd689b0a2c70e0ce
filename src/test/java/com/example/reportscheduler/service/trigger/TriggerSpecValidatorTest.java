package com.example.reportscheduler.service.trigger;

import com.example.reportscheduler.domain.enums.TriggerKind;
import com.example.reportscheduler.exception.ScheduleValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@DisplayName("TriggerSpecValidator Tests")
class TriggerSpecValidatorTest {

    private final TriggerSpecValidator validator = new TriggerSpecValidator();

    @Test
    @DisplayName("Should build a cron spec from a valid expression")
    void shouldBuildCronSpec() {
        var spec = validator.validate(TriggerKind.CRON, " 0 9 * * 1 ", null, null, null, "America/New_York");

        assertThat(spec).isInstanceOf(CronSpec.class);
        var cron = (CronSpec) spec;
        assertThat(cron.toExpression()).isEqualTo("0 9 * * 1");
        assertThat(cron.getTimezone()).isEqualTo("America/New_York");
    }

    @Test
    @DisplayName("Should build an interval spec with a normalized unit")
    void shouldBuildIntervalSpec() {
        var anchor = LocalDateTime.of(2026, 1, 5, 9, 0);

        var spec = validator.validate(TriggerKind.INTERVAL, null, "DAYS", 14, anchor, " ");

        assertThat(spec).isInstanceOf(IntervalSpec.class);
        var interval = (IntervalSpec) spec;
        assertThat(interval.getUnit()).isEqualTo("days");
        assertThat(interval.getValue()).isEqualTo(14);
        assertThat(interval.getAnchorTime()).isEqualTo(anchor);
        assertThat(interval.getTimezone()).isNull();
    }

    @Test
    @DisplayName("Should reject a cron expression with the wrong number of fields")
    void shouldRejectWrongFieldCount() {
        assertThatThrownBy(() -> validator.validate(TriggerKind.CRON, "0 9 * *", null, null, null, null))
                .isInstanceOf(ScheduleValidationException.class)
                .satisfies(e -> assertThat(((ScheduleValidationException) e).getErrors())
                        .anySatisfy(error -> assertThat(error).contains("expected 5 fields")));
    }

    @Test
    @DisplayName("Should reject an out-of-range cron field")
    void shouldRejectOutOfRangeField() {
        assertThatThrownBy(() -> validator.validate(TriggerKind.CRON, "61 9 * * *", null, null, null, null))
                .isInstanceOf(ScheduleValidationException.class);
    }

    @Test
    @DisplayName("Should reject a missing cron expression")
    void shouldRejectMissingCron() {
        var error = catchThrowableOfType(() -> validator.validate(TriggerKind.CRON, null, null, null, null, null),
                ScheduleValidationException.class);

        assertThat(error.getErrors()).containsExactly("cronExpression: is required for cron schedules");
    }

    @Test
    @DisplayName("Should report every interval problem at once")
    void shouldReportAllIntervalErrors() {
        var error = catchThrowableOfType(() -> validator.validate(TriggerKind.INTERVAL, null, "fortnights", 0, null, "Bad/Zone"),
                ScheduleValidationException.class);

        assertThat(error.getErrors()).hasSize(3);
        assertThat(error.getErrors()).anySatisfy(e -> assertThat(e).startsWith("timezone:"));
        assertThat(error.getErrors()).anySatisfy(e -> assertThat(e).startsWith("intervalUnit:"));
        assertThat(error.getErrors()).anySatisfy(e -> assertThat(e).startsWith("intervalValue:"));
    }

    @Test
    @DisplayName("Should reject a missing trigger kind")
    void shouldRejectMissingKind() {
        assertThatThrownBy(() -> validator.validate(null, "0 9 * * 1", null, null, null, null))
                .isInstanceOf(ScheduleValidationException.class);
    }
}
