package com.example.reportscheduler.domain.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Domain Enum Tests")
class JobTypeTest {

    @Test
    @DisplayName("Report job types should be identified correctly")
    void reportTypesShouldBeIdentified() {
        assertThat(JobType.TIP_REPORT.isReport()).isTrue();
        assertThat(JobType.DAILY_BALANCE_REPORT.isReport()).isTrue();
        assertThat(JobType.EMPLOYEE_TIP_REPORT.isReport()).isTrue();

        assertThat(JobType.BACKUP.isReport()).isFalse();
    }

    @Test
    @DisplayName("Only employee tip reports should require an employee")
    void onlyEmployeeTipReportRequiresEmployee() {
        assertThat(JobType.EMPLOYEE_TIP_REPORT.requiresEmployee()).isTrue();

        assertThat(JobType.TIP_REPORT.requiresEmployee()).isFalse();
        assertThat(JobType.DAILY_BALANCE_REPORT.requiresEmployee()).isFalse();
        assertThat(JobType.BACKUP.requiresEmployee()).isFalse();
    }

    @Test
    @DisplayName("Should lookup job type by code")
    void shouldLookupJobTypeByCode() {
        assertThat(JobType.fromCode("tip_report")).isEqualTo(JobType.TIP_REPORT);
        assertThat(JobType.fromCode("daily_balance_report")).isEqualTo(JobType.DAILY_BALANCE_REPORT);
        assertThat(JobType.fromCode("backup")).isEqualTo(JobType.BACKUP);

        assertThatThrownBy(() -> JobType.fromCode("payroll"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("payroll");
    }

    @Test
    @DisplayName("Terminal execution states should be identified correctly")
    void terminalExecutionStatesShouldBeIdentified() {
        assertThat(ExecutionStatus.SUCCESS.isTerminal()).isTrue();
        assertThat(ExecutionStatus.FAILED.isTerminal()).isTrue();

        assertThat(ExecutionStatus.RUNNING.isTerminal()).isFalse();
        assertThat(ExecutionStatus.fromCode("failed")).isEqualTo(ExecutionStatus.FAILED);
    }

    @Test
    @DisplayName("Interval units should be found leniently")
    void intervalUnitsShouldBeFoundLeniently() {
        assertThat(IntervalUnit.find(" Days ")).contains(IntervalUnit.DAYS);
        assertThat(IntervalUnit.find("WEEKS")).contains(IntervalUnit.WEEKS);
        assertThat(IntervalUnit.find("fortnights")).isEmpty();
        assertThat(IntervalUnit.find(null)).isEmpty();

        assertThat(IntervalUnit.DAYS.isCalendarBased()).isTrue();
        assertThat(IntervalUnit.HOURS.isCalendarBased()).isFalse();
        assertThatThrownBy(() -> IntervalUnit.fromCode("fortnights")).isInstanceOf(IllegalArgumentException.class);
    }
}
