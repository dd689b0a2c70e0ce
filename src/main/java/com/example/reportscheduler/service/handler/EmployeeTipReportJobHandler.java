package com.example.reportscheduler.service.handler;

import com.example.reportscheduler.client.Mailer;
import com.example.reportscheduler.client.ReportGenerator;
import com.example.reportscheduler.domain.enums.JobType;
import org.springframework.stereotype.Component;

/**
 * Handler for employee_tip_report jobs.
 * <p>
 * Same flow as the tip report, restricted to the employee named by the schedule's employee reference.
 */
@Component
public class EmployeeTipReportJobHandler extends AbstractReportJobHandler {

    public EmployeeTipReportJobHandler(ReportGenerator reportGenerator, Mailer mailer,
                                       DateRangeResolver dateRangeResolver, RecipientResolver recipientResolver) {
        super(reportGenerator, mailer, dateRangeResolver, recipientResolver);
    }

    @Override
    public JobType getJobType() {
        return JobType.EMPLOYEE_TIP_REPORT;
    }

    @Override
    public void validate(JobContext context) {
        super.validate(context);

        if (context.getEmployeeRef() == null || context.getEmployeeRef().isBlank()) {
            throw new IllegalArgumentException("Employee reference is required for " + getJobType().getDisplayName());
        }
    }

    @Override
    protected String reportTitle(JobContext context) {
        return getJobType().getDisplayName() + " (" + context.getEmployeeRef() + ")";
    }
}
