package com.example.reportscheduler.service.handler;

import com.example.reportscheduler.client.Mailer;
import com.example.reportscheduler.client.ReportGenerator;
import com.example.reportscheduler.domain.enums.JobType;
import org.springframework.stereotype.Component;

/**
 * Handler for tip_report jobs: the tip report of all employees.
 */
@Component
public class TipReportJobHandler extends AbstractReportJobHandler {

    public TipReportJobHandler(ReportGenerator reportGenerator, Mailer mailer,
                               DateRangeResolver dateRangeResolver, RecipientResolver recipientResolver) {
        super(reportGenerator, mailer, dateRangeResolver, recipientResolver);
    }

    @Override
    public JobType getJobType() {
        return JobType.TIP_REPORT;
    }
}
