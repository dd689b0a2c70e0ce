package com.example.reportscheduler.service.handler;

import com.example.reportscheduler.client.Mailer;
import com.example.reportscheduler.client.ReportGenerator;
import com.example.reportscheduler.domain.enums.JobType;
import org.springframework.stereotype.Component;

/**
 * Handler for daily_balance_report jobs: the consolidated daily balance over the range.
 */
@Component
public class DailyBalanceReportJobHandler extends AbstractReportJobHandler {

    public DailyBalanceReportJobHandler(ReportGenerator reportGenerator, Mailer mailer,
                                        DateRangeResolver dateRangeResolver, RecipientResolver recipientResolver) {
        super(reportGenerator, mailer, dateRangeResolver, recipientResolver);
    }

    @Override
    public JobType getJobType() {
        return JobType.DAILY_BALANCE_REPORT;
    }
}
