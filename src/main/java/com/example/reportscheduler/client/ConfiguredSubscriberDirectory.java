package com.example.reportscheduler.client;

import com.example.reportscheduler.config.ReportingProperties;
import com.example.reportscheduler.domain.enums.JobType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Subscribers listed under {@code reporting.subscribers.<job type code>}
 */
@Component
@RequiredArgsConstructor
public class ConfiguredSubscriberDirectory implements SubscriberDirectory {

    private final ReportingProperties properties;

    @Override
    public List<String> optedInRecipients(JobType jobType) {
        return List.copyOf(properties.subscribersFor(jobType.getCode()));
    }
}
