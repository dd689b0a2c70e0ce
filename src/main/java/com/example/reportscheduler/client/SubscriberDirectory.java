package com.example.reportscheduler.client;

import com.example.reportscheduler.domain.enums.JobType;

import java.util.List;

/**
 * Source of the addresses that opted in to receive a given report.
 */
public interface SubscriberDirectory {

    List<String> optedInRecipients(JobType jobType);
}
