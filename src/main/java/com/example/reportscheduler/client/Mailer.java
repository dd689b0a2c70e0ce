package com.example.reportscheduler.client;

import com.example.reportscheduler.client.ClientModels.MailMessage;
import com.example.reportscheduler.client.ClientModels.MailResult;

/**
 * Delivers report mails. Delivery problems are reported through the result, not thrown.
 */
public interface Mailer {

    MailResult send(MailMessage message);
}
