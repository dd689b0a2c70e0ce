package com.example.reportscheduler.client;

import com.example.reportscheduler.client.ClientModels.MailMessage;
import com.example.reportscheduler.client.ClientModels.MailResult;
import com.example.reportscheduler.config.ReportingProperties;
import jakarta.mail.MessagingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/**
 * Default mailer sending through Spring's {@link JavaMailSender}
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SmtpMailer implements Mailer {

    private final JavaMailSender mailSender;
    private final ReportingProperties properties;

    @Override
    public MailResult send(MailMessage message) {
        if (message.getRecipients() == null || message.getRecipients().isEmpty()) {
            return MailResult.failed("No recipients");
        }

        try {
            var mime = mailSender.createMimeMessage();
            var helper = new MimeMessageHelper(mime, message.getAttachment() != null);
            helper.setFrom(properties.getMailFrom());
            helper.setTo(message.getRecipients().toArray(String[]::new));
            helper.setSubject(message.getSubject());
            helper.setText(message.getBody() != null ? message.getBody() : "");

            if (message.getAttachment() != null) {
                helper.addAttachment(message.getAttachment().getFileName().toString(),
                        new FileSystemResource(message.getAttachment()));
            }

            mailSender.send(mime);
            log.info("Sent '{}' to {} recipient(s)", message.getSubject(), message.getRecipients().size());
            return MailResult.sent(message.getRecipients().size());
        } catch (MessagingException | MailException e) {
            log.warn("Could not send '{}': {}", message.getSubject(), e.getMessage());
            return MailResult.failed(e.getMessage());
        }
    }
}
