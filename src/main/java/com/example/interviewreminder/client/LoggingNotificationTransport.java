package com.example.interviewreminder.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Writes reminders to the application log instead of sending them.
 * Default transport for development and environments without a mail service.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "reminder.notification", name = "transport", havingValue = "log", matchIfMissing = true)
public class LoggingNotificationTransport implements NotificationTransport {

    @Override
    public void send(NotificationRequest request) {
        log.info("""
                        [reminder email] token={}
                        To: {} <{}>
                        Subject: {}

                        {}""",
                request.getDedupToken(), request.getRecipientName(), request.getRecipientEmail(), request.getSubject(), request.getBody());
    }
}
