package com.example.interviewreminder.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * History entry for a delivered reminder email.
 */
@Value
@Builder
public class AuditRecord {
    String interviewId;
    String recipient;
    String subject;

    /**
     * Notification type, e.g. INTERVIEW_REMINDER
     */
    String type;

    Instant sentAt;
    String jobKey;
}
