package com.example.interviewreminder.client;

import lombok.Builder;
import lombok.Value;

/**
 * A rendered reminder ready for delivery.
 */
@Value
@Builder
public class NotificationRequest {
    String recipientEmail;
    String recipientName;
    String subject;
    String body;

    /**
     * Stable per job; transports forward it so a retried attempt can be recognised downstream
     */
    String dedupToken;

    String locale;
}
