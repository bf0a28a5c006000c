package com.example.interviewreminder.service.handler;

import lombok.Builder;
import lombok.Value;

/**
 * Reminder content for one recipient.
 */
@Value
@Builder
public class RenderedMessage {
    String subject;
    String body;

    /**
     * Short text for the in-app notification feed
     */
    String summary;

    /**
     * Interview time as shown to the recipient
     */
    String formattedTime;

    String locale;
}
