package com.example.interviewreminder.store;

import lombok.Builder;
import lombok.Value;

/**
 * Addressing details of one interview participant.
 */
@Value
@Builder
public class Recipient {
    String userId;
    String displayName;
    String email;

    /**
     * Preferred BCP 47 language tag, null when unknown
     */
    String locale;

    /**
     * Preferred IANA zone id, null when unknown
     */
    String timeZone;
}
