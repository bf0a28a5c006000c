package com.example.interviewreminder.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Reason code recorded on a completed reminder job.
 * <p>
 * Only {@link #SENT} means a notification went out; the others are business
 * no-ops and are reported separately from failures.
 */
@Getter
@RequiredArgsConstructor
public enum ReminderOutcome {

    SENT("sent", "Reminder sent"),

    NOT_FOUND("not-found", "Interview not found"),

    CANCELLED("cancelled", "Interview cancelled"),

    ALREADY_SENT("already-sent", "Reminder already sent");

    private final String code;
    private final String description;

    public boolean isDelivered() {
        return this == SENT;
    }
}
