package com.example.interviewreminder.store;

import com.example.interviewreminder.domain.enums.InterviewStatus;
import com.example.interviewreminder.domain.enums.InterviewType;
import com.example.interviewreminder.domain.enums.RecipientRole;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of an interview as seen by the reminder pipeline.
 */
@Value
@Builder
public class InterviewDetails {
    String id;
    Instant scheduledAt;
    InterviewStatus status;
    boolean reminderSent;
    int durationMinutes;
    InterviewType type;
    String location;
    String meetingUrl;
    String appliedPosition;
    Recipient candidate;
    Recipient interviewer;

    public Recipient recipientFor(RecipientRole role) {
        return switch (role) {
            case CANDIDATE -> candidate;
            case INTERVIEWER -> interviewer;
        };
    }

    public boolean isCancelled() {
        return status == InterviewStatus.CANCELLED;
    }
}
