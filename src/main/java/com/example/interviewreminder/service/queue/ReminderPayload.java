package com.example.interviewreminder.service.queue;

import com.example.interviewreminder.domain.enums.JobOrigin;
import com.example.interviewreminder.domain.enums.RecipientRole;
import lombok.Builder;
import lombok.Value;

/**
 * What a reminder job carries: which interview and whom to remind.
 */
@Value
@Builder
public class ReminderPayload {
    String interviewId;
    RecipientRole role;

    @Builder.Default
    JobOrigin origin = JobOrigin.SCHEDULER;

    public static ReminderPayload scheduled(String interviewId, RecipientRole role) {
        return new ReminderPayload(interviewId, role, JobOrigin.SCHEDULER);
    }

    public static ReminderPayload manual(String interviewId, RecipientRole role) {
        return new ReminderPayload(interviewId, role, JobOrigin.MANUAL);
    }
}
