package com.example.interviewreminder.store;

import com.example.interviewreminder.domain.enums.InterviewStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Access to the platform's interview records.
 * <p>
 * The pipeline only reads interviews and flips their reminder flag; every
 * other column belongs to the recruiting application.
 */
public interface InterviewStore {

    /**
     * Interviews with the given status, {@code reminderSent = false} and
     * {@code scheduledAt} inside [rangeStart, rangeEnd] (both inclusive)
     */
    List<InterviewDetails> findInterviewsInWindow(InterviewStatus status, Instant rangeStart, Instant rangeEnd);

    Optional<InterviewDetails> getInterview(String interviewId);

    /**
     * Set {@code reminderSent = true}. Idempotent.
     */
    void markReminderSent(String interviewId);

    default boolean isCancelled(String interviewId) {
        return getInterview(interviewId).map(InterviewDetails::isCancelled).orElse(false);
    }
}
