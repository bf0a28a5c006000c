package com.example.interviewreminder.service.queue;

import com.example.interviewreminder.config.ReminderQueueProperties;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Per-job retry policy.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JobOptions {

    /**
     * Total attempts, the first one included
     */
    int attempts;

    Backoff backoff;

    public static JobOptions of(int attempts, Backoff backoff) {
        if (attempts < 1) {
            throw new IllegalArgumentException("Attempts must be at least 1: " + attempts);
        }
        if (backoff == null) {
            throw new IllegalArgumentException("Backoff is required");
        }
        return new JobOptions(attempts, backoff);
    }

    public static JobOptions from(ReminderQueueProperties properties) {
        return of(properties.getMaxAttempts(), Backoff.of(properties.getBackoffType(), properties.getBackoffDelayMs()));
    }
}
