package com.example.interviewreminder.service.queue;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Deduplication identity of a reminder job.
 * <p>
 * Two enqueue calls with equal keys produce at most one pending job.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JobKey {

    String value;

    public static JobKey of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Job key must not be blank");
        }
        return new JobKey(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
