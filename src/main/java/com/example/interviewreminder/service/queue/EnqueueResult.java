package com.example.interviewreminder.service.queue;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.UUID;

/**
 * Outcome of an enqueue call.
 * <p>
 * For a duplicate, {@code jobId} points at the pending job already holding the
 * key. It may be null if that job finished between the conflict and the lookup.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EnqueueResult {
    UUID jobId;
    String jobKey;
    boolean duplicate;

    public static EnqueueResult created(UUID jobId, JobKey key) {
        return new EnqueueResult(jobId, key.getValue(), false);
    }

    public static EnqueueResult duplicate(UUID existingJobId, JobKey key) {
        return new EnqueueResult(existingJobId, key.getValue(), true);
    }
}
