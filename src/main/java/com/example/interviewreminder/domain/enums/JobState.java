package com.example.interviewreminder.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle states of a reminder job inside the queue.
 * <p>
 * WAITING, ACTIVE and DELAYED jobs still own their job key; a second enqueue
 * with the same key is a no-op while the job is in one of these states.
 */
@Getter
@RequiredArgsConstructor
public enum JobState {

    /**
     * Job is ready and waiting for a free worker slot.
     */
    WAITING("waiting", true),

    /**
     * Job has been claimed by a worker and is being processed.
     */
    ACTIVE("active", false),

    /**
     * Job finished, either delivering a reminder or deciding there was nothing to do.
     * Terminal state.
     */
    COMPLETED("completed", false),

    /**
     * Job exhausted all attempts.
     * Terminal state - surfaced through stats, logs and alerts only.
     */
    FAILED("failed", false),

    /**
     * Job failed an attempt and waits for its backoff delay before becoming eligible again.
     */
    DELAYED("delayed", true);

    private final String code;

    /**
     * Indicates if a job in this state can be picked up once its available time has passed
     */
    private final boolean claimable;

    public static JobState fromCode(String code) {
        for (var state : values()) {
            if (state.getCode().equals(code)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown job state code: " + code);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
