package com.example.interviewreminder.service.scheduler;

import lombok.Builder;
import lombok.Value;

/**
 * Summary of one scan: interviews found and jobs enqueued or skipped as duplicates.
 */
@Value
@Builder
public class TickResult {

    private static final TickResult SKIPPED = TickResult.builder().skipped(true).build();

    int found;
    int enqueued;
    int duplicates;

    /**
     * The scan did not run (pipeline stopped or a previous scan still running)
     */
    boolean skipped;

    /**
     * The scan ran into an error; counts reflect the work done before it
     */
    boolean failed;

    public static TickResult skipped() {
        return SKIPPED;
    }
}
