package com.example.interviewreminder.service.queue;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time job counts per state.
 */
@Value
@Builder
public class QueueStats {
    long waiting;
    long active;
    long completed;
    long failed;
    long delayed;

    public long total() {
        return waiting + active + completed + failed + delayed;
    }
}
