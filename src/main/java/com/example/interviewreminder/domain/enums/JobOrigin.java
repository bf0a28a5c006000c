package com.example.interviewreminder.domain.enums;

/**
 * Who put a reminder job on the queue.
 */
public enum JobOrigin {

    /**
     * Produced by the periodic scheduler tick with a deterministic key
     */
    SCHEDULER,

    /**
     * Produced by an operator through the monitoring facade; always notifies
     */
    MANUAL
}
