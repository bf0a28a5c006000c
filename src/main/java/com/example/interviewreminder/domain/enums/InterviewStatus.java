package com.example.interviewreminder.domain.enums;

/**
 * Lifecycle status of an interview as kept by the interview store.
 */
public enum InterviewStatus {
    SCHEDULED,
    CANCELLED,
    COMPLETED,
    NO_SHOW
}
