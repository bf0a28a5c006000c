package com.example.interviewreminder.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for a reminder job that does not exist (or was pruned)
 */
@Getter
public class JobNotFoundException extends RuntimeException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Reminder job not found: " + jobId);
        this.jobId = jobId;
    }

    public JobNotFoundException(UUID jobId) {
        this(jobId.toString());
    }
}
