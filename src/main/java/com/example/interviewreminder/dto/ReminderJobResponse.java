package com.example.interviewreminder.dto;

import com.example.interviewreminder.domain.enums.BackoffType;
import com.example.interviewreminder.domain.enums.JobOrigin;
import com.example.interviewreminder.domain.enums.JobState;
import com.example.interviewreminder.domain.enums.RecipientRole;
import com.example.interviewreminder.domain.enums.ReminderOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for reminder job data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReminderJobResponse {

    private UUID id;
    private String jobKey;
    private JobState state;
    private String interviewId;
    private RecipientRole recipientRole;
    private JobOrigin origin;
    private Integer attemptsMade;
    private Integer maxAttempts;
    private BackoffType backoffType;
    private Long backoffDelayMs;
    private Instant availableAt;
    private ReminderOutcome outcome;
    private String lastError;
    private String lockedBy;
    private Instant lockedUntil;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant startedAt;
    private Instant finishedAt;
    private Long executionDurationMs;
}
