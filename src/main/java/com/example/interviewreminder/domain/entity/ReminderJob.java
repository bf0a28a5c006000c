package com.example.interviewreminder.domain.entity;

import com.example.interviewreminder.domain.enums.BackoffType;
import com.example.interviewreminder.domain.enums.JobOrigin;
import com.example.interviewreminder.domain.enums.JobState;
import com.example.interviewreminder.domain.enums.RecipientRole;
import com.example.interviewreminder.domain.enums.ReminderOutcome;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A unit of queued work: "send a reminder to recipient role R for interview I".
 * <p>
 * Supports:
 * - Deduplication by job key while the job is still pending
 * - Per-job retry policy (attempts and backoff)
 * - Distributed claiming through lock columns and optimistic versioning
 * - Result and error details for inspection after completion
 */
@Entity
@Table(name = "reminder_jobs", indexes = {
        @Index(name = "idx_job_state_available_at", columnList = "state, available_at"),
        @Index(name = "idx_job_interview_id", columnList = "interview_id"),
        @Index(name = "idx_job_job_key", columnList = "job_key"),
        @Index(name = "idx_job_state_finished_at", columnList = "state, finished_at DESC"),
        @Index(name = "idx_job_locked_by_until", columnList = "locked_by, locked_until")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_job_active_key", columnNames = "active_key")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReminderJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Deduplication identity, e.g. candidate-42 or manual-candidate-42-1718000000000-9f3a
     */
    @Column(name = "job_key", nullable = false, updatable = false, length = 200)
    private String jobKey;

    /**
     * Copy of the job key while the job is pending, null once terminal.
     * Unique, so two pending jobs can never share a key.
     */
    @Column(name = "active_key", length = 200)
    private String activeKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private JobState state;

    // === Payload ===

    @Column(name = "interview_id", nullable = false, length = 100)
    private String interviewId;

    @Enumerated(EnumType.STRING)
    @Column(name = "recipient_role", nullable = false, length = 20)
    private RecipientRole recipientRole;

    @Enumerated(EnumType.STRING)
    @Column(name = "origin", nullable = false, length = 20)
    private JobOrigin origin;

    // === Retry Policy ===

    @Column(name = "attempts_made", nullable = false)
    @Builder.Default
    private Integer attemptsMade = 0;

    @Column(name = "max_attempts", nullable = false)
    private Integer maxAttempts;

    @Enumerated(EnumType.STRING)
    @Column(name = "backoff_type", nullable = false, length = 20)
    private BackoffType backoffType;

    @Column(name = "backoff_delay_ms", nullable = false)
    private Long backoffDelayMs;

    /**
     * Earliest time the job may be claimed (creation time, or end of the backoff delay)
     */
    @Column(name = "available_at", nullable = false)
    private Instant availableAt;

    // === Result ===

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", length = 20)
    private ReminderOutcome outcome;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "last_error_stack_trace", columnDefinition = "TEXT")
    private String lastErrorStackTrace;

    // === Distributed Locking Fields ===

    @Column(name = "locked_by", length = 100)
    private String lockedBy;

    @Column(name = "locked_until")
    private Instant lockedUntil;

    @Version
    @Column(name = "version")
    private Long version;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "execution_duration_ms")
    private Long executionDurationMs;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
        if (this.state == null) {
            this.state = JobState.WAITING;
        }
        if (this.attemptsMade == null) {
            this.attemptsMade = 0;
        }
        if (this.availableAt == null) {
            this.availableAt = this.createdAt;
        }
        if (this.activeKey == null && !this.state.isTerminal()) {
            this.activeKey = this.jobKey;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // === Helper Methods ===

    public boolean hasAttemptsLeft() {
        return attemptsMade < maxAttempts;
    }

    /**
     * Move to a terminal state, releasing the job key and the lock
     */
    public void finish(JobState terminalState, Instant finishedAt) {
        if (!terminalState.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminalState);
        }
        this.state = terminalState;
        this.finishedAt = finishedAt;
        this.activeKey = null;
        releaseLock();
    }

    public void releaseLock() {
        this.lockedBy = null;
        this.lockedUntil = null;
    }
}
