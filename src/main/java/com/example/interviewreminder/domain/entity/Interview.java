package com.example.interviewreminder.domain.entity;

import com.example.interviewreminder.domain.enums.InterviewStatus;
import com.example.interviewreminder.domain.enums.InterviewType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Interview record owned by the recruiting platform.
 * <p>
 * The reminder pipeline reads it and writes a single column: {@code reminder_sent}.
 */
@Entity
@Table(name = "interviews", indexes = {
        @Index(name = "idx_interview_status_reminder_scheduled", columnList = "status, reminder_sent, scheduled_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Interview {

    @Id
    @Column(name = "id", length = 100)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "candidate_user_id", nullable = false)
    private UserAccount candidate;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "interviewer_user_id", nullable = false)
    private UserAccount interviewer;

    @Column(name = "applied_position", length = 200)
    private String appliedPosition;

    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    @Column(name = "duration_minutes", nullable = false)
    private Integer durationMinutes;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private InterviewType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private InterviewStatus status;

    @Column(name = "location", length = 500)
    private String location;

    @Column(name = "meeting_url", length = 1000)
    private String meetingUrl;

    @Column(name = "reminder_sent", nullable = false)
    @Builder.Default
    private boolean reminderSent = false;
}
