package com.example.interviewreminder.domain.entity;

import com.example.interviewreminder.domain.enums.BackoffType;
import com.example.interviewreminder.domain.enums.JobOrigin;
import com.example.interviewreminder.domain.enums.JobState;
import com.example.interviewreminder.domain.enums.RecipientRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ReminderJob Entity Tests")
class ReminderJobTest {

    private ReminderJob job;

    @BeforeEach
    void setUp() {
        job = ReminderJob.builder()
                .jobKey("candidate-int-1")
                .interviewId("int-1")
                .recipientRole(RecipientRole.CANDIDATE)
                .origin(JobOrigin.SCHEDULER)
                .maxAttempts(3)
                .backoffType(BackoffType.EXPONENTIAL)
                .backoffDelayMs(60000L)
                .build();
    }

    @Nested
    @DisplayName("onCreate Tests")
    class OnCreateTests {

        @Test
        @DisplayName("Should default to WAITING and hold its key while pending")
        void shouldApplyDefaults() {
            // When
            job.onCreate();

            // Then
            assertThat(job.getState()).isEqualTo(JobState.WAITING);
            assertThat(job.getAttemptsMade()).isZero();
            assertThat(job.getActiveKey()).isEqualTo("candidate-int-1");
            assertThat(job.getAvailableAt()).isEqualTo(job.getCreatedAt());
        }

        @Test
        @DisplayName("Should keep an explicit creation time")
        void shouldKeepExplicitCreatedAt() {
            // Given
            var createdAt = Instant.parse("2024-06-10T09:00:00Z");
            job.setCreatedAt(createdAt);

            // When
            job.onCreate();

            // Then
            assertThat(job.getCreatedAt()).isEqualTo(createdAt);
            assertThat(job.getAvailableAt()).isEqualTo(createdAt);
        }
    }

    @Nested
    @DisplayName("hasAttemptsLeft Tests")
    class HasAttemptsLeftTests {

        @Test
        @DisplayName("Should have attempts left below the maximum")
        void shouldHaveAttemptsLeft() {
            job.setAttemptsMade(2);

            assertThat(job.hasAttemptsLeft()).isTrue();
        }

        @Test
        @DisplayName("Should have no attempts left at the maximum")
        void shouldHaveNoAttemptsLeft() {
            job.setAttemptsMade(3);

            assertThat(job.hasAttemptsLeft()).isFalse();
        }
    }

    @Nested
    @DisplayName("finish Tests")
    class FinishTests {

        @Test
        @DisplayName("Should release the key and the lock when finished")
        void shouldReleaseKeyAndLock() {
            // Given
            var finishedAt = Instant.parse("2024-06-10T09:00:00Z");
            job.onCreate();
            job.setState(JobState.ACTIVE);
            job.setLockedBy("host-1");
            job.setLockedUntil(finishedAt.plusSeconds(300));

            // When
            job.finish(JobState.COMPLETED, finishedAt);

            // Then
            assertThat(job.getState()).isEqualTo(JobState.COMPLETED);
            assertThat(job.getFinishedAt()).isEqualTo(finishedAt);
            assertThat(job.getActiveKey()).isNull();
            assertThat(job.getJobKey()).isEqualTo("candidate-int-1");
            assertThat(job.getLockedBy()).isNull();
            assertThat(job.getLockedUntil()).isNull();
        }

        @Test
        @DisplayName("Should reject a non-terminal target state")
        void shouldRejectNonTerminalState() {
            assertThatThrownBy(() -> job.finish(JobState.DELAYED, Instant.now()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
