package com.example.interviewreminder.service.scheduler;

import com.example.interviewreminder.config.MetricsConfig;
import com.example.interviewreminder.config.ReminderSchedulerProperties;
import com.example.interviewreminder.domain.enums.InterviewStatus;
import com.example.interviewreminder.domain.enums.JobOrigin;
import com.example.interviewreminder.domain.enums.RecipientRole;
import com.example.interviewreminder.service.ReminderPipelineLifecycle;
import com.example.interviewreminder.service.alert.SlackAlertService;
import com.example.interviewreminder.service.queue.EnqueueResult;
import com.example.interviewreminder.service.queue.JobKey;
import com.example.interviewreminder.service.queue.ReminderPayload;
import com.example.interviewreminder.service.queue.ReminderQueue;
import com.example.interviewreminder.store.InterviewDetails;
import com.example.interviewreminder.store.InterviewStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReminderScheduler Tests")
class ReminderSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-06-10T09:00:00Z");

    @Mock
    private InterviewStore interviewStore;

    @Mock
    private ReminderQueue reminderQueue;

    @Mock
    private ReminderPipelineLifecycle lifecycle;

    @Mock
    private MetricsConfig metricsConfig;

    @Mock
    private SlackAlertService slackAlertService;

    private ReminderScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ReminderScheduler(interviewStore, reminderQueue, lifecycle, new ReminderSchedulerProperties(),
                metricsConfig, slackAlertService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static InterviewDetails interview(String id) {
        return InterviewDetails.builder()
                .id(id)
                .scheduledAt(NOW.plusSeconds(24 * 3600))
                .status(InterviewStatus.SCHEDULED)
                .build();
    }

    @Nested
    @DisplayName("tick Tests")
    class TickTests {

        @Test
        @DisplayName("Should query interviews between 23 and 25 hours from now")
        void shouldQueryWindowAroundLeadTime() {
            // Given
            when(lifecycle.isRunning()).thenReturn(true);
            when(interviewStore.findInterviewsInWindow(any(), any(), any())).thenReturn(List.of());

            // When
            var result = scheduler.tick();

            // Then
            verify(interviewStore).findInterviewsInWindow(InterviewStatus.SCHEDULED,
                    Instant.parse("2024-06-11T08:00:00Z"), Instant.parse("2024-06-11T10:00:00Z"));
            assertThat(result.getFound()).isZero();
            assertThat(result.getEnqueued()).isZero();
            assertThat(result.isFailed()).isFalse();
        }

        @Test
        @DisplayName("Should enqueue one job per participant with stable keys")
        void shouldEnqueueJobPerParticipant() {
            // Given
            when(lifecycle.isRunning()).thenReturn(true);
            when(interviewStore.findInterviewsInWindow(any(), any(), any()))
                    .thenReturn(List.of(interview("int-1"), interview("int-2")));
            when(reminderQueue.enqueue(any(JobKey.class), any(ReminderPayload.class)))
                    .thenAnswer(inv -> EnqueueResult.created(UUID.randomUUID(), inv.getArgument(0)));

            // When
            var result = scheduler.tick();

            // Then
            var keyCaptor = ArgumentCaptor.forClass(JobKey.class);
            var payloadCaptor = ArgumentCaptor.forClass(ReminderPayload.class);
            verify(reminderQueue, times(4)).enqueue(keyCaptor.capture(), payloadCaptor.capture());

            assertThat(keyCaptor.getAllValues()).extracting(JobKey::getValue)
                    .containsExactly("candidate-int-1", "interviewer-int-1", "candidate-int-2", "interviewer-int-2");
            assertThat(payloadCaptor.getAllValues()).extracting(ReminderPayload::getOrigin).containsOnly(JobOrigin.SCHEDULER);
            assertThat(payloadCaptor.getAllValues().get(1).getRole()).isEqualTo(RecipientRole.INTERVIEWER);

            assertThat(result.getFound()).isEqualTo(2);
            assertThat(result.getEnqueued()).isEqualTo(4);
            assertThat(result.getDuplicates()).isZero();
        }

        @Test
        @DisplayName("Should count jobs that are already pending as duplicates")
        void shouldCountDuplicates() {
            // Given
            when(lifecycle.isRunning()).thenReturn(true);
            when(interviewStore.findInterviewsInWindow(any(), any(), any())).thenReturn(List.of(interview("int-1")));
            when(reminderQueue.enqueue(any(JobKey.class), any(ReminderPayload.class)))
                    .thenAnswer(inv -> EnqueueResult.duplicate(UUID.randomUUID(), inv.getArgument(0)));

            // When
            var result = scheduler.tick();

            // Then
            assertThat(result.getFound()).isEqualTo(1);
            assertThat(result.getEnqueued()).isZero();
            assertThat(result.getDuplicates()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should not scan while the pipeline is stopped")
        void shouldSkipWhenStopped() {
            // Given
            when(lifecycle.isRunning()).thenReturn(false);

            // When
            var result = scheduler.tick();

            // Then
            assertThat(result.isSkipped()).isTrue();
            verifyNoInteractions(interviewStore, reminderQueue);
        }
    }

    @Nested
    @DisplayName("Error Handling Tests")
    class ErrorHandlingTests {

        @Test
        @DisplayName("Should report a failed scan without throwing")
        void shouldReportFailedScan() {
            // Given
            when(lifecycle.isRunning()).thenReturn(true);
            when(interviewStore.findInterviewsInWindow(any(), any(), any()))
                    .thenThrow(new QueryTimeoutException("canceling statement due to statement timeout"));

            // When
            var result = scheduler.tick();

            // Then
            assertThat(result.isFailed()).isTrue();
            verify(metricsConfig).recordTickError("QueryTimeoutException");
            verify(slackAlertService).sendErrorAlert(eq("Interview reminder scan failed"), contains("statement timeout"), anyString());
            verify(reminderQueue, never()).enqueue(any(JobKey.class), any(ReminderPayload.class));
        }

        @Test
        @DisplayName("Should keep counts of jobs enqueued before the failure")
        void shouldKeepPartialCounts() {
            // Given
            when(lifecycle.isRunning()).thenReturn(true);
            when(interviewStore.findInterviewsInWindow(any(), any(), any())).thenReturn(List.of(interview("int-1")));
            when(reminderQueue.enqueue(any(JobKey.class), any(ReminderPayload.class)))
                    .thenAnswer(inv -> EnqueueResult.created(UUID.randomUUID(), inv.getArgument(0)))
                    .thenThrow(new IllegalStateException("connection closed"));

            // When
            var result = scheduler.tick();

            // Then
            assertThat(result.isFailed()).isTrue();
            assertThat(result.getFound()).isEqualTo(1);
            assertThat(result.getEnqueued()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should run normally on the tick after a failure")
        void shouldRecoverOnNextTick() {
            // Given
            when(lifecycle.isRunning()).thenReturn(true);
            when(interviewStore.findInterviewsInWindow(any(), any(), any()))
                    .thenThrow(new IllegalStateException("database unavailable"))
                    .thenReturn(List.of());

            // When
            var first = scheduler.tick();
            var second = scheduler.tick();

            // Then
            assertThat(first.isFailed()).isTrue();
            assertThat(second.isFailed()).isFalse();
            assertThat(second.isSkipped()).isFalse();
        }
    }
}
