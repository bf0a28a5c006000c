package com.example.interviewreminder.service.queue;

import com.example.interviewreminder.config.MetricsConfig;
import com.example.interviewreminder.config.ReminderQueueProperties;
import com.example.interviewreminder.domain.entity.ReminderJob;
import com.example.interviewreminder.domain.enums.BackoffType;
import com.example.interviewreminder.domain.enums.JobOrigin;
import com.example.interviewreminder.domain.enums.JobState;
import com.example.interviewreminder.domain.enums.RecipientRole;
import com.example.interviewreminder.domain.repository.ReminderJobRepository;
import com.example.interviewreminder.service.handler.ReminderJobHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JpaReminderQueue Tests")
class JpaReminderQueueTest {

    private static final Instant NOW = Instant.parse("2024-06-10T09:00:00Z");

    @Mock
    private ReminderJobRepository jobRepository;

    @Mock
    private ReminderJobExecutor jobExecutor;

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private MetricsConfig metricsConfig;

    @Mock
    private ReminderJobHandler handler;

    @Captor
    private ArgumentCaptor<ReminderJob> jobCaptor;

    private ReminderQueueProperties properties;
    private ExecutorService workerExecutor;
    private JpaReminderQueue queue;

    @BeforeEach
    void setUp() {
        properties = new ReminderQueueProperties();
        workerExecutor = Executors.newFixedThreadPool(2);
        queue = new JpaReminderQueue(jobRepository, jobExecutor, properties, workerExecutor, transactionManager, metricsConfig,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        workerExecutor.shutdownNow();
    }

    @Nested
    @DisplayName("enqueue Tests")
    class EnqueueTests {

        @Test
        @DisplayName("Should insert a waiting job with the default retry policy")
        void shouldInsertWaitingJob() {
            // Given
            var key = JobKeyGenerator.scheduled("int-1", RecipientRole.CANDIDATE);
            var savedId = UUID.randomUUID();
            when(jobRepository.findByActiveKey("candidate-int-1")).thenReturn(Optional.empty());
            when(jobRepository.saveAndFlush(any(ReminderJob.class))).thenAnswer(inv -> {
                ReminderJob job = inv.getArgument(0);
                job.setId(savedId);
                return job;
            });

            // When
            var result = queue.enqueue(key, ReminderPayload.scheduled("int-1", RecipientRole.CANDIDATE));

            // Then
            assertThat(result.isDuplicate()).isFalse();
            assertThat(result.getJobId()).isEqualTo(savedId);
            assertThat(result.getJobKey()).isEqualTo("candidate-int-1");

            verify(jobRepository).saveAndFlush(jobCaptor.capture());
            var job = jobCaptor.getValue();
            assertThat(job.getState()).isEqualTo(JobState.WAITING);
            assertThat(job.getActiveKey()).isEqualTo("candidate-int-1");
            assertThat(job.getOrigin()).isEqualTo(JobOrigin.SCHEDULER);
            assertThat(job.getMaxAttempts()).isEqualTo(3);
            assertThat(job.getBackoffType()).isEqualTo(BackoffType.EXPONENTIAL);
            assertThat(job.getBackoffDelayMs()).isEqualTo(60000L);
            assertThat(job.getAvailableAt()).isEqualTo(NOW);

            verify(metricsConfig).recordEnqueue("scheduler", false);
        }

        @Test
        @DisplayName("Should honour explicit job options")
        void shouldHonourExplicitOptions() {
            // Given
            var key = JobKey.of("candidate-int-1");
            when(jobRepository.findByActiveKey("candidate-int-1")).thenReturn(Optional.empty());
            when(jobRepository.saveAndFlush(any(ReminderJob.class))).thenAnswer(inv -> inv.getArgument(0));

            // When
            queue.enqueue(key, ReminderPayload.scheduled("int-1", RecipientRole.CANDIDATE),
                    JobOptions.of(5, Backoff.fixed(Duration.ofSeconds(10))));

            // Then
            verify(jobRepository).saveAndFlush(jobCaptor.capture());
            assertThat(jobCaptor.getValue().getMaxAttempts()).isEqualTo(5);
            assertThat(jobCaptor.getValue().getBackoffType()).isEqualTo(BackoffType.FIXED);
            assertThat(jobCaptor.getValue().getBackoffDelayMs()).isEqualTo(10000L);
        }

        @Test
        @DisplayName("Should not insert a job whose key is still pending")
        void shouldSkipPendingKey() {
            // Given
            var existingId = UUID.randomUUID();
            var existing = ReminderJob.builder().id(existingId).jobKey("candidate-int-1").build();
            when(jobRepository.findByActiveKey("candidate-int-1")).thenReturn(Optional.of(existing));

            // When
            var result = queue.enqueue(JobKey.of("candidate-int-1"), ReminderPayload.scheduled("int-1", RecipientRole.CANDIDATE));

            // Then
            assertThat(result.isDuplicate()).isTrue();
            assertThat(result.getJobId()).isEqualTo(existingId);
            verify(jobRepository, never()).saveAndFlush(any());
            verify(metricsConfig).recordEnqueue("scheduler", true);
        }

        @Test
        @DisplayName("Should report a duplicate when a concurrent enqueue wins the unique key")
        void shouldReportDuplicateOnConstraintViolation() {
            // Given
            var winnerId = UUID.randomUUID();
            var winner = ReminderJob.builder().id(winnerId).jobKey("candidate-int-1").build();
            when(jobRepository.findByActiveKey("candidate-int-1"))
                    .thenReturn(Optional.empty())
                    .thenReturn(Optional.of(winner));
            when(jobRepository.saveAndFlush(any(ReminderJob.class)))
                    .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint \"uk_job_active_key\""));

            // When
            var result = queue.enqueue(JobKey.of("candidate-int-1"), ReminderPayload.scheduled("int-1", RecipientRole.CANDIDATE));

            // Then
            assertThat(result.isDuplicate()).isTrue();
            assertThat(result.getJobId()).isEqualTo(winnerId);
        }
    }

    @Nested
    @DisplayName("stats Tests")
    class StatsTests {

        @Test
        @DisplayName("Should report counts per state with zero for missing states")
        void shouldReportCounts() {
            // Given
            when(jobRepository.countJobsGroupedByState()).thenReturn(List.of(
                    new Object[]{JobState.WAITING, 4L},
                    new Object[]{JobState.COMPLETED, 10L},
                    new Object[]{JobState.DELAYED, 1L}
            ));

            // When
            var stats = queue.stats();

            // Then
            assertThat(stats.getWaiting()).isEqualTo(4);
            assertThat(stats.getActive()).isZero();
            assertThat(stats.getCompleted()).isEqualTo(10);
            assertThat(stats.getFailed()).isZero();
            assertThat(stats.getDelayed()).isEqualTo(1);
            assertThat(stats.total()).isEqualTo(15);
        }
    }

    @Nested
    @DisplayName("prune Tests")
    class PruneTests {

        @Test
        @DisplayName("Should delete finished jobs beyond the retention caps")
        void shouldDeleteBeyondCaps() {
            // Given
            var completedIds = List.of(UUID.randomUUID(), UUID.randomUUID());
            var failedIds = List.of(UUID.randomUUID());
            when(jobRepository.findJobIdsBeyondRetention("COMPLETED", 100)).thenReturn(completedIds);
            when(jobRepository.findJobIdsBeyondRetention("FAILED", 50)).thenReturn(failedIds);

            // When
            var removed = queue.prune();

            // Then
            assertThat(removed).isEqualTo(3);
            verify(jobRepository).deleteAllByIdInBatch(completedIds);
            verify(jobRepository).deleteAllByIdInBatch(failedIds);
        }

        @Test
        @DisplayName("Should delete nothing within the caps")
        void shouldDeleteNothingWithinCaps() {
            // Given
            when(jobRepository.findJobIdsBeyondRetention("COMPLETED", 100)).thenReturn(List.of());
            when(jobRepository.findJobIdsBeyondRetention("FAILED", 50)).thenReturn(List.of());

            // When
            var removed = queue.prune();

            // Then
            assertThat(removed).isZero();
            verify(jobRepository, never()).deleteAllByIdInBatch(any());
        }
    }

    @Nested
    @DisplayName("Consuming Tests")
    class ConsumingTests {

        @Test
        @DisplayName("Should not claim jobs before a handler is registered")
        void shouldNotPollWithoutHandler() {
            // When
            queue.pollAndProcess();

            // Then
            verify(jobExecutor, never()).claimReadyJobs(anyInt());
        }

        @Test
        @DisplayName("Should run claimed jobs with the registered handler")
        void shouldRunClaimedJobs() {
            // Given
            var first = UUID.randomUUID();
            var second = UUID.randomUUID();
            queue.consume(handler);
            when(jobExecutor.claimReadyJobs(50)).thenReturn(List.of(first, second));
            when(jobExecutor.execute(first, handler)).thenReturn(true);
            when(jobExecutor.execute(second, handler)).thenReturn(false);

            // When
            queue.pollAndProcess();

            // Then
            verify(jobExecutor).execute(first, handler);
            verify(jobExecutor).execute(second, handler);
            verify(jobRepository).findJobIdsBeyondRetention("COMPLETED", 100);
        }

        @Test
        @DisplayName("Should stop claiming once closed")
        void shouldStopClaimingWhenClosed() {
            // Given
            queue.consume(handler);

            // When
            var drained = queue.close(Duration.ofSeconds(1));
            queue.pollAndProcess();

            // Then
            assertThat(drained).isTrue();
            assertThat(queue.isConsuming()).isFalse();
            verify(jobExecutor, never()).claimReadyJobs(anyInt());
        }

        @Test
        @DisplayName("Close should wait for in-flight jobs")
        void closeShouldWaitForInFlightJobs() throws Exception {
            // Given
            var jobId = UUID.randomUUID();
            var started = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            queue.consume(handler);
            when(jobExecutor.claimReadyJobs(50)).thenReturn(List.of(jobId));
            when(jobExecutor.execute(jobId, handler)).thenAnswer(inv -> {
                started.countDown();
                release.await(5, TimeUnit.SECONDS);
                return true;
            });
            var poller = Executors.newSingleThreadExecutor();
            try {
                poller.submit(queue::pollAndProcess);
                assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

                // When
                var timedOut = queue.close(Duration.ofMillis(50));
                release.countDown();
                var drained = queue.close(Duration.ofSeconds(5));

                // Then
                assertThat(timedOut).isFalse();
                assertThat(drained).isTrue();
            } finally {
                poller.shutdownNow();
            }
        }

        @Test
        @DisplayName("Close should wait for a claiming cycle and hand its jobs back unrun")
        void closeShouldReleaseJobsClaimedAfterClose() throws Exception {
            // Given
            var jobId = UUID.randomUUID();
            var claiming = new CountDownLatch(1);
            var finishClaim = new CountDownLatch(1);
            queue.consume(handler);
            when(jobExecutor.claimReadyJobs(50)).thenAnswer(inv -> {
                claiming.countDown();
                finishClaim.await(5, TimeUnit.SECONDS);
                return List.of(jobId);
            });
            var poller = Executors.newSingleThreadExecutor();
            try {
                poller.submit(queue::pollAndProcess);
                assertThat(claiming.await(5, TimeUnit.SECONDS)).isTrue();

                // When
                var timedOut = queue.close(Duration.ofMillis(100));
                finishClaim.countDown();
                var drained = queue.close(Duration.ofSeconds(5));

                // Then
                assertThat(timedOut).isFalse();
                assertThat(drained).isTrue();
                verify(jobExecutor).releaseClaimedJobs(List.of(jobId));
                verify(jobExecutor, never()).execute(any(), any());
            } finally {
                poller.shutdownNow();
            }
        }

        @Test
        @DisplayName("Should reject a null handler")
        void shouldRejectNullHandler() {
            assertThatThrownBy(() -> queue.consume(null)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Stall Recovery Tests")
    class StallRecoveryTests {

        @Test
        @DisplayName("Should return stalled jobs to waiting")
        void shouldResetStalledJobs() {
            // Given
            var stalled = ReminderJob.builder()
                    .id(UUID.randomUUID())
                    .jobKey("interviewer-int-2")
                    .state(JobState.ACTIVE)
                    .lockedBy("host-gone")
                    .lockedUntil(NOW.minusSeconds(30))
                    .build();
            queue.consume(handler);
            when(jobRepository.findStalledJobs(NOW, JobState.ACTIVE)).thenReturn(List.of(stalled));
            when(jobRepository.resetStalledJobs(List.of(stalled.getId()), NOW, JobState.WAITING)).thenReturn(1);

            // When
            queue.recoverStalledJobs();

            // Then
            verify(jobRepository).resetStalledJobs(List.of(stalled.getId()), NOW, JobState.WAITING);
            verify(metricsConfig).recordStalled(1);
        }

        @Test
        @DisplayName("Should leave jobs alone while not consuming")
        void shouldSkipWhenNotConsuming() {
            // When
            queue.recoverStalledJobs();

            // Then
            verify(jobRepository, never()).findStalledJobs(any(), any());
        }
    }
}
