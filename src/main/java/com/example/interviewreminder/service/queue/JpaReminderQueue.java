package com.example.interviewreminder.service.queue;

import com.example.interviewreminder.config.MetricsConfig;
import com.example.interviewreminder.config.ReminderQueueProperties;
import com.example.interviewreminder.domain.entity.ReminderJob;
import com.example.interviewreminder.domain.enums.JobState;
import com.example.interviewreminder.domain.repository.ReminderJobRepository;
import com.example.interviewreminder.service.handler.ReminderJobHandler;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ReminderQueue} stored in the {@code reminder_jobs} table.
 * <p>
 * Flow:
 * 1. Poll job runs on schedule while a handler is registered
 * 2. Claims a batch of ready jobs using FOR UPDATE SKIP LOCKED
 * 3. Dispatches each job to the bounded worker pool
 * 4. Prunes terminal jobs beyond the retention caps once the batch is done
 * <p>
 * A second periodic job returns stalled jobs (ACTIVE with an expired lock) to WAITING.
 * <p>
 * {@link #close} waits for the current poll cycle as well as the jobs it dispatched.
 * A cycle that finishes claiming after close began hands its jobs back to WAITING.
 */
@Slf4j
@Service
public class JpaReminderQueue implements ReminderQueue {

    private final ReminderJobRepository jobRepository;
    private final ReminderJobExecutor jobExecutor;
    private final ReminderQueueProperties properties;
    private final ExecutorService workerExecutor;
    private final TransactionTemplate transactionTemplate;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final AtomicBoolean isPolling = new AtomicBoolean(false);
    private final Set<CompletableFuture<Boolean>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile CompletableFuture<Void> pollCycle = CompletableFuture.completedFuture(null);

    private volatile ReminderJobHandler handler;

    public JpaReminderQueue(ReminderJobRepository jobRepository, ReminderJobExecutor jobExecutor, ReminderQueueProperties properties,
                            @Qualifier("reminderWorkerExecutor") ExecutorService workerExecutor,
                            PlatformTransactionManager transactionManager, MetricsConfig metricsConfig, Clock clock) {
        this.jobRepository = jobRepository;
        this.jobExecutor = jobExecutor;
        this.properties = properties;
        this.workerExecutor = workerExecutor;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Override
    public EnqueueResult enqueue(JobKey key, ReminderPayload payload) {
        return enqueue(key, payload, JobOptions.from(properties));
    }

    @Override
    public EnqueueResult enqueue(JobKey key, ReminderPayload payload, JobOptions options) {
        var existing = jobRepository.findByActiveKey(key.getValue());
        if (existing.isPresent()) {
            return duplicate(key, payload, existing.get().getId());
        }

        var now = clock.instant();
        var job = ReminderJob.builder()
                .jobKey(key.getValue())
                .activeKey(key.getValue())
                .state(JobState.WAITING)
                .interviewId(payload.getInterviewId())
                .recipientRole(payload.getRole())
                .origin(payload.getOrigin())
                .attemptsMade(0)
                .maxAttempts(options.getAttempts())
                .backoffType(options.getBackoff().getType())
                .backoffDelayMs(options.getBackoff().getDelayMs())
                .availableAt(now)
                .createdAt(now)
                .build();

        try {
            var saved = transactionTemplate.execute(status -> jobRepository.saveAndFlush(job));
            log.info("Enqueued job {} for interview {} ({})", key, payload.getInterviewId(), payload.getOrigin());
            metricsConfig.recordEnqueue(payload.getOrigin().name().toLowerCase(), false);
            return EnqueueResult.created(saved.getId(), key);
        } catch (DataIntegrityViolationException e) {
            // lost the race on uk_job_active_key
            var winner = jobRepository.findByActiveKey(key.getValue()).map(ReminderJob::getId).orElse(null);
            return duplicate(key, payload, winner);
        }
    }

    private EnqueueResult duplicate(JobKey key, ReminderPayload payload, UUID existingId) {
        log.debug("Job {} is already pending as {}, not enqueued again", key, existingId);
        metricsConfig.recordEnqueue(payload.getOrigin().name().toLowerCase(), true);
        return EnqueueResult.duplicate(existingId, key);
    }

    @Override
    public void consume(ReminderJobHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("Handler is required");
        }
        this.handler = handler;
        log.info("Reminder queue consuming with concurrency {}", properties.getConcurrency());
    }

    @Override
    public boolean close(Duration timeout) {
        this.handler = null;

        var cycle = pollCycle;
        var pending = new ArrayList<CompletableFuture<?>>(inFlight);
        if (pending.isEmpty() && cycle.isDone()) {
            return true;
        }
        pending.add(cycle);

        log.info("Waiting up to {}s for the poll cycle and {} in-flight jobs", timeout.toSeconds(), inFlight.size());
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("Poll cycle running: {}, {} jobs still running after {}s, stall recovery will pick them up",
                    !pollCycle.isDone(), inFlight.size(), timeout.toSeconds());
            return false;
        } catch (ExecutionException e) {
            // job errors are recorded by the executor
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isConsuming() {
        return handler != null;
    }

    /**
     * Main polling job: claims ready jobs and runs them on the worker pool.
     */
    @Scheduled(fixedDelayString = "${reminder.queue.poll-interval-ms:5000}")
    @SchedulerLock(name = "reminderQueuePoll", lockAtMostFor = "10m")
    public void pollAndProcess() {
        var currentHandler = handler;
        if (currentHandler == null) {
            return;
        }
        if (!isPolling.compareAndSet(false, true)) {
            log.debug("Previous polling cycle still running, skipping");
            return;
        }
        var cycle = new CompletableFuture<Void>();
        pollCycle = cycle;

        try {
            var jobIds = jobExecutor.claimReadyJobs(properties.getBatchSize());

            if (jobIds.isEmpty()) {
                log.debug("No reminder jobs ready");
                return;
            }

            if (handler == null) {
                log.info("Queue closed while claiming, releasing {} reminder jobs", jobIds.size());
                jobExecutor.releaseClaimedJobs(jobIds);
                return;
            }

            log.info("Claimed {} reminder jobs", jobIds.size());

            var futures = jobIds.stream()
                    .map(jobId -> submit(jobId, currentHandler))
                    .toList();

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .orTimeout(properties.getLockDurationMinutes(), TimeUnit.MINUTES)
                    .exceptionally(ex -> {
                        log.error("Error waiting for job completion: {}", ex.getMessage());
                        return null;
                    })
                    .join();

            var completed = futures.stream()
                    .filter(f -> f.isDone() && !f.isCompletedExceptionally() && f.join())
                    .count();

            log.info("Processed {} reminder jobs, {} completed", jobIds.size(), completed);

            prune();
        } catch (Exception e) {
            log.error("Error in reminder polling cycle: {}", e.getMessage(), e);
        } finally {
            isPolling.set(false);
            cycle.complete(null);
        }
    }

    private CompletableFuture<Boolean> submit(UUID jobId, ReminderJobHandler jobHandler) {
        // tracked before it can start, so close() always sees it
        var future = new CompletableFuture<Boolean>();
        inFlight.add(future);
        future.whenComplete((result, ex) -> inFlight.remove(future));
        try {
            workerExecutor.execute(() -> future.complete(processJob(jobId, jobHandler)));
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool rejected job {}, stall recovery will pick it up", jobId);
            future.completeExceptionally(e);
        }
        return future;
    }

    private boolean processJob(UUID jobId, ReminderJobHandler jobHandler) {
        try {
            return jobExecutor.execute(jobId, jobHandler);
        } catch (Exception e) {
            log.error("Error processing job {}: {}", jobId, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Return ACTIVE jobs with an expired lock to WAITING.
     * <p>
     * Jobs stall when an instance crashes or is stopped mid-job. The attempt is not counted.
     */
    @Scheduled(fixedDelayString = "${reminder.queue.stalled-check-interval-ms:30000}")
    @SchedulerLock(name = "reminderStalledJobCheck", lockAtLeastFor = "5s", lockAtMostFor = "5m")
    public void recoverStalledJobs() {
        if (handler == null) {
            return;
        }

        try {
            var now = clock.instant();
            var stalled = jobRepository.findStalledJobs(now, JobState.ACTIVE);

            if (stalled.isEmpty()) {
                return;
            }

            stalled.forEach(job -> log.warn("Job {} stalled (locked by {} until {})", job.getJobKey(), job.getLockedBy(), job.getLockedUntil()));

            var ids = stalled.stream().map(ReminderJob::getId).toList();
            var reset = transactionTemplate.execute(status -> jobRepository.resetStalledJobs(ids, now, JobState.WAITING));

            metricsConfig.recordStalled(reset != null ? reset : 0);
            log.info("Returned {} stalled jobs to the waiting list", reset);
        } catch (Exception e) {
            log.error("Error recovering stalled jobs: {}", e.getMessage(), e);
        }
    }

    @Override
    public QueueStats stats() {
        var counts = new EnumMap<JobState, Long>(JobState.class);
        for (var row : jobRepository.countJobsGroupedByState()) {
            counts.put((JobState) row[0], (Long) row[1]);
        }

        return QueueStats.builder()
                .waiting(counts.getOrDefault(JobState.WAITING, 0L))
                .active(counts.getOrDefault(JobState.ACTIVE, 0L))
                .completed(counts.getOrDefault(JobState.COMPLETED, 0L))
                .failed(counts.getOrDefault(JobState.FAILED, 0L))
                .delayed(counts.getOrDefault(JobState.DELAYED, 0L))
                .build();
    }

    @Override
    public int prune() {
        var removed = prune(JobState.COMPLETED, properties.getRemoveOnComplete())
                + prune(JobState.FAILED, properties.getRemoveOnFail());
        if (removed > 0) {
            log.debug("Pruned {} finished reminder jobs", removed);
        }
        return removed;
    }

    private int prune(JobState state, int keep) {
        var ids = jobRepository.findJobIdsBeyondRetention(state.name(), keep);
        if (ids.isEmpty()) {
            return 0;
        }
        jobRepository.deleteAllByIdInBatch(ids);
        return ids.size();
    }
}
