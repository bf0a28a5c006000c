package com.example.interviewreminder.service.queue;

import com.example.interviewreminder.config.MetricsConfig;
import com.example.interviewreminder.config.ReminderQueueProperties;
import com.example.interviewreminder.domain.entity.ReminderJob;
import com.example.interviewreminder.domain.enums.JobState;
import com.example.interviewreminder.domain.repository.ReminderJobRepository;
import com.example.interviewreminder.service.alert.SlackAlertService;
import com.example.interviewreminder.service.handler.JobExecutionResult;
import com.example.interviewreminder.service.handler.ReminderJobHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.net.InetAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Claims reminder jobs and runs single attempts of them.
 * <p>
 * Handles:
 * - Job claiming through SKIP LOCKED plus an optimistic-locked update
 * - Handler invocation
 * - Completion with an outcome code
 * - Retry scheduling with the job's backoff
 * - Terminal failure with metrics and a Slack alert, optionally early for permanent rejections
 * <p>
 * {@link #execute} runs outside a transaction; the handler commits its own writes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReminderJobExecutor {

    private static final List<JobState> CLAIMABLE_STATES = List.of(JobState.WAITING, JobState.DELAYED);

    private final ReminderJobRepository jobRepository;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final ReminderQueueProperties properties;
    private final Clock clock;

    @Value("${HOSTNAME:unknown}")
    private String hostname;

    private String instanceId;

    /**
     * Unique id of this service instance, written to claimed jobs
     */
    String getInstanceId() {
        if (instanceId == null) {
            try {
                var host = InetAddress.getLocalHost().getHostName();
                instanceId = host + "-" + ProcessHandle.current().pid();
            } catch (Exception e) {
                instanceId = hostname + "-" + UUID.randomUUID().toString().substring(0, 8);
            }
        }
        return instanceId;
    }

    /**
     * Claim up to {@code limit} ready jobs, moving them to ACTIVE.
     *
     * @return ids of the jobs this instance now owns
     */
    @Transactional
    public List<UUID> claimReadyJobs(int limit) {
        var now = clock.instant();
        var lockUntil = now.plus(Duration.ofMinutes(properties.getLockDurationMinutes()));

        var candidates = jobRepository.findJobsReadyForClaim(now, limit);
        var claimed = new ArrayList<UUID>(candidates.size());

        for (var job : candidates) {
            var updated = jobRepository.claimJob(job.getId(), getInstanceId(), lockUntil, job.getVersion(), now, JobState.ACTIVE, CLAIMABLE_STATES);
            if (updated == 1) {
                claimed.add(job.getId());
            } else {
                log.debug("Failed to claim job {} (already claimed or version mismatch)", job.getJobKey());
            }
        }
        return claimed;
    }

    /**
     * Return jobs claimed by this instance to WAITING without running them.
     *
     * @return number of jobs released
     */
    @Transactional
    public int releaseClaimedJobs(List<UUID> jobIds) {
        if (jobIds.isEmpty()) {
            return 0;
        }
        var released = jobRepository.releaseClaimedJobs(jobIds, getInstanceId(), clock.instant(), JobState.ACTIVE, JobState.WAITING);
        log.info("Released {} claimed job(s) back to WAITING", released);
        return released;
    }

    /**
     * Run one attempt of a claimed job and record its result.
     *
     * @return true if the job completed
     */
    public boolean execute(UUID jobId, ReminderJobHandler handler) {
        var job = jobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.warn("Job {} no longer exists", jobId);
            return false;
        }
        if (job.getState() != JobState.ACTIVE) {
            log.warn("Job {} is {} instead of ACTIVE, skipping", job.getJobKey(), job.getState());
            return false;
        }

        log.info("Processing job {} (interview: {}, role: {}, attempt {}/{})",
                job.getJobKey(), job.getInterviewId(), job.getRecipientRole(), job.getAttemptsMade() + 1, job.getMaxAttempts());

        var timerSample = metricsConfig.startJobExecutionTimer();
        var startTime = clock.instant();

        JobExecutionResult result;
        try {
            var outcome = handler.handle(JobKey.of(job.getJobKey()), toPayload(job));
            result = JobExecutionResult.success(outcome);
        } catch (Exception e) {
            result = JobExecutionResult.failure(e);
        }

        var endTime = clock.instant();
        var durationMs = Duration.between(startTime, endTime).toMillis();
        job.setAttemptsMade(job.getAttemptsMade() + 1);
        job.setExecutionDurationMs(durationMs);

        try {
            if (result.isSuccess()) {
                handleSuccess(job, result, endTime, durationMs);
            } else {
                handleFailure(job, result, endTime);
            }
        } catch (ObjectOptimisticLockingFailureException e) {
            log.warn("Job {} was modified concurrently (likely reset as stalled), its result is discarded", job.getJobKey());
            return false;
        } finally {
            metricsConfig.recordJobExecution(timerSample, job.getRecipientRole(), result.isSuccess());
        }
        return result.isSuccess();
    }

    private void handleSuccess(ReminderJob job, JobExecutionResult result, Instant endTime, long durationMs) {
        log.info("Job {} completed in {}ms: {}", job.getJobKey(), durationMs, result.getOutcome().getDescription());

        job.setOutcome(result.getOutcome());
        job.setLastError(null);
        job.setLastErrorStackTrace(null);
        job.finish(JobState.COMPLETED, endTime);
        jobRepository.save(job);

        metricsConfig.recordOutcome(job.getRecipientRole(), result.getOutcome());
    }

    private void handleFailure(ReminderJob job, JobExecutionResult result, Instant endTime) {
        log.warn("Job {} attempt {}/{} failed: {}", job.getJobKey(), job.getAttemptsMade(), job.getMaxAttempts(), result.getErrorMessage());

        job.setLastError(result.getErrorMessage());
        job.setLastErrorStackTrace(result.getStackTrace());

        if (properties.isFailFastOnClientError() && !result.isRetryable()) {
            log.error("Job {} failed with a non-retryable error, skipping remaining attempts", job.getJobKey());
            handleAttemptsExhausted(job, result, endTime);
            return;
        }

        if (!job.hasAttemptsLeft()) {
            handleAttemptsExhausted(job, result, endTime);
            return;
        }

        scheduleRetry(job, endTime);
    }

    private void scheduleRetry(ReminderJob job, Instant now) {
        var backoff = Backoff.of(job.getBackoffType(), job.getBackoffDelayMs());
        var nextAttemptAt = now.plus(backoff.delayAfter(job.getAttemptsMade()));

        log.info("Scheduling attempt {} for job {} at {}", job.getAttemptsMade() + 1, job.getJobKey(), nextAttemptAt);

        job.setState(JobState.DELAYED);
        job.setAvailableAt(nextAttemptAt);
        job.releaseLock();
        jobRepository.save(job);

        metricsConfig.recordRetry(job.getRecipientRole(), job.getAttemptsMade());
    }

    private void handleAttemptsExhausted(ReminderJob job, JobExecutionResult result, Instant endTime) {
        log.error("Job {} failed after {} attempts: {}\n{}", job.getJobKey(), job.getAttemptsMade(), result.getErrorMessage(), result.getStackTrace());

        job.finish(JobState.FAILED, endTime);
        jobRepository.save(job);

        metricsConfig.recordJobFailed(job.getRecipientRole(), result.getErrorType());
        slackAlertService.sendJobFailedAlert(job);
    }

    private static ReminderPayload toPayload(ReminderJob job) {
        return ReminderPayload.builder()
                .interviewId(job.getInterviewId())
                .role(job.getRecipientRole())
                .origin(job.getOrigin())
                .build();
    }
}
