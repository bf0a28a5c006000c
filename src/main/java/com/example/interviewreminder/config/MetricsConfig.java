package com.example.interviewreminder.config;

import com.example.interviewreminder.domain.enums.JobState;
import com.example.interviewreminder.domain.enums.RecipientRole;
import com.example.interviewreminder.domain.enums.ReminderOutcome;
import com.example.interviewreminder.domain.repository.ReminderJobRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the reminder pipeline.
 * <p>
 * Exposes Prometheus metrics for:
 * - Job counts by state
 * - Execution times
 * - Outcomes, retries and terminal failures
 * - Scheduler tick errors
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final ReminderJobRepository jobRepository;

    private final Map<JobState, AtomicLong> jobCounts = new EnumMap<>(JobState.class);

    @PostConstruct
    public void initializeMetrics() {
        for (var state : JobState.values()) {
            var holder = new AtomicLong(0);
            jobCounts.put(state, holder);

            Gauge.builder("reminder_queue_jobs", holder, AtomicLong::get)
                    .tag("state", state.getCode())
                    .description("Number of reminder jobs by state")
                    .register(meterRegistry);
        }
    }

    /**
     * Periodically refresh gauge metrics from the database
     */
    @Scheduled(fixedDelayString = "${reminder.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        for (var state : JobState.values()) {
            jobCounts.get(state).set(jobRepository.countByState(state));
        }
    }

    public Timer.Sample startJobExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordJobExecution(Timer.Sample sample, RecipientRole role, boolean success) {
        sample.stop(Timer.builder("reminder_job_execution_time")
                .tag("role", role.getCode())
                .tag("success", String.valueOf(success))
                .description("Reminder job execution time")
                .register(meterRegistry));
    }

    /**
     * Enqueue attempts, tagged by origin and whether the key was already pending
     */
    public void recordEnqueue(String origin, boolean duplicate) {
        meterRegistry.counter("reminder_queue_enqueued",
                "origin", origin,
                "duplicate", String.valueOf(duplicate)
        ).increment();
    }

    public void recordOutcome(RecipientRole role, ReminderOutcome outcome) {
        meterRegistry.counter("reminder_job_outcomes",
                "role", role.getCode(),
                "outcome", outcome.getCode()
        ).increment();
    }

    public void recordRetry(RecipientRole role, int attemptNumber) {
        meterRegistry.counter("reminder_job_retries",
                "role", role.getCode(),
                "attempt", String.valueOf(attemptNumber)
        ).increment();
    }

    public void recordJobFailed(RecipientRole role, String errorType) {
        meterRegistry.counter("reminder_job_failures",
                "role", role.getCode(),
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    public void recordStalled(int count) {
        meterRegistry.counter("reminder_job_stalled").increment(count);
    }

    public void recordTickError(String errorType) {
        meterRegistry.counter("reminder_scheduler_tick_errors",
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    /**
     * The reminder went out but the interview flag could not be set
     */
    public void recordFlagUpdateFailure() {
        meterRegistry.counter("reminder_flag_update_failures").increment();
    }
}
