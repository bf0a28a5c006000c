package com.example.interviewreminder.config;

import com.example.interviewreminder.domain.enums.BackoffType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the reminder job queue.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "reminder.queue")
public class ReminderQueueProperties {

    /**
     * Polling interval in milliseconds for claiming ready jobs
     */
    @Min(100)
    private long pollIntervalMs = 5000;

    /**
     * Maximum number of jobs claimed per poll cycle
     */
    @Min(1)
    private int batchSize = 50;

    /**
     * Number of worker threads running jobs concurrently
     */
    @Min(1)
    private int concurrency = 5;

    /**
     * Default attempts per job, first attempt included
     */
    @Min(1)
    private int maxAttempts = 3;

    @NotNull
    private BackoffType backoffType = BackoffType.EXPONENTIAL;

    /**
     * Base backoff delay in milliseconds
     */
    @Min(0)
    private long backoffDelayMs = 60000;

    /**
     * Number of completed jobs kept for inspection
     */
    @Min(0)
    private int removeOnComplete = 100;

    /**
     * Number of failed jobs kept for inspection
     */
    @Min(0)
    private int removeOnFail = 50;

    /**
     * How long a claimed job stays locked before it counts as stalled
     */
    @Min(1)
    private int lockDurationMinutes = 5;

    /**
     * Fail a job on its first permanent rejection (4xx other than 408/429) instead of
     * spending the remaining attempts. Off by default: every handler error is retried.
     */
    private boolean failFastOnClientError = false;

    @Min(1000)
    private long stalledCheckIntervalMs = 30000;

    /**
     * Wait for in-flight jobs on shutdown
     */
    @Min(0)
    private int shutdownTimeoutSeconds = 30;
}
