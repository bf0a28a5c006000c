package com.example.interviewreminder.service.queue;

import com.example.interviewreminder.service.handler.ReminderJobHandler;

import java.time.Duration;

/**
 * Durable queue of reminder jobs with deduplication, retries and retention.
 */
public interface ReminderQueue {

    /**
     * Add a job unless a job with the same key is still waiting, active or delayed.
     * Safe against concurrent callers using the same key.
     */
    EnqueueResult enqueue(JobKey key, ReminderPayload payload, JobOptions options);

    /**
     * Add a job with the configured default retry policy
     */
    EnqueueResult enqueue(JobKey key, ReminderPayload payload);

    /**
     * Register the function that processes jobs. Jobs are claimed only while a
     * handler is registered.
     */
    void consume(ReminderJobHandler handler);

    /**
     * Stop claiming jobs and wait up to {@code timeout} for in-flight jobs.
     *
     * @return true if every in-flight job finished in time
     */
    boolean close(Duration timeout);

    QueueStats stats();

    /**
     * Drop terminal jobs beyond the retention caps.
     *
     * @return number of jobs deleted
     */
    int prune();
}
