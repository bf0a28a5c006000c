package com.example.interviewreminder.service.handler;

import com.example.interviewreminder.domain.enums.ReminderOutcome;
import com.example.interviewreminder.service.queue.JobKey;
import com.example.interviewreminder.service.queue.ReminderPayload;

/**
 * Processing function registered with the reminder queue.
 * <p>
 * Handlers should:
 * - Be stateless
 * - Report business no-ops through the returned outcome
 * - Throw for transient failures so the queue retries the job
 * - Not manage the job's own state (handled by the executor)
 */
public interface ReminderJobHandler {

    /**
     * Process one job attempt.
     *
     * @param key     the job key, usable as a dedup token downstream
     * @param payload the interview and recipient role
     * @return why the job is complete
     * @throws RuntimeException on a transient failure
     */
    ReminderOutcome handle(JobKey key, ReminderPayload payload);
}
