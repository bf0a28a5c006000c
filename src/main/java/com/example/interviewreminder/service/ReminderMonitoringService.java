package com.example.interviewreminder.service;

import com.example.interviewreminder.domain.enums.JobState;
import com.example.interviewreminder.domain.enums.RecipientRole;
import com.example.interviewreminder.domain.repository.ReminderJobRepository;
import com.example.interviewreminder.dto.ReminderJobResponse;
import com.example.interviewreminder.exception.JobNotFoundException;
import com.example.interviewreminder.mapper.ReminderJobMapper;
import com.example.interviewreminder.service.queue.EnqueueResult;
import com.example.interviewreminder.service.queue.JobKeyGenerator;
import com.example.interviewreminder.service.queue.QueueStats;
import com.example.interviewreminder.service.queue.ReminderPayload;
import com.example.interviewreminder.service.queue.ReminderQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Operational entry points of the reminder pipeline.
 * <p>
 * Provides:
 * - Queue statistics
 * - Manual reminders that bypass deduplication and the already-sent check
 * - Job inspection by id, interview and state
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReminderMonitoringService {

    private final ReminderQueue reminderQueue;
    private final ReminderJobRepository jobRepository;
    private final JobKeyGenerator jobKeyGenerator;
    private final ReminderJobMapper jobMapper;

    public QueueStats getStats() {
        return reminderQueue.stats();
    }

    /**
     * Enqueue a reminder for every participant right away.
     * <p>
     * Keys are unique per call, so repeated calls send repeated reminders.
     * The interview is not looked up here; a missing one ends the job as NOT_FOUND.
     */
    public List<EnqueueResult> sendManualReminder(String interviewId) {
        if (interviewId == null || interviewId.isBlank()) {
            throw new IllegalArgumentException("Interview id is required");
        }

        var results = new ArrayList<EnqueueResult>();
        for (var role : RecipientRole.values()) {
            var key = jobKeyGenerator.manual(interviewId, role);
            results.add(reminderQueue.enqueue(key, ReminderPayload.manual(interviewId, role)));
        }

        log.info("Manual reminder scheduled for interview {}", interviewId);
        return results;
    }

    @Transactional(readOnly = true)
    public ReminderJobResponse getJob(UUID jobId) {
        return jobRepository.findById(jobId)
                .map(jobMapper::toResponse)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Transactional(readOnly = true)
    public List<ReminderJobResponse> getJobsForInterview(String interviewId) {
        return jobMapper.toResponseList(jobRepository.findByInterviewIdOrderByCreatedAtDesc(interviewId));
    }

    @Transactional(readOnly = true)
    public Page<ReminderJobResponse> getJobsByState(JobState state, Pageable pageable) {
        return jobRepository.findByState(state, pageable).map(jobMapper::toResponse);
    }
}
