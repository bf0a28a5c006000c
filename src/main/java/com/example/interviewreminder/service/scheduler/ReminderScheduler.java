package com.example.interviewreminder.service.scheduler;

import com.example.interviewreminder.config.MetricsConfig;
import com.example.interviewreminder.config.ReminderSchedulerProperties;
import com.example.interviewreminder.domain.enums.InterviewStatus;
import com.example.interviewreminder.domain.enums.RecipientRole;
import com.example.interviewreminder.service.ReminderPipelineLifecycle;
import com.example.interviewreminder.service.alert.SlackAlertService;
import com.example.interviewreminder.service.queue.JobKeyGenerator;
import com.example.interviewreminder.service.queue.ReminderPayload;
import com.example.interviewreminder.service.queue.ReminderQueue;
import com.example.interviewreminder.store.InterviewStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Producer side of the reminder pipeline.
 * <p>
 * Every tick scans the interviews starting inside the reminder window and
 * enqueues one job per participant. Job keys are stable per (interview, role),
 * so overlapping windows of consecutive ticks never produce duplicate jobs.
 * <p>
 * ShedLock keeps the scan on one instance at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReminderScheduler {

    private final InterviewStore interviewStore;
    private final ReminderQueue reminderQueue;
    private final ReminderPipelineLifecycle lifecycle;
    private final ReminderSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final SlackAlertService slackAlertService;
    private final Clock clock;

    private final AtomicBoolean isTicking = new AtomicBoolean(false);

    @Scheduled(fixedRateString = "${reminder.scheduler.tick-interval-ms:3600000}",
            initialDelayString = "${reminder.scheduler.initial-delay-ms:0}")
    @SchedulerLock(name = "interviewReminderScan", lockAtLeastFor = "1m", lockAtMostFor = "30m")
    public void scheduledTick() {
        tick();
    }

    /**
     * Scan the current window and enqueue reminder jobs.
     * <p>
     * Never throws: errors are logged, counted and alerted, and the next tick
     * runs as usual.
     */
    public TickResult tick() {
        if (!lifecycle.isRunning()) {
            log.debug("Reminder pipeline not running, skipping scan");
            return TickResult.skipped();
        }
        if (!isTicking.compareAndSet(false, true)) {
            log.warn("Previous reminder scan still running, skipping");
            return TickResult.skipped();
        }

        var found = 0;
        var enqueued = 0;
        var duplicates = 0;
        try {
            var window = ReminderWindow.of(clock.instant(), properties.getLeadTime(), properties.getSlack());
            log.info("Scanning interviews scheduled between {} and {}", window.getStart(), window.getEnd());

            var interviews = interviewStore.findInterviewsInWindow(InterviewStatus.SCHEDULED, window.getStart(), window.getEnd());
            found = interviews.size();

            for (var interview : interviews) {
                for (var role : RecipientRole.values()) {
                    var key = JobKeyGenerator.scheduled(interview.getId(), role);
                    var result = reminderQueue.enqueue(key, ReminderPayload.scheduled(interview.getId(), role));
                    if (result.isDuplicate()) {
                        duplicates++;
                    } else {
                        enqueued++;
                    }
                }
            }

            log.info("Reminder scan found {} interviews: {} jobs enqueued, {} already pending", found, enqueued, duplicates);
            return TickResult.builder()
                    .found(found)
                    .enqueued(enqueued)
                    .duplicates(duplicates)
                    .build();
        } catch (Exception e) {
            log.error("Reminder scan failed after enqueuing {} jobs: {}", enqueued, e.getMessage(), e);
            metricsConfig.recordTickError(e.getClass().getSimpleName());
            slackAlertService.sendErrorAlert("Interview reminder scan failed", e.getMessage(), e.getClass().getName());
            return TickResult.builder()
                    .found(found)
                    .enqueued(enqueued)
                    .duplicates(duplicates)
                    .failed(true)
                    .build();
        } finally {
            isTicking.set(false);
        }
    }
}
