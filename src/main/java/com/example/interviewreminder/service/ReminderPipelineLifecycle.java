package com.example.interviewreminder.service;

import com.example.interviewreminder.config.ReminderQueueProperties;
import com.example.interviewreminder.service.handler.ReminderJobHandler;
import com.example.interviewreminder.service.queue.ReminderQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts and stops the reminder pipeline with the application context.
 * <p>
 * While stopped the scheduler skips its scans and the queue claims no jobs.
 * Stopping waits for in-flight jobs up to the configured shutdown timeout;
 * jobs still running after that are picked up by stall recovery later.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReminderPipelineLifecycle implements SmartLifecycle {

    private final ReminderQueue reminderQueue;
    private final ReminderJobHandler reminderJobHandler;
    private final ReminderQueueProperties queueProperties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        reminderQueue.consume(reminderJobHandler);
        log.info("Interview reminder pipeline started");
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping interview reminder pipeline");

        var drained = reminderQueue.close(Duration.ofSeconds(queueProperties.getShutdownTimeoutSeconds()));
        if (drained) {
            log.info("Interview reminder pipeline stopped");
        } else {
            log.warn("Interview reminder pipeline stopped with jobs still running");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }
}
