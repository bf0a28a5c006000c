package com.example.interviewreminder.service.queue;

import com.example.interviewreminder.domain.enums.RecipientRole;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Builds job keys for scheduled and manual reminders.
 * <p>
 * Scheduled keys are stable per (interview, role), so repeated scans of the
 * same window collapse onto one pending job. Manual keys carry a timestamp and
 * a random suffix and never collide with anything.
 */
@Component
@RequiredArgsConstructor
public class JobKeyGenerator {

    private static final String MANUAL_PREFIX = "manual";

    private final Clock clock;

    /**
     * {@code <role>-<interviewId>}
     */
    public static JobKey scheduled(String interviewId, RecipientRole role) {
        requireInterviewId(interviewId);
        return JobKey.of(role.getCode() + "-" + interviewId);
    }

    /**
     * {@code manual-<role>-<interviewId>-<epochMillis>-<nonce>}
     */
    public JobKey manual(String interviewId, RecipientRole role) {
        requireInterviewId(interviewId);
        var nonce = Integer.toHexString(ThreadLocalRandom.current().nextInt(0x10000, 0x100000));
        return JobKey.of(String.join("-", MANUAL_PREFIX, role.getCode(), interviewId, String.valueOf(clock.millis()), nonce));
    }

    private static void requireInterviewId(String interviewId) {
        if (interviewId == null || interviewId.isBlank()) {
            throw new IllegalArgumentException("Interview id is required");
        }
    }
}
