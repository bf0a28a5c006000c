package com.example.interviewreminder.service.queue;

import com.example.interviewreminder.domain.enums.BackoffType;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;

/**
 * Delay between failed attempts of a job.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Backoff {

    BackoffType type;
    long delayMs;

    public static Backoff of(BackoffType type, long delayMs) {
        if (type == null) {
            throw new IllegalArgumentException("Backoff type is required");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("Backoff delay must not be negative: " + delayMs);
        }
        return new Backoff(type, delayMs);
    }

    public static Backoff exponential(Duration base) {
        return of(BackoffType.EXPONENTIAL, base.toMillis());
    }

    public static Backoff fixed(Duration delay) {
        return of(BackoffType.FIXED, delay.toMillis());
    }

    /**
     * Delay before the next attempt once {@code attemptsMade} attempts have failed.
     * Exponential backoff doubles per failure: base, 2 * base, 4 * base...
     */
    public Duration delayAfter(int attemptsMade) {
        if (attemptsMade < 1) {
            throw new IllegalArgumentException("attemptsMade must be at least 1: " + attemptsMade);
        }
        return switch (type) {
            case FIXED -> Duration.ofMillis(delayMs);
            case EXPONENTIAL -> Duration.ofMillis(delayMs * (1L << Math.min(attemptsMade - 1, 30)));
        };
    }
}
