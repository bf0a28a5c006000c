package com.example.interviewreminder.service.scheduler;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Closed time range of interview start times that are due for a reminder.
 * <p>
 * Centred on {@code now + leadTime} with {@code slack} on either side, so with
 * the defaults an interview is picked up between 23 and 25 hours before it
 * starts. The total width must be at least the scan interval or interviews
 * can slip between two scans.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReminderWindow {

    Instant start;
    Instant end;

    public static ReminderWindow of(Instant now, Duration leadTime, Duration slack) {
        if (slack == null || slack.isNegative() || slack.isZero()) {
            throw new IllegalArgumentException("Slack must be positive: " + slack);
        }
        if (leadTime == null || leadTime.compareTo(slack) < 0) {
            throw new IllegalArgumentException("Lead time must be at least the slack: " + leadTime);
        }
        var target = now.plus(leadTime);
        return new ReminderWindow(target.minus(slack), target.plus(slack));
    }
}
