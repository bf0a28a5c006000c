package com.example.interviewreminder.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the periodic reminder scan.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "reminder.scheduler")
public class ReminderSchedulerProperties {

    /**
     * Interval between scans in milliseconds
     */
    @Min(1000)
    private long tickIntervalMs = 3600000;

    /**
     * Delay before the first scan after startup
     */
    @Min(0)
    private long initialDelayMs = 0;

    /**
     * Target distance between the reminder and the interview
     */
    @NotNull
    private Duration leadTime = Duration.ofHours(24);

    /**
     * Tolerance on either side of the lead time. Must cover the tick interval
     * so every interview falls into at least one scan.
     */
    @NotNull
    private Duration slack = Duration.ofHours(1);
}
