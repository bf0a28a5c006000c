package com.example.interviewreminder.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Rendering and delivery settings for reminder notifications
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "reminder.notification")
public class NotificationProperties {

    /**
     * Active transport: {@code log} or {@code mail-service}
     */
    @NotBlank
    private String transport = "log";

    /**
     * Locale used when the recipient has none
     */
    @NotBlank
    private String defaultLocale = "en-US";

    /**
     * Zone used when the recipient has none
     */
    @NotBlank
    private String defaultTimeZone = "UTC";

    @NotBlank
    private String senderName = "RecruitFlow";

    @NotBlank
    private String dashboardBaseUrl = "http://localhost:3000";

    @NotNull
    private Duration sendTimeout = Duration.ofSeconds(30);
}
