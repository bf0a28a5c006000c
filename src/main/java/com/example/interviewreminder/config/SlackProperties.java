package com.example.interviewreminder.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Slack configuration properties
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {
    private String webhookUrl;
    private String channel = "#recruiting-alerts";
    private boolean enabled = true;

    /**
     * Base URL of the operations dashboard linked from alerts
     */
    private String dashboardBaseUrl = "http://localhost:8080/api/v1/reminders";
}
