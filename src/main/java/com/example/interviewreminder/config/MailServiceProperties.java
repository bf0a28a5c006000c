package com.example.interviewreminder.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * External mail service configuration properties
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "external-services.mail-service")
public class MailServiceProperties {
    @NotBlank
    private String baseUrl;
    private int timeoutSeconds = 30;
}
