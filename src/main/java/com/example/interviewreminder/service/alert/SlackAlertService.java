package com.example.interviewreminder.service.alert;

import com.example.interviewreminder.config.SlackProperties;
import com.example.interviewreminder.domain.entity.ReminderJob;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * Sends alerts to Slack when reminder jobs fail for good or the scheduler
 * cannot scan interviews.
 */
@Slf4j
@Service
public class SlackAlertService {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneOffset.UTC);

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:interview-reminder-service}")
    private String applicationName;

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Alert for a job that exhausted its attempts.
     * Runs asynchronously to not block job processing.
     */
    @Async
    public void sendJobFailedAlert(ReminderJob job) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Job {} failed but no alert was sent.", job.getJobKey());
            return;
        }

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), buildJobFailedPayload(job));

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for failed job {}", job.getJobKey());
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for job {}: {}", job.getJobKey(), e.getMessage(), e);
        }
    }

    @Async
    public void sendErrorAlert(String title, String message, String details) {
        if (!isConfigured()) {
            log.warn("Slack alerting disabled. Error alert not sent: {}", title);
            return;
        }

        try {
            var payload = Payload.builder()
                    .channel(slackProperties.getChannel())
                    .username(applicationName)
                    .iconEmoji(":warning:")
                    .text(":warning: *" + title + "*")
                    .attachments(List.of(
                            Attachment.builder()
                                    .color("warning")
                                    .text(message)
                                    .fields(details != null ? List.of(
                                            Field.builder()
                                                    .title("Details")
                                                    .value(truncate(details, 500))
                                                    .valueShortEnough(false)
                                                    .build()
                                    ) : List.of())
                                    .footer(applicationName)
                                    .ts(String.valueOf(Instant.now().getEpochSecond()))
                                    .build()
                    ))
                    .build();

            slack.send(slackProperties.getWebhookUrl(), payload);
        } catch (Exception e) {
            log.error("Error sending Slack error alert: {}", e.getMessage(), e);
        }
    }

    Payload buildJobFailedPayload(ReminderJob job) {
        var jobId = String.valueOf(job.getId());
        var lastError = job.getLastError() != null ? job.getLastError() : "Unknown error";

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Interview Reminder Failed - Participant Was Not Notified*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(job.getRecipientRole().getDisplayName() + " reminder - interview " + job.getInterviewId())
                                .titleLink(slackProperties.getDashboardBaseUrl() + "/jobs/" + jobId)
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Job Key")
                                                .value(job.getJobKey())
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Origin")
                                                .value(job.getOrigin().name())
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Attempts")
                                                .value(job.getAttemptsMade() + "/" + job.getMaxAttempts())
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Created At")
                                                .value(job.getCreatedAt() != null ? DATE_FORMATTER.format(job.getCreatedAt()) : "-")
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Last Error")
                                                .value("```" + truncate(lastError, 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName + " | Use the manual reminder endpoint to resend")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private boolean isConfigured() {
        return slackProperties.isEnabled() && slackProperties.getWebhookUrl() != null && !slackProperties.getWebhookUrl().isBlank();
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
