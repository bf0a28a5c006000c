package com.example.interviewreminder.service.handler;

import com.example.interviewreminder.audit.AuditRecord;
import com.example.interviewreminder.audit.AuditSink;
import com.example.interviewreminder.client.NotificationRequest;
import com.example.interviewreminder.client.NotificationTransport;
import com.example.interviewreminder.config.MetricsConfig;
import com.example.interviewreminder.domain.enums.JobOrigin;
import com.example.interviewreminder.domain.enums.RecipientRole;
import com.example.interviewreminder.domain.enums.ReminderOutcome;
import com.example.interviewreminder.service.queue.JobKey;
import com.example.interviewreminder.service.queue.ReminderPayload;
import com.example.interviewreminder.store.InAppNotificationStore;
import com.example.interviewreminder.store.InterviewDetails;
import com.example.interviewreminder.store.InterviewStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Consumer side of the reminder pipeline: delivers one reminder to one participant.
 * <p>
 * Steps, in order:
 * 1. Re-fetch the interview; missing, cancelled or already reminded interviews end the job
 * 2. Render and send the email (transport failures propagate, so the queue retries)
 * 3. Set the interview's reminder flag
 * 4. Record an in-app notification for the interviewer
 * 5. Append the delivery to the audit trail
 * <p>
 * Manual jobs skip the already-reminded check. Steps 3 to 5 run after the email
 * went out: their failures are logged and the job still completes as SENT. The flag
 * is set immediately after the send, before any other bookkeeping.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InterviewReminderHandler implements ReminderJobHandler {

    static final String NOTIFICATION_TYPE = "INTERVIEW_REMINDER";

    private final InterviewStore interviewStore;
    private final NotificationTransport notificationTransport;
    private final InAppNotificationStore inAppNotificationStore;
    private final AuditSink auditSink;
    private final ReminderMessageRenderer renderer;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    @Override
    public ReminderOutcome handle(JobKey key, ReminderPayload payload) {
        var interviewId = payload.getInterviewId();
        var role = payload.getRole();

        var interview = interviewStore.getInterview(interviewId).orElse(null);
        if (interview == null) {
            log.info("[{}] Interview {} not found, skipping", key, interviewId);
            return ReminderOutcome.NOT_FOUND;
        }
        if (interview.isCancelled()) {
            log.info("[{}] Interview {} is cancelled, skipping", key, interviewId);
            return ReminderOutcome.CANCELLED;
        }
        if (interview.isReminderSent() && payload.getOrigin() == JobOrigin.SCHEDULER) {
            log.info("[{}] Reminder already sent for interview {}, skipping", key, interviewId);
            return ReminderOutcome.ALREADY_SENT;
        }

        var recipient = interview.recipientFor(role);
        var message = renderer.render(interview, role);

        notificationTransport.send(NotificationRequest.builder()
                .recipientEmail(recipient.getEmail())
                .recipientName(recipient.getDisplayName())
                .subject(message.getSubject())
                .body(message.getBody())
                .dedupToken(key.getValue())
                .locale(message.getLocale())
                .build());
        var sentAt = clock.instant();
        log.info("[{}] Sent {} reminder for interview {} to {}", key, role.getCode(), interviewId, recipient.getEmail());

        try {
            interviewStore.markReminderSent(interviewId);
        } catch (Exception e) {
            log.error("[{}] Reminder for interview {} was sent but the reminder flag could not be set: {}", key, interviewId, e.getMessage(), e);
            metricsConfig.recordFlagUpdateFailure();
        }

        if (role == RecipientRole.INTERVIEWER) {
            createInAppNotification(key, interview, recipient.getUserId(), message);
        }

        recordHistory(key, interview, recipient.getEmail(), message, sentAt);

        return ReminderOutcome.SENT;
    }

    private void createInAppNotification(JobKey key, InterviewDetails interview, String userId, RenderedMessage message) {
        try {
            inAppNotificationStore.create(userId, NOTIFICATION_TYPE, message.getSubject(), message.getSummary(), "/interviews/" + interview.getId());
        } catch (Exception e) {
            log.error("[{}] Failed to create in-app notification for user {}: {}", key, userId, e.getMessage(), e);
        }
    }

    private void recordHistory(JobKey key, InterviewDetails interview, String recipientEmail, RenderedMessage message, Instant sentAt) {
        try {
            auditSink.record(AuditRecord.builder()
                    .interviewId(interview.getId())
                    .recipient(recipientEmail)
                    .subject(message.getSubject())
                    .type(NOTIFICATION_TYPE)
                    .sentAt(sentAt)
                    .jobKey(key.getValue())
                    .build());
        } catch (Exception e) {
            log.error("[{}] Failed to record email history: {}", key, e.getMessage(), e);
        }
    }
}
