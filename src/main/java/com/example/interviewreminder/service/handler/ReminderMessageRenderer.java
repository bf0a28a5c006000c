package com.example.interviewreminder.service.handler;

import com.example.interviewreminder.config.NotificationProperties;
import com.example.interviewreminder.domain.enums.RecipientRole;
import com.example.interviewreminder.store.InterviewDetails;
import com.example.interviewreminder.store.Recipient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.Locale;

/**
 * Renders the reminder email for a participant of an interview.
 * <p>
 * The interview time is shown in the recipient's own locale and time zone,
 * falling back to the configured defaults.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReminderMessageRenderer {

    private final NotificationProperties properties;

    public RenderedMessage render(InterviewDetails interview, RecipientRole role) {
        var recipient = interview.recipientFor(role);
        var locale = resolveLocale(recipient);
        var formattedTime = formatTime(interview, recipient, locale);

        return switch (role) {
            case CANDIDATE -> renderForCandidate(interview, recipient, locale, formattedTime);
            case INTERVIEWER -> renderForInterviewer(interview, recipient, locale, formattedTime);
        };
    }

    private RenderedMessage renderForCandidate(InterviewDetails interview, Recipient candidate, Locale locale, String formattedTime) {
        var body = new StringBuilder()
                .append("Dear ").append(candidate.getDisplayName()).append(",\n\n")
                .append("This is a reminder that your interview is scheduled for tomorrow.\n\n")
                .append("- Date: ").append(formattedTime).append('\n')
                .append("- Duration: ").append(interview.getDurationMinutes()).append(" minutes\n")
                .append("- Format: ").append(typeName(interview)).append('\n')
                .append("- Interviewer: ").append(interview.getInterviewer().getDisplayName()).append('\n');
        appendVenue(body, interview);
        body.append("\nPlease join a few minutes early. If you have any questions, feel free to contact us.\n");
        appendSignature(body);

        return RenderedMessage.builder()
                .subject("[Reminder] Your interview tomorrow")
                .body(body.toString())
                .summary("Your interview is scheduled for " + formattedTime)
                .formattedTime(formattedTime)
                .locale(locale.toLanguageTag())
                .build();
    }

    private RenderedMessage renderForInterviewer(InterviewDetails interview, Recipient interviewer, Locale locale, String formattedTime) {
        var candidateName = interview.getCandidate().getDisplayName();

        var body = new StringBuilder()
                .append("Dear ").append(interviewer.getDisplayName()).append(",\n\n")
                .append("You have the following interview scheduled for tomorrow.\n\n")
                .append("- Candidate: ").append(candidateName).append('\n')
                .append("- Position: ").append(interview.getAppliedPosition() != null ? interview.getAppliedPosition() : "-").append('\n')
                .append("- Date: ").append(formattedTime).append('\n')
                .append("- Duration: ").append(interview.getDurationMinutes()).append(" minutes\n")
                .append("- Format: ").append(typeName(interview)).append('\n');
        appendVenue(body, interview);
        body.append("- Details: ").append(properties.getDashboardBaseUrl()).append("/interviews/").append(interview.getId()).append('\n');
        body.append("\nPlease prepare accordingly.\n");
        appendSignature(body);

        return RenderedMessage.builder()
                .subject("[Reminder] Interview tomorrow with " + candidateName)
                .body(body.toString())
                .summary("Your interview with " + candidateName + " is scheduled for tomorrow, " + formattedTime)
                .formattedTime(formattedTime)
                .locale(locale.toLanguageTag())
                .build();
    }

    private void appendVenue(StringBuilder body, InterviewDetails interview) {
        if (hasText(interview.getLocation())) {
            body.append("- Location: ").append(interview.getLocation()).append('\n');
        }
        if (hasText(interview.getMeetingUrl())) {
            body.append("- Meeting URL: ").append(interview.getMeetingUrl()).append('\n');
        }
    }

    private void appendSignature(StringBuilder body) {
        body.append("\n---\n").append(properties.getSenderName());
    }

    private static String typeName(InterviewDetails interview) {
        return interview.getType() != null ? interview.getType().getDisplayName() : "-";
    }

    String formatTime(InterviewDetails interview, Recipient recipient, Locale locale) {
        var zone = resolveZone(recipient);
        var formatter = DateTimeFormatter.ofLocalizedDateTime(FormatStyle.FULL, FormatStyle.SHORT)
                .withLocale(locale)
                .withZone(zone);
        return formatter.format(interview.getScheduledAt()) + " (" + zone.getId() + ")";
    }

    Locale resolveLocale(Recipient recipient) {
        var tag = recipient.getLocale();
        if (!hasText(tag)) {
            tag = properties.getDefaultLocale();
        }
        return Locale.forLanguageTag(tag);
    }

    ZoneId resolveZone(Recipient recipient) {
        if (hasText(recipient.getTimeZone())) {
            try {
                return ZoneId.of(recipient.getTimeZone());
            } catch (DateTimeException e) {
                log.warn("Unknown time zone '{}' for user {}, using {}", recipient.getTimeZone(), recipient.getUserId(), properties.getDefaultTimeZone());
            }
        }
        return ZoneId.of(properties.getDefaultTimeZone());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
