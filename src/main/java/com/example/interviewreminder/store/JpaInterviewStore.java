package com.example.interviewreminder.store;

import com.example.interviewreminder.domain.entity.Interview;
import com.example.interviewreminder.domain.entity.UserAccount;
import com.example.interviewreminder.domain.enums.InterviewStatus;
import com.example.interviewreminder.domain.repository.InterviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link InterviewStore} backed by the platform's PostgreSQL schema.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaInterviewStore implements InterviewStore {

    private final InterviewRepository interviewRepository;

    @Override
    @Transactional(readOnly = true)
    public List<InterviewDetails> findInterviewsInWindow(InterviewStatus status, Instant rangeStart, Instant rangeEnd) {
        return interviewRepository.findPendingReminders(status, rangeStart, rangeEnd).stream()
                .map(JpaInterviewStore::toDetails)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<InterviewDetails> getInterview(String interviewId) {
        return interviewRepository.findWithParticipantsById(interviewId).map(JpaInterviewStore::toDetails);
    }

    @Override
    @Transactional
    public void markReminderSent(String interviewId) {
        var updated = interviewRepository.markReminderSent(interviewId);
        if (updated == 0) {
            log.warn("Interview {} vanished before its reminder flag could be set", interviewId);
        }
    }

    static InterviewDetails toDetails(Interview interview) {
        return InterviewDetails.builder()
                .id(interview.getId())
                .scheduledAt(interview.getScheduledAt())
                .status(interview.getStatus())
                .reminderSent(interview.isReminderSent())
                .durationMinutes(interview.getDurationMinutes() != null ? interview.getDurationMinutes() : 0)
                .type(interview.getType())
                .location(interview.getLocation())
                .meetingUrl(interview.getMeetingUrl())
                .appliedPosition(interview.getAppliedPosition())
                .candidate(toRecipient(interview.getCandidate()))
                .interviewer(toRecipient(interview.getInterviewer()))
                .build();
    }

    private static Recipient toRecipient(UserAccount user) {
        return Recipient.builder()
                .userId(user.getId())
                .displayName(user.getDisplayName())
                .email(user.getEmail())
                .locale(user.getLocale())
                .timeZone(user.getTimeZone())
                .build();
    }
}
