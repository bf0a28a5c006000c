package com.example.interviewreminder.audit;

import com.example.interviewreminder.domain.entity.AuditLog;
import com.example.interviewreminder.domain.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;

/**
 * Writes reminder deliveries into the platform audit trail as
 * {@code CREATE EmailNotification} entries by the system user.
 */
@Component
@RequiredArgsConstructor
public class JpaAuditSink implements AuditSink {

    static final String SYSTEM_USER = "system";
    static final String ACTION = "CREATE";
    static final String ENTITY_TYPE = "EmailNotification";
    static final String IP_ADDRESS = "0.0.0.0";
    static final String USER_AGENT = "InterviewReminderJob";

    private final AuditLogRepository auditLogRepository;

    @Override
    @Transactional
    public void record(AuditRecord record) {
        var data = new LinkedHashMap<String, Object>();
        data.put("recipient", record.getRecipient());
        data.put("subject", record.getSubject());
        data.put("type", record.getType());
        data.put("sentAt", record.getSentAt().toString());
        data.put("jobKey", record.getJobKey());

        auditLogRepository.save(AuditLog.builder()
                .userId(SYSTEM_USER)
                .action(ACTION)
                .entityType(ENTITY_TYPE)
                .entityId(record.getInterviewId())
                .newData(data)
                .ipAddress(IP_ADDRESS)
                .userAgent(USER_AGENT)
                .createdAt(record.getSentAt())
                .build());
    }
}
