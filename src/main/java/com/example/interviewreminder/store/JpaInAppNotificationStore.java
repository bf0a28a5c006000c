package com.example.interviewreminder.store;

import com.example.interviewreminder.domain.entity.InAppNotification;
import com.example.interviewreminder.domain.repository.InAppNotificationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

@Component
@RequiredArgsConstructor
public class JpaInAppNotificationStore implements InAppNotificationStore {

    private final InAppNotificationRepository notificationRepository;
    private final Clock clock;

    @Override
    @Transactional
    public void create(String userId, String type, String title, String message, String link) {
        notificationRepository.save(InAppNotification.builder()
                .userId(userId)
                .type(type)
                .title(title)
                .message(message)
                .link(link)
                .createdAt(clock.instant())
                .build());
    }
}
