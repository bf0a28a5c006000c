package com.example.interviewreminder.client;

/**
 * Delivery channel for reminder notifications.
 * <p>
 * Implementations must finish or fail within a bounded time and report
 * failures as {@link com.example.interviewreminder.exception.ExternalServiceException}.
 */
public interface NotificationTransport {

    void send(NotificationRequest request);
}
