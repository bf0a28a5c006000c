package com.example.interviewreminder.client;

import com.example.interviewreminder.client.ClientModels.SendEmailRequest;
import com.example.interviewreminder.client.ClientModels.SendEmailResponse;
import com.example.interviewreminder.config.NotificationProperties;
import com.example.interviewreminder.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Sends reminders through the platform mail service.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker so an unavailable mail service fails fast
 * - WebClient with a bounded blocking timeout
 * - The job key as Idempotency-Key, so a retried attempt is not mailed twice
 *   when the mail service supports it
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "reminder.notification", name = "transport", havingValue = "mail-service")
public class MailServiceClient implements NotificationTransport {

    static final String SERVICE_NAME = "Mail Service";

    private final WebClient webClient;
    private final NotificationProperties notificationProperties;

    public MailServiceClient(@Qualifier("mailServiceWebClient") WebClient webClient, NotificationProperties notificationProperties) {
        this.webClient = webClient;
        this.notificationProperties = notificationProperties;
    }

    /**
     * @throws ExternalServiceException if the mail service rejects the message or cannot be reached
     */
    @Override
    @CircuitBreaker(name = "mailService", fallbackMethod = "sendFallback")
    public void send(NotificationRequest request) {
        log.debug("Calling Mail Service for {} (token {})", request.getRecipientEmail(), request.getDedupToken());

        var body = SendEmailRequest.builder()
                .to(request.getRecipientEmail())
                .toName(request.getRecipientName())
                .subject(request.getSubject())
                .textBody(request.getBody())
                .locale(request.getLocale())
                .tags(Map.of("category", "interview-reminder"))
                .build();

        try {
            var response = webClient.post()
                    .uri("/api/v1/emails")
                    .header("Idempotency-Key", request.getDedupToken())
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse ->
                            clientResponse.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(responseBody -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, clientResponse.statusCode().value(), responseBody))))
                    .bodyToMono(SendEmailResponse.class)
                    .timeout(notificationProperties.getSendTimeout())
                    .block();

            log.info("Mail Service accepted reminder for {} (message {})",
                    request.getRecipientEmail(), response != null ? response.getMessageId() : "-");
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to send reminder to {}: {}", request.getRecipientEmail(), e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    /**
     * Fallback when the circuit breaker is open or the call failed
     */
    @SuppressWarnings("unused")
    private void sendFallback(NotificationRequest request, Exception e) {
        if (e instanceof ExternalServiceException ese) {
            throw ese;
        }
        log.warn("Circuit breaker open for Mail Service, token: {}, error: {}", request.getDedupToken(), e.getMessage());
        throw new ExternalServiceException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
    }
}
