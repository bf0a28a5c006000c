package com.example.interviewreminder.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request/Response DTOs for the mail service
 */
public class ClientModels {
    private ClientModels() {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SendEmailRequest {
        private String to;
        private String toName;
        private String subject;
        private String textBody;
        private String locale;
        private Map<String, String> tags;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SendEmailResponse {
        private String messageId;
        private String status;
    }
}
