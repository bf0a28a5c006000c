package com.example.interviewreminder.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Jobs created by a manual reminder request
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualReminderResponse {

    private String interviewId;
    private List<EnqueuedJob> jobs;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EnqueuedJob {
        private UUID jobId;
        private String jobKey;
        private boolean duplicate;
    }
}
