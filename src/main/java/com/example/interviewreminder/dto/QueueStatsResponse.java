package com.example.interviewreminder.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Queue statistics response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatsResponse {

    private long waiting;
    private long active;
    private long completed;
    private long failed;
    private long delayed;
    private Instant generatedAt;
}
