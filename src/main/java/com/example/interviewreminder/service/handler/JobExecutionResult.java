package com.example.interviewreminder.service.handler;

import com.example.interviewreminder.domain.enums.ReminderOutcome;
import com.example.interviewreminder.exception.ExternalServiceException;
import lombok.Builder;
import lombok.Data;

/**
 * Result of one job attempt.
 * <p>
 * Contains everything needed to move the job to its next state.
 */
@Data
@Builder
public class JobExecutionResult {

    private static final int MAX_STACK_TRACE_LINES = 20;
    private static final int MAX_STACK_TRACE_LENGTH = 4000;

    private boolean success;

    /**
     * Reason code when successful
     */
    private ReminderOutcome outcome;

    private String errorMessage;

    /**
     * Error classification for metrics, usually the exception's simple name
     */
    private String errorType;

    private String stackTrace;

    /**
     * False for errors another attempt cannot fix, such as a rejected recipient address
     */
    @Builder.Default
    private boolean retryable = true;

    public static JobExecutionResult success(ReminderOutcome outcome) {
        return JobExecutionResult.builder()
                .success(true)
                .outcome(outcome)
                .build();
    }

    public static JobExecutionResult failure(Exception e) {
        return JobExecutionResult.builder()
                .success(false)
                .errorMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                .errorType(e.getClass().getSimpleName())
                .stackTrace(truncateStackTrace(e))
                .retryable(!(e instanceof ExternalServiceException ese) || ese.isRetryable())
                .build();
    }

    /**
     * Truncate stack trace to keep the error column bounded
     */
    static String truncateStackTrace(Exception e) {
        if (e == null) return null;

        var sb = new StringBuilder();
        sb.append(e.getClass().getName()).append(": ").append(e.getMessage()).append("\n");

        var trace = e.getStackTrace();
        var maxLines = Math.min(trace.length, MAX_STACK_TRACE_LINES);
        for (var i = 0; i < maxLines; i++) {
            sb.append("\tat ").append(trace[i]).append("\n");
        }
        if (trace.length > maxLines) {
            sb.append("\t... ").append(trace.length - maxLines).append(" more\n");
        }
        if (e.getCause() != null) {
            sb.append("Caused by: ").append(e.getCause()).append("\n");
        }

        var result = sb.toString();
        if (result.length() > MAX_STACK_TRACE_LENGTH) {
            result = result.substring(0, MAX_STACK_TRACE_LENGTH) + "...";
        }
        return result;
    }
}
