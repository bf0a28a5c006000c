package com.example.interviewreminder.service.handler;

import com.example.interviewreminder.domain.enums.ReminderOutcome;
import com.example.interviewreminder.exception.ExternalServiceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JobExecutionResult Tests")
class JobExecutionResultTest {

    @Test
    @DisplayName("Success should carry the outcome")
    void successCarriesOutcome() {
        var result = JobExecutionResult.success(ReminderOutcome.CANCELLED);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOutcome()).isEqualTo(ReminderOutcome.CANCELLED);
        assertThat(result.getErrorMessage()).isNull();
    }

    @Test
    @DisplayName("Failure should classify the error")
    void failureClassifiesError() {
        var result = JobExecutionResult.failure(new IllegalStateException("smtp down"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).isEqualTo("smtp down");
        assertThat(result.getErrorType()).isEqualTo("IllegalStateException");
        assertThat(result.getStackTrace()).startsWith("java.lang.IllegalStateException: smtp down");
    }

    @Test
    @DisplayName("Client errors from an external service should not be retried")
    void clientErrorsAreNotRetryable() {
        assertThat(JobExecutionResult.failure(new ExternalServiceException("Mail Service", 400, "bad request")).isRetryable()).isFalse();
        assertThat(JobExecutionResult.failure(new ExternalServiceException("Mail Service", 429, "slow down")).isRetryable()).isTrue();
        assertThat(JobExecutionResult.failure(new IllegalStateException("smtp down")).isRetryable()).isTrue();
    }

    @Test
    @DisplayName("Failure without a message should use the exception name")
    void failureWithoutMessage() {
        var result = JobExecutionResult.failure(new NullPointerException());

        assertThat(result.getErrorMessage()).isEqualTo("NullPointerException");
    }

    @Test
    @DisplayName("Stack trace should be cut after twenty frames")
    void stackTraceIsTruncated() {
        var e = new RuntimeException("deep", new IllegalArgumentException("root"));
        var frames = new StackTraceElement[30];
        for (var i = 0; i < frames.length; i++) {
            frames[i] = new StackTraceElement("com.example.Deep", "call" + i, "Deep.java", i + 1);
        }
        e.setStackTrace(frames);

        var trace = JobExecutionResult.truncateStackTrace(e);

        assertThat(trace).contains("call19").doesNotContain("call20");
        assertThat(trace).contains("... 10 more");
        assertThat(trace).contains("Caused by: java.lang.IllegalArgumentException: root");
    }
}
