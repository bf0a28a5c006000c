package com.example.interviewreminder.exception;

import lombok.Getter;

/**
 * Exception for failures talking to an external system (mail service, interview store).
 * Thrown out of a job attempt, it makes the queue retry the job.
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String serviceName;
    private final Integer httpStatusCode;
    private final String responseBody;
    private final boolean retryable;

    public ExternalServiceException(String serviceName, String message) {
        super(String.format("[%s] %s", serviceName, message));
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
        this.retryable = true;
    }

    public ExternalServiceException(String serviceName, Exception cause) {
        this(serviceName, cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(), cause);
    }

    public ExternalServiceException(String serviceName, String message, Exception cause) {
        super(String.format("[%s] %s", serviceName, message), cause);
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
        this.retryable = true;
    }

    public ExternalServiceException(String serviceName, int httpStatusCode, String responseBody) {
        super(String.format("[%s] HTTP %d: %s", serviceName, httpStatusCode, responseBody));
        this.serviceName = serviceName;
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
        // 4xx errors (except 408, 429) are not retryable
        this.retryable = httpStatusCode >= 500 || httpStatusCode == 408 || httpStatusCode == 429;
    }
}
