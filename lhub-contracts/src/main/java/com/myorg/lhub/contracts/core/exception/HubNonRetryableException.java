package com.myorg.lhub.contracts.core.exception;

/**
 * Failure that no amount of retrying will fix. Consumers dead-letter it on the first attempt.
 */
public class HubNonRetryableException extends RuntimeException {

    private final String reason;

    public HubNonRetryableException(String message) {
        this("NON_RETRYABLE", message, null);
    }

    public HubNonRetryableException(String reason, String message) {
        this(reason, message, null);
    }

    public HubNonRetryableException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = (reason == null || reason.isBlank()) ? "NON_RETRYABLE" : reason;
    }

    public String getReason() {
        return reason;
    }
}
