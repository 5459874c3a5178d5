package com.myorg.changefeed.contracts.core.exception;

/**
 * Failure that will not go away by retrying the same call.
 * The {@code reason} is a short machine readable code, e.g. {@code UNKNOWN_FEED}.
 */
public class ChangefeedNonRetryableException extends RuntimeException {

    private final String reason;

    public ChangefeedNonRetryableException(String reason, String message) {
        this(reason, message, null);
    }

    public ChangefeedNonRetryableException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = (reason == null || reason.isBlank()) ? "NON_RETRYABLE" : reason;
    }

    public String getReason() {
        return reason;
    }
}
