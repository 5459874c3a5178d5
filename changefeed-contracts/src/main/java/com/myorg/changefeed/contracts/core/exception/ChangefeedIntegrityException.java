package com.myorg.changefeed.contracts.core.exception;

/**
 * The database is not in the shape the protocol expects (unexpected update counts,
 * exhausted ULID counter). Needs an operator, not a retry.
 */
public class ChangefeedIntegrityException extends ChangefeedNonRetryableException {

    public ChangefeedIntegrityException(String reason, String message) {
        super(reason, message);
    }
}
