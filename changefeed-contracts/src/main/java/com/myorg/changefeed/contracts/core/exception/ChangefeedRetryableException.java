package com.myorg.changefeed.contracts.core.exception;

public class ChangefeedRetryableException extends RuntimeException {
    public ChangefeedRetryableException(String msg) { super(msg); }
    public ChangefeedRetryableException(String msg, Throwable cause) { super(msg, cause); }
}
