package com.myorg.changefeed.contracts.core.exception;

public class UnknownFeedException extends ChangefeedNonRetryableException {

    private final String feedId;

    public UnknownFeedException(String feedId) {
        super("UNKNOWN_FEED", "Unknown feed: " + feedId);
        this.feedId = feedId;
    }

    public String getFeedId() {
        return feedId;
    }
}
