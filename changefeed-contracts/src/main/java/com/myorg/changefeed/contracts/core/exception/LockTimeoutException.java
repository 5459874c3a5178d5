package com.myorg.changefeed.contracts.core.exception;

import java.time.Duration;

/**
 * The shard writer lock was held by a live writer for longer than the configured wait.
 */
public class LockTimeoutException extends ChangefeedRetryableException {

    private final String feedId;
    private final int shardId;
    private final Duration waited;
    private final int attempts;

    public LockTimeoutException(String feedId, int shardId, Duration waited, int attempts) {
        super("Timed out waiting for writer lock feed=" + feedId + " shard=" + shardId
                + " waited=" + waited + " attempts=" + attempts);
        this.feedId = feedId;
        this.shardId = shardId;
        this.waited = waited;
        this.attempts = attempts;
    }

    public String getFeedId() { return feedId; }
    public int getShardId() { return shardId; }
    public Duration getWaited() { return waited; }
    public int getAttempts() { return attempts; }
}
