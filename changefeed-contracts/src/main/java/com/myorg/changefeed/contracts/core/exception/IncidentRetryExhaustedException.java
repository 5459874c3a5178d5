package com.myorg.changefeed.contracts.core.exception;

/**
 * Too many stuck writers were found in a row on the same shard. Something keeps
 * abandoning transactions while holding the lock; stop and let a human look.
 */
public class IncidentRetryExhaustedException extends ChangefeedNonRetryableException {

    private final String feedId;
    private final int shardId;
    private final int attempts;
    private final long incidentCount;

    public IncidentRetryExhaustedException(String feedId, int shardId, int attempts, long incidentCount) {
        super("INCIDENT_RETRY_EXHAUSTED",
                "Gave up acquiring writer lock feed=" + feedId + " shard=" + shardId
                        + " attempts=" + attempts + " incidentCount=" + incidentCount);
        this.feedId = feedId;
        this.shardId = shardId;
        this.attempts = attempts;
        this.incidentCount = incidentCount;
    }

    public String getFeedId() { return feedId; }
    public int getShardId() { return shardId; }
    public int getAttempts() { return attempts; }
    public long getIncidentCount() { return incidentCount; }
}
