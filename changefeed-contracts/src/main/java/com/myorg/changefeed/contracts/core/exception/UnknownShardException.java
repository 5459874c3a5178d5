package com.myorg.changefeed.contracts.core.exception;

public class UnknownShardException extends ChangefeedNonRetryableException {

    private final String feedId;
    private final int shardId;

    public UnknownShardException(String feedId, int shardId) {
        super("UNKNOWN_SHARD", "Unknown shard: feed=" + feedId + " shard=" + shardId);
        this.feedId = feedId;
        this.shardId = shardId;
    }

    public String getFeedId() { return feedId; }
    public int getShardId() { return shardId; }
}
