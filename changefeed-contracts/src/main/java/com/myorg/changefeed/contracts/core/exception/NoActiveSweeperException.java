package com.myorg.changefeed.contracts.core.exception;

public class NoActiveSweeperException extends ChangefeedRetryableException {

    private final String feedId;
    private final int shardId;

    public NoActiveSweeperException(String feedId, int shardId) {
        super("No sweep loop is holding the longpoll lock for feed=" + feedId + " shard=" + shardId);
        this.feedId = feedId;
        this.shardId = shardId;
    }

    public String getFeedId() { return feedId; }
    public int getShardId() { return shardId; }
}
