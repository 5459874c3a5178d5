package com.myorg.changefeed;

import java.time.Instant;

/**
 * Writer for {@code OUTBOX} feeds. Joins the caller's transaction and never waits for the shard lock.
 */
public interface OutboxWriter {
    long append(String feedId, int shardId, Instant timeHint, Object payload);
}
