package com.myorg.changefeed.contracts.feed;

/**
 * How events get their position in a feed.
 */
public enum FeedMode {
    /** Writers insert freely; a sweep assigns sequence numbers later. */
    SWEEP,
    /** Writers serialize on the shard lock and get ULIDs at write time. */
    BLOCKING,
    /** Writers append to an outbox; readers fold it into ULID order under the shard lock. */
    OUTBOX
}
