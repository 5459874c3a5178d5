package com.myorg.changefeed;

import com.myorg.changefeed.contracts.feed.FeedDefinition;
import com.myorg.changefeed.contracts.feed.ShardState;

import java.util.Optional;

public interface FeedRegistry {

    /** Creates the feed if missing. Re-registering with a different mode is rejected. */
    FeedDefinition setupFeed(FeedDefinition feed);

    Optional<FeedDefinition> findFeed(String feedId);

    /** Creates the shard with the feed's defaults if missing. */
    void insertShard(String feedId, int shardId);

    Optional<ShardState> shard(String feedId, int shardId);

    long incidentCount(String feedId, int shardId);
}
