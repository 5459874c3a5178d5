package com.myorg.changefeed;

import com.myorg.changefeed.contracts.feed.Cursor;
import com.myorg.changefeed.contracts.feed.FeedPage;

public interface FeedReader {

    /**
     * Entries strictly after {@code cursor}, in feed order, at most {@code pageSize} of them.
     * A non-positive page size means the configured default.
     */
    FeedPage readFeed(String feedId, int shardId, Cursor cursor, int pageSize);
}
