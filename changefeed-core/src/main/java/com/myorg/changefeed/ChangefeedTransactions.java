package com.myorg.changefeed;

import java.time.Instant;

/**
 * Entry point for serialized ("blocking") writers of a shard.
 */
public interface ChangefeedTransactions {

    /**
     * Opens a database transaction, takes the shard writer lock (burning a stuck holder if needed)
     * and loads the shard's ULID state.
     *
     * @param timeHint time the writer wants its ids to carry; {@code null} means now. A hint earlier
     *                 than what the shard already issued is moved forward silently.
     */
    ChangefeedTransaction begin(String feedId, int shardId, Instant timeHint);

    default ChangefeedTransaction begin(String feedId, int shardId) {
        return begin(feedId, shardId, null);
    }
}
