package com.myorg.changefeed.postgres;

import com.myorg.changefeed.contracts.core.exception.UnknownShardException;
import com.myorg.changefeed.contracts.ulid.UlidState;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Optional;

/**
 * ULID state columns of the shard row. Both calls must run under the shard writer lock, in the
 * transaction that issues the ids.
 */
final class ShardUlids {

    private ShardUlids() {}

    /** Stamps {@code last_lock_time} and returns the stored state, empty if the shard never issued an id. */
    static Optional<UlidState> load(JdbcTemplate tx, String feedId, int shardId) {
        List<Optional<UlidState>> rows = tx.query("""
                update changefeed.shard
                   set last_lock_time = now()
                 where feed_id = ? and shard_id = ?
                returning ulid_prefix, ulid_suffix
                """,
                (rs, i) -> {
                    byte[] prefix = rs.getBytes("ulid_prefix");
                    if (prefix == null) return Optional.empty();
                    return Optional.of(UlidState.of(ByteBuffer.wrap(prefix).getLong(), rs.getLong("ulid_suffix")));
                },
                feedId, shardId);
        if (rows.isEmpty()) throw new UnknownShardException(feedId, shardId);
        return rows.get(0);
    }

    static void store(JdbcTemplate tx, String feedId, int shardId, UlidState state) {
        int updated = tx.update("""
                update changefeed.shard
                   set ulid_prefix = ?, ulid_suffix = ?
                 where feed_id = ? and shard_id = ?
                """, state.prefixBytes(), state.nextSuffix(), feedId, shardId);
        if (updated != 1) throw new UnknownShardException(feedId, shardId);
    }
}
