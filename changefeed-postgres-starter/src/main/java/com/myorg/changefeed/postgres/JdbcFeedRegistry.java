package com.myorg.changefeed.postgres;

import com.myorg.changefeed.FeedRegistry;
import com.myorg.changefeed.contracts.core.exception.ChangefeedNonRetryableException;
import com.myorg.changefeed.contracts.core.exception.UnknownFeedException;
import com.myorg.changefeed.contracts.feed.FeedDefinition;
import com.myorg.changefeed.contracts.feed.FeedMode;
import com.myorg.changefeed.contracts.feed.ShardState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class JdbcFeedRegistry implements FeedRegistry {

    private final JdbcTemplate jdbc;

    private static final RowMapper<FeedDefinition> FEED = (rs, i) -> FeedDefinition.builder()
            .feedId(rs.getString("feed_id"))
            .mode(FeedMode.valueOf(rs.getString("mode")))
            .sweepGroup(rs.getInt("sweep_group"))
            .longpoll(rs.getBoolean("longpoll"))
            .build();

    private static final RowMapper<ShardState> SHARD = (rs, i) -> new ShardState(
            rs.getString("feed_id"),
            rs.getInt("shard_id"),
            rs.getInt("sweep_group"),
            rs.getBoolean("longpoll"),
            rs.getLong("last_sequence_number"),
            toInstant(rs.getTimestamp("last_sweep_time")),
            toInstant(rs.getTimestamp("last_lock_time"))
    );

    @Override
    public FeedDefinition setupFeed(FeedDefinition feed) {
        if (feed == null) throw new IllegalArgumentException("feed must not be null");
        if (feed.getFeedId() == null || feed.getFeedId().isBlank()) throw new IllegalArgumentException("feedId must not be blank");
        if (feed.getFeedId().length() > 200) throw new IllegalArgumentException("feedId longer than 200 characters");
        if (feed.getMode() == null) throw new IllegalArgumentException("mode must not be null");

        int inserted = jdbc.update("""
                insert into changefeed.feed (feed_id, mode, sweep_group, longpoll)
                values (?, ?, ?, ?)
                on conflict (feed_id) do nothing
                """, feed.getFeedId(), feed.getMode().name(), feed.getSweepGroup(), feed.isLongpoll());

        FeedDefinition stored = findFeed(feed.getFeedId())
                .orElseThrow(() -> new IllegalStateException("feed vanished after insert: " + feed.getFeedId()));
        if (stored.getMode() != feed.getMode()) {
            throw new ChangefeedNonRetryableException("FEED_MODE_CONFLICT",
                    "Feed " + feed.getFeedId() + " already exists with mode " + stored.getMode());
        }
        if (inserted > 0) {
            log.info("Changefeed feed created feedId={} mode={} sweepGroup={} longpoll={}",
                    stored.getFeedId(), stored.getMode(), stored.getSweepGroup(), stored.isLongpoll());
        }
        return stored;
    }

    @Override
    public Optional<FeedDefinition> findFeed(String feedId) {
        List<FeedDefinition> rows = jdbc.query(
                "select feed_id, mode, sweep_group, longpoll from changefeed.feed where feed_id = ?", FEED, feedId);
        return rows.stream().findFirst();
    }

    @Override
    public void insertShard(String feedId, int shardId) {
        Boolean exists = jdbc.queryForObject(
                "select exists(select 1 from changefeed.shard where feed_id = ? and shard_id = ?)",
                Boolean.class, feedId, shardId);
        if (Boolean.TRUE.equals(exists)) return;

        int inserted = jdbc.update("""
                insert into changefeed.shard (feed_id, shard_id, sweep_group, longpoll)
                select f.feed_id, ?, f.sweep_group, f.longpoll
                  from changefeed.feed f
                 where f.feed_id = ?
                on conflict (feed_id, shard_id) do nothing
                """, shardId, feedId);
        if (inserted == 0 && findFeed(feedId).isEmpty()) {
            throw new UnknownFeedException(feedId);
        }
    }

    @Override
    public Optional<ShardState> shard(String feedId, int shardId) {
        List<ShardState> rows = jdbc.query("""
                select feed_id, shard_id, sweep_group, longpoll, last_sequence_number, last_sweep_time, last_lock_time
                  from changefeed.shard
                 where feed_id = ? and shard_id = ?
                """, SHARD, feedId, shardId);
        return rows.stream().findFirst();
    }

    @Override
    public long incidentCount(String feedId, int shardId) {
        List<Long> rows = jdbc.queryForList(
                "select incident_count from changefeed.incident where feed_id = ? and shard_id = ?",
                Long.class, feedId, shardId);
        return rows.isEmpty() ? 0L : rows.get(0);
    }

    /** Changes still waiting for a sequence number, all groups. */
    public long countUnswept() {
        Long n = jdbc.queryForObject(
                "select count(*) from changefeed.change where change_sequence_number is null", Long.class);
        return n == null ? 0L : n;
    }

    static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
