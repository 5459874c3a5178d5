package com.myorg.changefeed.postgres;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.changefeed.FeedRegistry;
import com.myorg.changefeed.OutboxWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;

/**
 * Appends to the outbox without touching the writer lock. Ids are assigned later, when a reader
 * folds the outbox into the feed.
 */
@RequiredArgsConstructor
public class JdbcOutboxWriter implements OutboxWriter {

    private final JdbcTemplate jdbc;
    private final FeedRegistry feeds;
    private final ObjectMapper mapper;

    @Override
    public long append(String feedId, int shardId, Instant timeHint, Object payload) {
        if (feedId == null || feedId.isBlank()) throw new IllegalArgumentException("feedId must not be blank");
        if (payload == null) throw new IllegalArgumentException("payload must not be null");

        String json = JdbcChangeWriter.toJson(mapper, payload);
        feeds.insertShard(feedId, shardId);

        Long id = jdbc.queryForObject("""
                INSERT INTO changefeed.outbox (feed_id, shard_id, time_hint, payload)
                VALUES (?, ?, ?, CAST(? AS jsonb))
                RETURNING outbox_id
                """, Long.class, feedId, shardId, timeHint == null ? null : Timestamp.from(timeHint), json);

        if (id == null) throw new IllegalStateException("No outbox_id returned from insert");
        return id;
    }
}
