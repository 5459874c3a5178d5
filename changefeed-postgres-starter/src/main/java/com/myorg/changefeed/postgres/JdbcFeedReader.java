package com.myorg.changefeed.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.changefeed.FeedReader;
import com.myorg.changefeed.FeedRegistry;
import com.myorg.changefeed.WriterLockCoordinator;
import com.myorg.changefeed.contracts.core.exception.ChangefeedIntegrityException;
import com.myorg.changefeed.contracts.core.exception.UnknownFeedException;
import com.myorg.changefeed.contracts.feed.Cursor;
import com.myorg.changefeed.contracts.feed.FeedEntry;
import com.myorg.changefeed.contracts.feed.FeedMode;
import com.myorg.changefeed.contracts.feed.FeedPage;
import com.myorg.changefeed.contracts.ulid.Ulid;
import com.myorg.changefeed.contracts.ulid.UlidState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Pages through a shard in feed order.
 * <p>
 * For {@code OUTBOX} feeds pending outbox rows are first folded into {@code feed_entry} under the shard
 * writer lock, in outbox insertion order. Each row's id uses {@code max(time_hint, last issued time)},
 * so ids keep increasing even when hints go backwards.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcFeedReader implements FeedReader {

    private final DataSource dataSource;
    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final FeedRegistry feeds;
    private final WriterLockCoordinator coordinator;
    private final ObjectMapper mapper;
    private final ChangefeedProperties props;

    record OutboxRow(long outboxId, Instant timeHint, Instant insertedAt, String payloadJson) {}

    @Override
    public FeedPage readFeed(String feedId, int shardId, Cursor cursor, int pageSize) {
        if (feedId == null || feedId.isBlank()) throw new IllegalArgumentException("feedId must not be blank");
        Cursor from = cursor == null ? Cursor.START : cursor;
        int limit = pageSize(pageSize);

        FeedMode mode = feeds.findFeed(feedId)
                .orElseThrow(() -> new UnknownFeedException(feedId))
                .getMode();

        List<FeedEntry> entries = switch (mode) {
            case SWEEP -> readChanges(feedId, shardId, from, limit);
            case BLOCKING -> readEntries(feedId, shardId, from, limit);
            case OUTBOX -> {
                foldOutbox(feedId, shardId);
                yield readEntries(feedId, shardId, from, limit);
            }
        };

        Cursor next = entries.isEmpty() ? from : entries.get(entries.size() - 1).cursor();
        return new FeedPage(entries, next);
    }

    int pageSize(int requested) {
        ChangefeedProperties.Read cfg = props.getRead();
        if (requested <= 0) return cfg.getDefaultPageSize();
        return Math.min(requested, cfg.getMaxPageSize());
    }

    private List<FeedEntry> readChanges(String feedId, int shardId, Cursor from, int limit) {
        return jdbc.query("""
                select change_sequence_number, inserted_at, payload::text as payload
                  from changefeed.change
                 where feed_id = ? and shard_id = ?
                   and change_sequence_number > ?
                 order by change_sequence_number
                 limit ?
                """,
                (rs, i) -> new FeedEntry(
                        Cursor.ofSequenceNumber(rs.getLong("change_sequence_number")),
                        rs.getTimestamp("inserted_at").toInstant(),
                        parse(rs.getString("payload"))),
                feedId, shardId, from.sequenceNumber(), limit);
    }

    private List<FeedEntry> readEntries(String feedId, int shardId, Cursor from, int limit) {
        return jdbc.query("""
                select ulid, time, payload::text as payload
                  from changefeed.feed_entry
                 where feed_id = ? and shard_id = ?
                   and ulid > ?
                 order by ulid
                 limit ?
                """,
                (rs, i) -> new FeedEntry(
                        Cursor.fromBytes(rs.getBytes("ulid")),
                        rs.getTimestamp("time").toInstant(),
                        parse(rs.getString("payload"))),
                feedId, shardId, from.toBytes(), limit);
    }

    /** Returns the number of outbox rows moved into the feed. */
    int foldOutbox(String feedId, int shardId) {
        Boolean pending = jdbc.queryForObject(
                "select exists(select 1 from changefeed.outbox where feed_id = ? and shard_id = ?)",
                Boolean.class, feedId, shardId);
        if (!Boolean.TRUE.equals(pending)) return 0;

        Integer folded = tx.execute(st -> {
            Connection connection = DataSourceUtils.getConnection(dataSource);
            coordinator.acquire(connection, feedId, shardId);

            UlidState state = ShardUlids.load(jdbc, feedId, shardId).orElse(null);
            List<OutboxRow> rows = jdbc.query("""
                    select outbox_id, time_hint, inserted_at, payload::text as payload
                      from changefeed.outbox
                     where feed_id = ? and shard_id = ?
                     order by outbox_id
                     limit ?
                    """,
                    (rs, i) -> new OutboxRow(
                            rs.getLong("outbox_id"),
                            JdbcFeedRegistry.toInstant(rs.getTimestamp("time_hint")),
                            rs.getTimestamp("inserted_at").toInstant(),
                            rs.getString("payload")),
                    feedId, shardId, props.getOutbox().getFoldBatchSize());
            if (rows.isEmpty()) return 0;

            List<Object[]> inserts = new ArrayList<>(rows.size());
            long[] outboxIds = new long[rows.size()];
            for (int i = 0; i < rows.size(); i++) {
                OutboxRow row = rows.get(i);
                Instant hint = row.timeHint() != null ? row.timeHint() : row.insertedAt();
                state = UlidState.begin(state, hint);
                Ulid id = state.current();
                state = state.advance();

                inserts.add(new Object[]{feedId, shardId, id.toBytes(), Timestamp.from(id.time()), row.payloadJson()});
                outboxIds[i] = row.outboxId();
            }

            jdbc.batchUpdate("""
                    insert into changefeed.feed_entry (feed_id, shard_id, ulid, time, payload)
                    values (?, ?, ?, ?, CAST(? AS jsonb))
                    """, inserts);

            int deleted = jdbc.update("""
                    delete from changefeed.outbox
                     where feed_id = ? and shard_id = ?
                       and outbox_id = any(?::bigint[])
                    """, feedId, shardId, outboxIds);
            if (deleted != rows.size()) {
                throw new ChangefeedIntegrityException("UNEXPECTED_OUTBOX_DELETE_COUNT",
                        "Outbox fold feed=" + feedId + " shard=" + shardId + " deleted " + deleted + " rows, expected " + rows.size());
            }

            ShardUlids.store(jdbc, feedId, shardId, state);
            return rows.size();
        });

        int n = folded == null ? 0 : folded;
        if (n > 0) log.debug("Changefeed outbox folded feedId={} shardId={} rows={}", feedId, shardId, n);
        return n;
    }

    private JsonNode parse(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payload is not valid JSON", e);
        }
    }
}
