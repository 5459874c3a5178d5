package com.myorg.changefeed.postgres;

import com.myorg.changefeed.Sweeper;
import com.myorg.changefeed.contracts.core.exception.SweepRaceException;
import com.myorg.changefeed.contracts.core.exception.SweepWritersInFlightException;
import com.myorg.changefeed.contracts.sweep.SweepResult;
import com.myorg.changefeed.contracts.sweep.UnsweptChange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lazy sequence number assignment.
 * <p>
 * One call is one READ COMMITTED transaction serialized per sweep group by an advisory lock.
 * It first waits for change inserts still open in the group (they hold the shared writer lock, see
 * {@link LockKeys#CHANGE_WRITER_CLASS}), so no lower {@code change_id} can commit after the rows it sees.
 * Then it selects a batch of unnumbered changes in {@code change_id} order, bumps each shard's counter by the
 * number of its rows and numbers the rows from the old counter value. The row update only touches rows
 * that are still unnumbered; if fewer rows than selected were updated, someone else numbered them in the
 * meantime and the whole transaction is rolled back.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcSweeper implements Sweeper {

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final ChangefeedProperties props;
    private final Clock clock;
    private final SweepHooks hooks;
    private final ChangefeedMetrics metrics; // may be null

    private record ShardKey(String feedId, int shardId) {}

    /** Same sweeper, running its statements on the given template and transactions. */
    public JdbcSweeper pinnedTo(JdbcTemplate pinnedJdbc, TransactionTemplate pinnedTx) {
        return new JdbcSweeper(pinnedJdbc, pinnedTx, props, clock, hooks, metrics);
    }

    @Override
    public List<SweepResult> sweep(int sweepGroup) {
        List<SweepResult> results = tx.execute(st -> sweepInTransaction(sweepGroup));
        results = Objects.requireNonNullElse(results, List.of());

        long assigned = results.stream().mapToLong(SweepResult::changesAssigned).sum();
        if (assigned > 0) {
            if (metrics != null) metrics.incAssigned(assigned);
            log.debug("Changefeed sweep group={} shards={} assigned={}", sweepGroup, results.size(), assigned);
        }
        return results;
    }

    private List<SweepResult> sweepInTransaction(int sweepGroup) {
        PgLocks.xactLock(jdbc, LockKeys.sweep(sweepGroup));
        awaitOpenWriters(sweepGroup);

        List<UnsweptChange> batch = jdbc.query("""
                select change_id, feed_id, shard_id,
                       row_number() over (partition by feed_id, shard_id order by change_id) as rank
                  from (select c.change_id, c.feed_id, c.shard_id
                          from changefeed.change c
                          join changefeed.shard s on s.feed_id = c.feed_id and s.shard_id = c.shard_id
                         where s.sweep_group = ?
                           and c.change_sequence_number is null
                         order by c.change_id
                         limit ?) b
                 order by change_id
                """,
                (rs, i) -> new UnsweptChange(
                        rs.getLong("change_id"),
                        rs.getString("feed_id"),
                        rs.getInt("shard_id"),
                        rs.getLong("rank")),
                sweepGroup, props.getSweep().getBatchSize());
        if (batch.isEmpty()) return List.of();

        hooks.afterSelect(sweepGroup, batch);

        Map<ShardKey, Integer> counts = new LinkedHashMap<>();
        for (UnsweptChange c : batch) {
            counts.merge(new ShardKey(c.feedId(), c.shardId()), 1, Integer::sum);
        }

        Instant now = clock.instant();
        String[] feedIds = new String[counts.size()];
        int[] shardIds = new int[counts.size()];
        long[] changeCounts = new long[counts.size()];
        int i = 0;
        for (Map.Entry<ShardKey, Integer> e : counts.entrySet()) {
            feedIds[i] = e.getKey().feedId();
            shardIds[i] = e.getKey().shardId();
            changeCounts[i] = e.getValue();
            i++;
        }

        List<SweepResult> results = jdbc.query("""
                update changefeed.shard s
                   set last_sequence_number = s.last_sequence_number + v.change_count,
                       last_sweep_time = ?
                  from (select u.feed_id, u.shard_id, u.change_count, p.last_sweep_time as previous_sweep_time
                          from unnest(?::varchar[], ?::int[], ?::bigint[]) as u(feed_id, shard_id, change_count)
                          join changefeed.shard p on p.feed_id = u.feed_id and p.shard_id = u.shard_id) v
                 where s.feed_id = v.feed_id and s.shard_id = v.shard_id
                returning s.feed_id, s.shard_id, v.change_count,
                          s.last_sequence_number - v.change_count as before,
                          v.previous_sweep_time
                """,
                (rs, n) -> {
                    Timestamp previous = rs.getTimestamp("previous_sweep_time");
                    long lag = previous == null ? 0L : Math.max(0L, now.toEpochMilli() - previous.getTime());
                    return new SweepResult(
                            rs.getString("feed_id"),
                            rs.getInt("shard_id"),
                            rs.getInt("change_count"),
                            rs.getLong("before"),
                            lag);
                },
                Timestamp.from(now), feedIds, shardIds, changeCounts);

        if (results.size() != counts.size()) {
            throw new SweepRaceException(sweepGroup, counts.size(), results.size());
        }

        Map<ShardKey, Long> before = new LinkedHashMap<>();
        for (SweepResult r : results) {
            before.put(new ShardKey(r.feedId(), r.shardId()), r.lastSequenceNumberBefore());
        }

        long[] changeIds = new long[batch.size()];
        long[] sequenceNumbers = new long[batch.size()];
        for (int j = 0; j < batch.size(); j++) {
            UnsweptChange c = batch.get(j);
            changeIds[j] = c.changeId();
            sequenceNumbers[j] = before.get(new ShardKey(c.feedId(), c.shardId())) + c.rank();
        }

        int updated = jdbc.update("""
                update changefeed.change c
                   set change_sequence_number = v.change_sequence_number
                  from unnest(?::bigint[], ?::bigint[]) as v(change_id, change_sequence_number)
                 where c.change_id = v.change_id
                   and c.change_sequence_number is null
                """, changeIds, sequenceNumbers);

        if (updated != batch.size()) {
            throw new SweepRaceException(sweepGroup, batch.size(), updated);
        }

        List<SweepResult> ordered = new ArrayList<>(results.size());
        for (ShardKey k : counts.keySet()) {
            results.stream()
                    .filter(r -> r.feedId().equals(k.feedId()) && r.shardId() == k.shardId())
                    .findFirst()
                    .ifPresent(ordered::add);
        }
        return ordered;
    }

    private void awaitOpenWriters(int sweepGroup) {
        Duration wait = props.getSweep().getWriterWait();
        String original = PgLocks.currentLockTimeout(jdbc);
        PgLocks.setLockTimeout(jdbc, wait, true);
        try {
            PgLocks.xactLock(jdbc, LockKeys.CHANGE_WRITER_CLASS, sweepGroup);
        } catch (DataAccessException e) {
            if (PgErrors.isLockTimeout(e)) throw new SweepWritersInFlightException(sweepGroup, wait, e);
            throw e;
        }
        PgLocks.setLockTimeout(jdbc, original, true);
    }
}
