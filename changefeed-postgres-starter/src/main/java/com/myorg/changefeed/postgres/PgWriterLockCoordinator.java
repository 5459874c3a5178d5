package com.myorg.changefeed.postgres;

import com.myorg.changefeed.WriterLockCoordinator;
import com.myorg.changefeed.contracts.core.exception.IncidentRetryExhaustedException;
import com.myorg.changefeed.contracts.core.exception.LockTimeoutException;
import com.myorg.changefeed.contracts.lock.LockResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Writer lock on top of {@code pg_advisory_xact_lock}.
 * <p>
 * Each attempt runs under a short {@code lock_timeout} inside a savepoint. After a timed out attempt the
 * holder is looked up in {@code pg_locks} / {@code pg_stat_activity} on a separate autocommit connection
 * (activity views are snapshotted per transaction). A holder that is idle in transaction (aborted or not) past the idle
 * threshold, or whose transaction is older than {@code maxHold}, is an incident: the incident count is
 * bumped with a compare-and-set and only the winner terminates the holder. Anything else is contention.
 */
@Slf4j
@RequiredArgsConstructor
public class PgWriterLockCoordinator implements WriterLockCoordinator {

    private final DataSource dataSource;
    private final ChangefeedProperties props;
    private final Clock clock;
    private final ChangefeedMetrics metrics; // may be null

    record Holder(int pid, String state, Instant xactStart, long idleMillis, long holdMillis) {}

    @Override
    public LockResult acquire(Connection connection, String feedId, int shardId) {
        if (feedId == null || feedId.isBlank()) throw new IllegalArgumentException("feedId must not be blank");
        requireTransaction(connection);

        ChangefeedProperties.Lock cfg = props.getLock();
        long key = LockKeys.shard(feedId, shardId);
        JdbcTemplate tx = new JdbcTemplate(new SingleConnectionDataSource(connection, true));

        Instant deadline = clock.instant().plus(cfg.getWaitTimeout());
        String originalTimeout = PgLocks.currentLockTimeout(tx);
        PgLocks.setLockTimeout(tx, cfg.getAttemptTimeout(), true);

        int attempts = 0;
        int incidents = 0;
        boolean detected = false;

        while (true) {
            attempts++;
            long token = onSideConnection(side -> incidentCount(side, feedId, shardId));

            if (tryLock(connection, tx, key)) {
                PgLocks.setLockTimeout(tx, originalTimeout, true);
                return new LockResult(detected, token, attempts);
            }

            Optional<Holder> holder = onSideConnection(side -> findHolder(side, key));
            if (holder.isPresent() && isIncident(holder.get(), cfg)) {
                incidents++;
                if (incidents > cfg.getMaxIncidentRetries()) {
                    throw new IncidentRetryExhaustedException(feedId, shardId, attempts, token);
                }
                Holder h = holder.get();
                boolean won = onSideConnection(side -> burn(side, feedId, shardId, token, h));
                if (won) {
                    detected = true;
                    if (metrics != null) metrics.incIncidents();
                    log.warn("Changefeed INCIDENT feedId={} shardId={} holderPid={} state={} idleMs={} holdMs={} incidentCount={}",
                            feedId, shardId, h.pid(), h.state(), h.idleMillis(), h.holdMillis(), token + 1);
                } else {
                    log.debug("Changefeed incident on feedId={} shardId={} handled by another writer", feedId, shardId);
                }
                continue;
            }

            if (!clock.instant().isBefore(deadline)) {
                throw new LockTimeoutException(feedId, shardId, cfg.getWaitTimeout(), attempts);
            }
            log.debug("Changefeed writer lock busy feedId={} shardId={} attempt={} holder={}",
                    feedId, shardId, attempts, holder.map(Holder::pid).orElse(null));
        }
    }

    private boolean tryLock(Connection connection, JdbcTemplate tx, long key) {
        Savepoint sp = savepoint(connection);
        try {
            PgLocks.xactLock(tx, key);
            connection.releaseSavepoint(sp);
            return true;
        } catch (DataAccessException e) {
            if (!PgErrors.isLockTimeout(e)) throw e;
            rollbackTo(connection, sp, e);
            return false;
        } catch (SQLException e) {
            throw new DataAccessResourceFailureException("Failed to release savepoint", e);
        }
    }

    static long incidentCount(JdbcTemplate jdbc, String feedId, int shardId) {
        List<Long> rows = jdbc.queryForList(
                "select incident_count from changefeed.incident where feed_id = ? and shard_id = ?",
                Long.class, feedId, shardId);
        return rows.isEmpty() ? 0L : rows.get(0);
    }

    static Optional<Holder> findHolder(JdbcTemplate jdbc, long key) {
        List<Holder> rows = jdbc.query("""
                select l.pid,
                       a.state,
                       a.xact_start,
                       coalesce((extract(epoch from clock_timestamp() - a.state_change) * 1000)::bigint, 0) as idle_ms,
                       coalesce((extract(epoch from clock_timestamp() - a.xact_start) * 1000)::bigint, 0) as hold_ms
                  from pg_locks l
                  join pg_stat_activity a on a.pid = l.pid
                 where l.locktype = 'advisory'
                   and l.database = (select oid from pg_database where datname = current_database())
                   and l.classid::bigint = ? and l.objid::bigint = ? and l.objsubid = 1
                   and l.granted
                 limit 1
                """,
                (rs, i) -> new Holder(
                        rs.getInt("pid"),
                        rs.getString("state"),
                        toInstant(rs.getTimestamp("xact_start")),
                        rs.getLong("idle_ms"),
                        rs.getLong("hold_ms")),
                LockKeys.classId(key), LockKeys.objId(key));
        return rows.stream().findFirst();
    }

    static boolean isIncident(Holder h, ChangefeedProperties.Lock cfg) {
        // also "idle in transaction (aborted)": a failed statement leaves a transaction that can only roll back
        boolean abandoned = h.state() != null && h.state().startsWith("idle in transaction")
                && h.idleMillis() >= cfg.getIncidentIdleThreshold().toMillis();
        boolean overdue = h.xactStart() != null && h.holdMillis() >= cfg.getMaxHold().toMillis();
        return abandoned || overdue;
    }

    /**
     * Moves the incident count from {@code token} to {@code token + 1}; the caller that succeeds
     * terminates the holder, provided it is still in the same transaction.
     */
    static boolean burn(JdbcTemplate jdbc, String feedId, int shardId, long token, Holder h) {
        int won = jdbc.update("""
                insert into changefeed.incident as i (feed_id, shard_id, incident_count, last_incident_time)
                values (?, ?, 1, now())
                on conflict (feed_id, shard_id) do update
                   set incident_count = i.incident_count + 1,
                       last_incident_time = now()
                 where i.incident_count = ?
                """, feedId, shardId, token);
        if (won == 0) return false;

        List<Boolean> terminated = jdbc.queryForList("""
                select pg_terminate_backend(a.pid)
                  from pg_stat_activity a
                 where a.pid = ? and a.xact_start = ?
                """, Boolean.class, h.pid(), Timestamp.from(h.xactStart()));
        if (terminated.isEmpty()) {
            log.debug("Changefeed incident holder pid={} finished before it could be terminated", h.pid());
        }
        return true;
    }

    private <T> T onSideConnection(Function<JdbcTemplate, T> work) {
        try (Connection c = dataSource.getConnection()) {
            if (!c.getAutoCommit()) c.setAutoCommit(true);
            return work.apply(new JdbcTemplate(new SingleConnectionDataSource(c, true)));
        } catch (SQLException e) {
            throw new DataAccessResourceFailureException("Failed to obtain inspection connection", e);
        }
    }

    private static void requireTransaction(Connection connection) {
        try {
            if (connection.getAutoCommit()) {
                throw new IllegalStateException("writer lock must be taken inside a transaction (autocommit is on)");
            }
        } catch (SQLException e) {
            throw new DataAccessResourceFailureException("Failed to inspect connection", e);
        }
    }

    private static Savepoint savepoint(Connection connection) {
        try {
            return connection.setSavepoint();
        } catch (SQLException e) {
            throw new DataAccessResourceFailureException("Failed to set savepoint", e);
        }
    }

    private static void rollbackTo(Connection connection, Savepoint sp, DataAccessException cause) {
        try {
            connection.rollback(sp);
        } catch (SQLException e) {
            cause.addSuppressed(e);
            throw cause;
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
