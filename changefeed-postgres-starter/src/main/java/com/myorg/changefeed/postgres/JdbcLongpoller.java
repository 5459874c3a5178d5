package com.myorg.changefeed.postgres;

import com.myorg.changefeed.Longpoller;
import com.myorg.changefeed.contracts.core.exception.ChangefeedNonRetryableException;
import com.myorg.changefeed.contracts.core.exception.NoActiveSweeperException;
import com.myorg.changefeed.contracts.core.exception.UnknownShardException;
import com.myorg.changefeed.contracts.feed.LongpollOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Longpoll built on lock hand-off.
 * <p>
 * The sweep loop holds the shard's longpoll lock exclusively and cycles it when the shard advances.
 * A longpoller asks for the same lock in shared mode on a dedicated connection, so the grant itself
 * is the signal. Before trusting the wait it confirms in {@code pg_locks} that the request is queued,
 * then re-reads the shard: a sweep that landed between the first read and the queueing would
 * otherwise be missed until the next one.
 */
@Slf4j
public class JdbcLongpoller implements Longpoller, AutoCloseable {

    enum WaitResult { SIGNALLED, TIMED_OUT, NO_LOCK_HOLDER, CANCELLED }

    private record ShardPosition(int sweepGroup, boolean longpoll, long lastSequenceNumber) {}

    private final DataSource dataSource;
    private final JdbcTemplate jdbc;
    private final ChangefeedProperties props;
    private final ChangefeedMetrics metrics; // may be null
    private final ExecutorService waiters;

    public JdbcLongpoller(DataSource dataSource, JdbcTemplate jdbc, ChangefeedProperties props, ChangefeedMetrics metrics) {
        this.dataSource = dataSource;
        this.jdbc = jdbc;
        this.props = props;
        this.metrics = metrics;
        CustomizableThreadFactory tf = new CustomizableThreadFactory("changefeed-longpoll-");
        tf.setDaemon(true);
        this.waiters = Executors.newCachedThreadPool(tf);
    }

    @Override
    public LongpollOutcome longpoll(String feedId, int shardId, Duration timeout, long seenSequenceNumber) {
        if (feedId == null || feedId.isBlank()) throw new IllegalArgumentException("feedId must not be blank");
        if (timeout == null || timeout.isNegative()) throw new IllegalArgumentException("timeout must be >= 0");

        ShardPosition before = position(feedId, shardId);
        // the sweep loop only holds longpoll locks of longpoll shards; waiting on any other would return at once
        if (!before.longpoll()) {
            throw new ChangefeedNonRetryableException("LONGPOLL_DISABLED",
                    "Longpoll is not enabled for feed=" + feedId + " shard=" + shardId);
        }
        if (before.lastSequenceNumber() != seenSequenceNumber) return LongpollOutcome.CHANGED;

        long key = LockKeys.longpoll(feedId, shardId);
        Connection connection = open();
        try {
            connection.setAutoCommit(false);
            JdbcTemplate waiter = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
            Integer pid = waiter.queryForObject("select pg_backend_pid()", Integer.class);

            Future<WaitResult> pending = waiters.submit(() -> waitForSignal(waiter, connection, key, timeout));
            guard(pid, pending);

            if (position(feedId, shardId).lastSequenceNumber() != seenSequenceNumber) {
                if (!pending.isDone()) jdbc.queryForObject("select pg_cancel_backend(?)", Boolean.class, pid);
                await(pending, pid, props.getLongpoll().getGrace());
                return LongpollOutcome.CHANGED;
            }

            WaitResult result = await(pending, pid, timeout.plus(props.getLongpoll().getGrace()));
            switch (result) {
                case SIGNALLED:
                    return LongpollOutcome.SIGNALLED;
                case TIMED_OUT:
                    if (metrics != null) metrics.incLongpollTimeouts();
                    return LongpollOutcome.TIMED_OUT;
                case CANCELLED:
                    return LongpollOutcome.CHANGED;
                default:
                    // the lock may have been free only while the sweeper was cycling it
                    if (PgLocks.isHeld(jdbc, LockKeys.sweepLoop(before.sweepGroup()))) return LongpollOutcome.SIGNALLED;
                    if (metrics != null) metrics.incNoSweeper();
                    throw new NoActiveSweeperException(feedId, shardId);
            }
        } catch (SQLException e) {
            throw new DataAccessResourceFailureException("Failed to prepare longpoll connection", e);
        } finally {
            close(connection);
        }
    }

    /** Runs on a waiter thread; always ends the transaction so a granted shared lock is released at once. */
    private WaitResult waitForSignal(JdbcTemplate waiter, Connection connection, long key, Duration timeout) {
        try {
            PgLocks.setLockTimeout(waiter, timeout, true);
            if (PgLocks.tryXactLockShared(waiter, key)) return WaitResult.NO_LOCK_HOLDER;
            PgLocks.xactLockShared(waiter, key);
            return WaitResult.SIGNALLED;
        } catch (DataAccessException e) {
            if (PgErrors.isLockTimeout(e)) return WaitResult.TIMED_OUT;
            if (PgErrors.isQueryCanceled(e)) return WaitResult.CANCELLED;
            throw e;
        } finally {
            try {
                connection.rollback();
            } catch (SQLException e) {
                log.warn("Longpoll rollback failed, connection will be discarded", e);
            }
        }
    }

    private void guard(int pid, Future<WaitResult> pending) {
        long deadline = System.nanoTime() + props.getLongpoll().getGuardTimeout().toNanos();
        long interval = Math.max(1, props.getLongpoll().getGuardInterval().toMillis());
        while (!pending.isDone() && System.nanoTime() < deadline) {
            Boolean waiting = jdbc.queryForObject(
                    "select exists(select 1 from pg_locks where pid = ? and locktype = 'advisory' and not granted)",
                    Boolean.class, pid);
            if (Boolean.TRUE.equals(waiting)) return;
            try {
                Thread.sleep(interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private WaitResult await(Future<WaitResult> pending, int pid, Duration max) {
        try {
            return pending.get(max.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            jdbc.queryForObject("select pg_cancel_backend(?)", Boolean.class, pid);
            pending.cancel(true);
            throw new QueryTimeoutException("Longpoll wait did not finish within " + max, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.cancel(true);
            throw new QueryTimeoutException("Interrupted while waiting for longpoll", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new IllegalStateException("Longpoll wait failed", e.getCause());
        }
    }

    private ShardPosition position(String feedId, int shardId) {
        List<ShardPosition> rows = jdbc.query(
                "select sweep_group, longpoll, last_sequence_number from changefeed.shard where feed_id = ? and shard_id = ?",
                (rs, i) -> new ShardPosition(
                        rs.getInt("sweep_group"), rs.getBoolean("longpoll"), rs.getLong("last_sequence_number")),
                feedId, shardId);
        if (rows.isEmpty()) throw new UnknownShardException(feedId, shardId);
        return rows.get(0);
    }

    private Connection open() {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            throw new DataAccessResourceFailureException("Failed to obtain longpoll connection", e);
        }
    }

    private static void close(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.debug("Longpoll connection close failed", e);
        }
    }

    @Override
    public void close() {
        waiters.shutdownNow();
    }
}
