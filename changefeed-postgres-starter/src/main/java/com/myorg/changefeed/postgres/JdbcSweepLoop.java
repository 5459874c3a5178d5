package com.myorg.changefeed.postgres;

import com.myorg.changefeed.SweepLoop;
import com.myorg.changefeed.contracts.core.exception.SweepRaceException;
import com.myorg.changefeed.contracts.core.exception.SweepWritersInFlightException;
import com.myorg.changefeed.contracts.sweep.SweepLoopStats;
import com.myorg.changefeed.contracts.sweep.SweepResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs sweeps for a group on one pinned connection.
 * <p>
 * The session holding {@code sweep-loop/{group}} is the only sweeper of the group. It also holds the
 * exclusive {@code longpoll/{feed}/{shard}} lock of every longpoll shard in the group; longpollers wait
 * for a shared lock on it, so unlocking and locking again after a shard advanced wakes all of them.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcSweepLoop implements SweepLoop {

    private final JdbcTemplate jdbc;
    private final JdbcSweeper sweeper;
    private final Clock clock;
    private final ChangefeedMetrics metrics; // may be null

    @Override
    public SweepLoopStats run(int sweepGroup, Duration wait, Duration duration, Duration sleep) {
        if (wait == null || duration == null || sleep == null) {
            throw new IllegalArgumentException("wait, duration and sleep must not be null");
        }
        return jdbc.execute((ConnectionCallback<SweepLoopStats>) con -> runPinned(con, sweepGroup, wait, duration, sleep));
    }

    private SweepLoopStats runPinned(Connection con, int sweepGroup, Duration wait, Duration duration, Duration sleep) {
        SingleConnectionDataSource pinned = new SingleConnectionDataSource(con, true);
        JdbcTemplate session = new JdbcTemplate(pinned);
        TransactionTemplate sessionTx = new TransactionTemplate(new DataSourceTransactionManager(pinned));
        JdbcSweeper pinnedSweeper = sweeper.pinnedTo(session, sessionTx);

        if (!lockWithTimeout(session, LockKeys.sweepLoop(sweepGroup), wait)) {
            log.debug("Changefeed sweep loop group={} not acquired within {}", sweepGroup, wait);
            return SweepLoopStats.notAcquired();
        }

        Set<Long> longpollKeys = new HashSet<>();
        int iterations = 0;
        long assigned = 0;
        int races = 0;
        long maxLag = 0;
        try {
            Instant end = clock.instant().plus(duration);
            while (true) {
                lockNewLongpollShards(session, sweepGroup, longpollKeys);

                iterations++;
                List<SweepResult> results = List.of();
                try {
                    results = pinnedSweeper.sweep(sweepGroup);
                } catch (SweepRaceException e) {
                    races++;
                    if (metrics != null) metrics.incRaces();
                    log.warn("Changefeed sweep RACE group={} expected={} actual={}", sweepGroup, e.getExpected(), e.getActual());
                } catch (SweepWritersInFlightException e) {
                    log.debug("Changefeed sweep group={} waited {} for open writers, retrying", sweepGroup, e.getWaited());
                }

                for (SweepResult r : results) {
                    assigned += r.changesAssigned();
                    maxLag = Math.max(maxLag, r.lagMillis());
                    long key = LockKeys.longpoll(r.feedId(), r.shardId());
                    if (r.changesAssigned() > 0 && longpollKeys.contains(key)) {
                        PgLocks.sessionUnlock(session, key);
                        PgLocks.sessionLock(session, key);
                    }
                }

                if (!clock.instant().isBefore(end)) break;
                if (!pause(sleep)) break;
            }
        } finally {
            PgLocks.unlockAll(session);
        }

        log.debug("Changefeed sweep loop group={} iterations={} assigned={} races={} maxLagMs={}",
                sweepGroup, iterations, assigned, races, maxLag);
        return new SweepLoopStats(true, iterations, assigned, races, maxLag);
    }

    private boolean lockWithTimeout(JdbcTemplate session, long key, Duration wait) {
        String original = PgLocks.currentLockTimeout(session);
        PgLocks.setLockTimeout(session, wait, false);
        try {
            PgLocks.sessionLock(session, key);
            return true;
        } catch (DataAccessException e) {
            if (PgErrors.isLockTimeout(e)) return false;
            throw e;
        } finally {
            PgLocks.setLockTimeout(session, original, false);
        }
    }

    private void lockNewLongpollShards(JdbcTemplate session, int sweepGroup, Set<Long> held) {
        List<Long> keys = session.query("""
                select feed_id, shard_id from changefeed.shard
                 where sweep_group = ? and longpoll
                """,
                (rs, i) -> LockKeys.longpoll(rs.getString("feed_id"), rs.getInt("shard_id")),
                sweepGroup);
        for (Long key : keys) {
            if (held.add(key)) PgLocks.sessionLock(session, key);
        }
    }

    private static boolean pause(Duration sleep) {
        if (sleep.isZero() || sleep.isNegative()) return true;
        try {
            Thread.sleep(sleep.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
