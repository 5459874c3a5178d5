package com.myorg.changefeed.postgres;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.changefeed.ChangefeedTransaction;
import com.myorg.changefeed.ChangefeedTransactions;
import com.myorg.changefeed.FeedRegistry;
import com.myorg.changefeed.WriterLockCoordinator;
import com.myorg.changefeed.contracts.lock.LockResult;
import com.myorg.changefeed.contracts.ulid.UlidState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;

/**
 * Each handle owns a physical connection taken straight from the pool, outside any Spring
 * managed transaction, so the writer lock lives exactly as long as the handle.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcChangefeedTransactions implements ChangefeedTransactions {

    private final DataSource dataSource;
    private final FeedRegistry feeds;
    private final WriterLockCoordinator coordinator;
    private final ObjectMapper mapper;
    private final Clock clock;

    @Override
    public ChangefeedTransaction begin(String feedId, int shardId, Instant timeHint) {
        if (feedId == null || feedId.isBlank()) throw new IllegalArgumentException("feedId must not be blank");

        // outside the writer transaction: a pending shard insert would block other writers without a timeout
        feeds.insertShard(feedId, shardId);

        Connection connection = open();
        try {
            connection.setAutoCommit(false);
            // READ COMMITTED: statements after the lock wait must see what the previous holder committed
            connection.setTransactionIsolation(Connection.TRANSACTION_READ_COMMITTED);
            JdbcTemplate tx = new JdbcTemplate(new SingleConnectionDataSource(connection, true));

            LockResult lock = coordinator.acquire(connection, feedId, shardId);
            Instant hint = timeHint != null ? timeHint : clock.instant();
            UlidState state = UlidState.begin(ShardUlids.load(tx, feedId, shardId).orElse(null), hint);

            log.debug("Changefeed writer began feedId={} shardId={} attempts={} incident={} next={}",
                    feedId, shardId, lock.attempts(), lock.incidentDetected(), state.current());
            return new JdbcChangefeedTransaction(connection, tx, mapper, feedId, shardId, lock, state);
        } catch (RuntimeException e) {
            abandon(connection, e);
            throw e;
        } catch (SQLException e) {
            DataAccessResourceFailureException ex =
                    new DataAccessResourceFailureException("Failed to prepare writer connection", e);
            abandon(connection, ex);
            throw ex;
        }
    }

    private Connection open() {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            throw new DataAccessResourceFailureException("Failed to obtain writer connection", e);
        }
    }

    static void abandon(Connection connection, Exception cause) {
        try {
            if (!connection.isClosed() && !connection.getAutoCommit()) connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
        try {
            connection.close();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
