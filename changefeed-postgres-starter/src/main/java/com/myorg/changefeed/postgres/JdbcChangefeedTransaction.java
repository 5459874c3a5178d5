package com.myorg.changefeed.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.changefeed.ChangefeedTransaction;
import com.myorg.changefeed.contracts.lock.LockResult;
import com.myorg.changefeed.contracts.ulid.Ulid;
import com.myorg.changefeed.contracts.ulid.UlidState;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * Handle returned by {@link JdbcChangefeedTransactions#begin}.
 * <p>
 * The shard's ULID state is written in the same database transaction right before {@code COMMIT},
 * so it becomes durable together with the caller's data and a rolled back attempt leaves no trace.
 */
class JdbcChangefeedTransaction implements ChangefeedTransaction {

    private final Connection connection;
    private final JdbcTemplate tx;
    private final ObjectMapper mapper;
    private final String feedId;
    private final int shardId;
    private final LockResult lockResult;
    private final Instant time;

    private UlidState state;
    private boolean finished;

    JdbcChangefeedTransaction(Connection connection,
                              JdbcTemplate tx,
                              ObjectMapper mapper,
                              String feedId,
                              int shardId,
                              LockResult lockResult,
                              UlidState state) {
        this.connection = connection;
        this.tx = tx;
        this.mapper = mapper;
        this.feedId = feedId;
        this.shardId = shardId;
        this.lockResult = lockResult;
        this.state = state;
        this.time = state.time();
    }

    @Override public String feedId() { return feedId; }
    @Override public int shardId() { return shardId; }
    @Override public Instant time() { return time; }
    @Override public LockResult lockResult() { return lockResult; }

    @Override
    public synchronized Ulid nextUlid() {
        checkOpen();
        Ulid id = state.current();
        state = state.advance();
        return id;
    }

    @Override
    public synchronized Ulid append(Object payload) {
        checkOpen();
        if (payload == null) throw new IllegalArgumentException("payload must not be null");
        String json = toJson(payload);

        Ulid id = nextUlid();
        tx.update("""
                insert into changefeed.feed_entry (feed_id, shard_id, ulid, time, payload)
                values (?, ?, ?, ?, CAST(? AS jsonb))
                """, feedId, shardId, id.toBytes(), Timestamp.from(id.time()), json);
        return id;
    }

    @Override
    public synchronized JdbcTemplate jdbc() {
        checkOpen();
        return tx;
    }

    @Override
    public synchronized void commit() {
        checkOpen();
        finished = true;
        try {
            ShardUlids.store(tx, feedId, shardId, state);
            connection.commit();
        } catch (SQLException e) {
            DataAccessException ex = translate("commit", e);
            JdbcChangefeedTransactions.abandon(connection, ex);
            throw ex;
        } catch (RuntimeException e) {
            JdbcChangefeedTransactions.abandon(connection, e);
            throw e;
        }
        closeConnection();
    }

    @Override
    public synchronized void rollback() {
        checkOpen();
        finished = true;
        try {
            connection.rollback();
        } catch (SQLException e) {
            DataAccessException ex = translate("rollback", e);
            JdbcChangefeedTransactions.abandon(connection, ex);
            throw ex;
        }
        closeConnection();
    }

    @Override
    public synchronized void close() {
        if (!finished) rollback();
    }

    private void closeConnection() {
        try {
            connection.close();
        } catch (SQLException e) {
            throw translate("close", e);
        }
    }

    private void checkOpen() {
        if (finished) {
            throw new IllegalStateException("changefeed transaction already finished feedId=" + feedId + " shardId=" + shardId);
        }
    }

    private DataAccessException translate(String task, SQLException e) {
        DataAccessException ex = tx.getExceptionTranslator().translate(task, null, e);
        return ex != null ? ex : new UncategorizedSQLException(task, null, e);
    }

    private String toJson(Object payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize payload", e);
        }
    }
}
