package com.myorg.changefeed;

import com.myorg.changefeed.contracts.lock.LockResult;
import com.myorg.changefeed.contracts.ulid.Ulid;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;

/**
 * An open writer transaction holding the shard writer lock.
 * <p>
 * Exactly one of {@link #commit()} or {@link #rollback()} ends it; {@link #close()} rolls back
 * when neither was called. Every other call after that throws {@link IllegalStateException}.
 */
public interface ChangefeedTransaction extends AutoCloseable {

    String feedId();

    int shardId();

    /** Effective time of the ids handed out, possibly later than the hint given to begin. */
    Instant time();

    LockResult lockResult();

    /** Next id of the shard, exactly one above the previous one from this handle. */
    Ulid nextUlid();

    /** Writes a feed entry with the next id and returns that id. */
    Ulid append(Object payload);

    /** Template bound to this transaction's connection, for writes to the caller's own tables. */
    JdbcTemplate jdbc();

    void commit();

    void rollback();

    @Override
    void close();
}
