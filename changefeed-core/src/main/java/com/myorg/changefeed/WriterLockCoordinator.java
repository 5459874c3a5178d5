package com.myorg.changefeed;

import com.myorg.changefeed.contracts.lock.LockResult;

import java.sql.Connection;

/**
 * Takes the transaction scoped writer lock of a shard on a connection that is inside a transaction.
 * Stuck holders (idle in transaction, or holding far too long) are terminated, counted as incidents,
 * and the acquire is retried. Plain contention is retried until the configured wait runs out.
 */
public interface WriterLockCoordinator {

    LockResult acquire(Connection connection, String feedId, int shardId);
}
