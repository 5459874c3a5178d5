package com.myorg.changefeed.contracts.sweep;

/**
 * Per shard outcome of one sweep.
 *
 * @param lastSequenceNumberBefore shard counter before this sweep; rows got numbers from {@code before + 1}
 * @param lagMillis                time since the previous sweep of this shard, 0 on the first one
 */
public record SweepResult(
        String feedId,
        int shardId,
        int changesAssigned,
        long lastSequenceNumberBefore,
        long lagMillis
) {}
