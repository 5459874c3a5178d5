package com.myorg.changefeed.contracts.feed;

import java.time.Instant;

public record ShardState(
        String feedId,
        int shardId,
        int sweepGroup,
        boolean longpoll,
        long lastSequenceNumber,
        Instant lastSweepTime,
        Instant lastLockTime
) {}
