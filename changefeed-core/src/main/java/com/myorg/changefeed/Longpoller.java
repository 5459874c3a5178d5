package com.myorg.changefeed;

import com.myorg.changefeed.contracts.feed.LongpollOutcome;

import java.time.Duration;

public interface Longpoller {

    /**
     * Blocks until the shard's sequence number moves past {@code seenSequenceNumber}, the sweep loop
     * signals, or {@code timeout} passes. Whatever the outcome, callers re-read the feed.
     *
     * @throws com.myorg.changefeed.contracts.core.exception.NoActiveSweeperException when no sweep
     *         loop would ever signal this shard
     */
    LongpollOutcome longpoll(String feedId, int shardId, Duration timeout, long seenSequenceNumber);
}
