package com.myorg.changefeed;

import com.myorg.changefeed.contracts.sweep.SweepLoopStats;

import java.time.Duration;

public interface SweepLoop {

    /**
     * Becomes the sweeper of the group (waiting at most {@code wait}), then sweeps repeatedly for
     * {@code duration}, sleeping {@code sleep} between iterations and waking longpollers of shards
     * that advanced. Returns {@link SweepLoopStats#notAcquired()} when another loop owns the group.
     */
    SweepLoopStats run(int sweepGroup, Duration wait, Duration duration, Duration sleep);
}
