package com.myorg.changefeed;

import com.myorg.changefeed.contracts.sweep.SweepResult;

import java.util.List;

public interface Sweeper {

    /**
     * Assigns sequence numbers to one batch of unnumbered changes in the group, in one transaction.
     * Returns one result per shard that got numbers; empty when there was nothing to do.
     */
    List<SweepResult> sweep(int sweepGroup);
}
