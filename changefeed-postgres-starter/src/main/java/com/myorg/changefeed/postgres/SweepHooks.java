package com.myorg.changefeed.postgres;

import com.myorg.changefeed.contracts.sweep.UnsweptChange;

import java.util.List;

/**
 * Test seam. Default = no-op.
 */
public interface SweepHooks {

    /** Called inside the sweep transaction after the batch is selected, before any number is assigned. */
    default void afterSelect(int sweepGroup, List<UnsweptChange> batch) {}
}
