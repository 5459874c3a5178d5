package com.myorg.changefeed.contracts.sweep;

public record SweepLoopStats(
        boolean acquired,
        int iterations,
        long changesAssigned,
        int races,
        long maxLagMillis
) {

    /** Another loop already sweeps the group. */
    public static SweepLoopStats notAcquired() {
        return new SweepLoopStats(false, 0, 0, 0, 0);
    }
}
