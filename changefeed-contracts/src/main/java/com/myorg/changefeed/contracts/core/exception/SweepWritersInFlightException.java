package com.myorg.changefeed.contracts.core.exception;

import java.time.Duration;

/**
 * A sweep gave up waiting for open writer transactions of its group. Nothing was numbered.
 */
public class SweepWritersInFlightException extends ChangefeedRetryableException {

    private final int sweepGroup;
    private final Duration waited;

    public SweepWritersInFlightException(int sweepGroup, Duration waited, Throwable cause) {
        super("Sweep group=" + sweepGroup + " still had open writers after " + waited, cause);
        this.sweepGroup = sweepGroup;
        this.waited = waited;
    }

    public int getSweepGroup() { return sweepGroup; }
    public Duration getWaited() { return waited; }
}
