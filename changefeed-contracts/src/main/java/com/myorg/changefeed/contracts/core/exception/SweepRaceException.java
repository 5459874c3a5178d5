package com.myorg.changefeed.contracts.core.exception;

/**
 * Another process assigned sequence numbers to some of the rows selected by this sweep.
 * The sweep transaction is rolled back, so no number is consumed.
 */
public class SweepRaceException extends ChangefeedRetryableException {

    private final int sweepGroup;
    private final int expected;
    private final int actual;

    public SweepRaceException(int sweepGroup, int expected, int actual) {
        super("Race in sweep group=" + sweepGroup + ": expected to assign " + expected
                + " rows, assigned " + actual);
        this.sweepGroup = sweepGroup;
        this.expected = expected;
        this.actual = actual;
    }

    public int getSweepGroup() { return sweepGroup; }
    public int getExpected() { return expected; }
    public int getActual() { return actual; }
}
