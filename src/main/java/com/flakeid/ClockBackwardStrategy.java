package com.flakeid;

/**
 * What a generator does when the wall clock reads earlier than the timestamp
 * of the last ID it produced.
 */
public enum ClockBackwardStrategy {

    /** Fail immediately; the caller owns any retry. */
    ERROR,

    /**
     * Sleep out a drift that is within the configured tolerance, re-checking a
     * bounded number of times. Larger or persistent drift fails.
     */
    WAIT,

    /**
     * Keep issuing IDs on the last timestamp. Never fails, but IDs may repeat
     * or lose ordering if the sequence is also exhausted while the clock is behind.
     */
    USE_LAST_TIMESTAMP
}
