package com.flakeid.snowflake;

/**
 * Snowflake Bit Layout and Default Values
 *
 * <p>Centralized location for the fixed bit layout and the default values used
 * by the generator, parser and validator. The layout is not runtime
 * configurable:</p>
 *
 * <pre>
 * +--------+-------------------+-----------+-----------+-------------+
 * | 1 bit  | 41 bits           | 5 bits    | 5 bits    | 12 bits     |
 * | unused | timestamp - epoch | datacenter| worker    | sequence    |
 * +--------+-------------------+-----------+-----------+-------------+
 * </pre>
 *
 * <p>Changing {@link #EPOCH} is a breaking migration: IDs issued before the
 * change no longer sort correctly against IDs issued after it.</p>
 */
public final class SnowflakeLayout {

    // ==================== Epoch ====================

    /** Epoch in Unix milliseconds (2023-01-01T00:00:00+08:00) */
    public static final long EPOCH = 1672502400000L;

    // ==================== Bit Widths ====================

    /** Number of bits for the timestamp difference */
    public static final int TIMESTAMP_BITS = 41;

    /** Number of bits for datacenter ID */
    public static final int DATACENTER_ID_BITS = 5;

    /** Number of bits for worker ID */
    public static final int WORKER_ID_BITS = 5;

    /** Number of bits for sequence number */
    public static final int SEQUENCE_BITS = 12;

    // ==================== Maximum Values ====================

    public static final long MAX_TIMESTAMP_DIFF = (1L << TIMESTAMP_BITS) - 1;

    public static final long MAX_DATACENTER_ID = (1L << DATACENTER_ID_BITS) - 1;

    public static final long MAX_WORKER_ID = (1L << WORKER_ID_BITS) - 1;

    public static final long MAX_SEQUENCE = (1L << SEQUENCE_BITS) - 1;

    // ==================== Shifts ====================

    public static final int WORKER_ID_SHIFT = SEQUENCE_BITS;

    public static final int DATACENTER_ID_SHIFT = SEQUENCE_BITS + WORKER_ID_BITS;

    public static final int TIMESTAMP_SHIFT = SEQUENCE_BITS + WORKER_ID_BITS + DATACENTER_ID_BITS;

    // ==================== Generator Defaults ====================

    /** Sleep between clock reads while waiting out an exhausted sequence (100µs) */
    public static final long SEQUENCE_WAIT_SLEEP_NANOS = 100_000L;

    /** Default clock backward tolerance in milliseconds (5ms) */
    public static final long DEFAULT_CLOCK_BACKWARD_TOLERANCE_MS = 5L;

    /** Upper bound for the clock backward tolerance in milliseconds (1000ms) */
    public static final long MAX_CLOCK_BACKWARD_TOLERANCE_MS = 1000L;

    /** Maximum re-checks of the clock under the WAIT strategy */
    public static final int MAX_WAIT_RETRIES = 10;

    /** Maximum number of IDs per batch call */
    public static final int MAX_BATCH_SIZE = 100_000;

    // ==================== Validation ====================

    /** How far in the future an ID's timestamp may lie (60s) */
    public static final long MAX_FUTURE_TOLERANCE_MS = 60_000L;

    /** Prevent instantiation */
    private SnowflakeLayout() {
        throw new AssertionError("Cannot instantiate SnowflakeLayout class");
    }

    /**
     * Returns layout summary
     */
    public static String describe() {
        return String.format(
                "Layout: Epoch=%d, Bits=%d(ts)+%d(dc)+%d(wk)+%d(seq), Shifts=%d/%d/%d",
                EPOCH, TIMESTAMP_BITS, DATACENTER_ID_BITS, WORKER_ID_BITS, SEQUENCE_BITS,
                TIMESTAMP_SHIFT, DATACENTER_ID_SHIFT, WORKER_ID_SHIFT
        );
    }
}
