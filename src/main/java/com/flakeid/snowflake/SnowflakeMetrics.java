package com.flakeid.snowflake;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters describing a generator's behavior.
 *
 * <p>Each counter is updated atomically and may be read without holding the
 * generator's lock. A {@link #snapshot()} is not a consistent cut across
 * counters; each value is read independently.</p>
 */
public final class SnowflakeMetrics {

    public static final String METRICS_ENABLED = "metrics_enabled";
    public static final String ID_COUNT = "id_count";
    public static final String SEQUENCE_OVERFLOW = "sequence_overflow";
    public static final String CLOCK_BACKWARD = "clock_backward";
    public static final String WAIT_COUNT = "wait_count";
    public static final String AVG_WAIT_TIME_NS = "avg_wait_time_ns";

    /** Returned by generators running with metrics disabled */
    public static final Map<String, Long> DISABLED =
            Collections.singletonMap(METRICS_ENABLED, 0L);

    private final LongAdder idCount = new LongAdder();
    private final LongAdder sequenceOverflowCount = new LongAdder();
    private final LongAdder clockBackwardCount = new LongAdder();
    private final LongAdder waitCount = new LongAdder();
    private final LongAdder totalWaitTimeNs = new LongAdder();

    void recordIds(long count) {
        idCount.add(count);
    }

    void recordSequenceOverflow() {
        sequenceOverflowCount.increment();
    }

    void recordClockBackward() {
        clockBackwardCount.increment();
    }

    void recordWait(long waitedNanos) {
        waitCount.increment();
        totalWaitTimeNs.add(waitedNanos);
    }

    /** @return IDs handed out, partial batches included */
    public long getIdCount() {
        return idCount.sum();
    }

    /** @return times the sequence ran out within a millisecond */
    public long getSequenceOverflowCount() {
        return sequenceOverflowCount.sum();
    }

    /** @return backward clock readings detected */
    public long getClockBackwardCount() {
        return clockBackwardCount.sum();
    }

    /** @return waits for the next millisecond */
    public long getWaitCount() {
        return waitCount.sum();
    }

    /** @return total time spent in those waits, in nanoseconds */
    public long getTotalWaitTimeNs() {
        return totalWaitTimeNs.sum();
    }

    /**
     * Resets every counter to zero.
     */
    public void reset() {
        idCount.reset();
        sequenceOverflowCount.reset();
        clockBackwardCount.reset();
        waitCount.reset();
        totalWaitTimeNs.reset();
    }

    /**
     * Copies the current values into a detached instance.
     */
    public SnowflakeMetrics snapshot() {
        SnowflakeMetrics copy = new SnowflakeMetrics();
        copy.idCount.add(idCount.sum());
        copy.sequenceOverflowCount.add(sequenceOverflowCount.sum());
        copy.clockBackwardCount.add(clockBackwardCount.sum());
        copy.waitCount.add(waitCount.sum());
        copy.totalWaitTimeNs.add(totalWaitTimeNs.sum());
        return copy;
    }

    /**
     * Exposes the counters under their wire names, with the average wait time
     * derived from the total (0 when nothing has waited yet).
     */
    public Map<String, Long> toMap() {
        long waits = waitCount.sum();
        long totalWait = totalWaitTimeNs.sum();
        Map<String, Long> map = new LinkedHashMap<>();
        map.put(METRICS_ENABLED, 1L);
        map.put(ID_COUNT, idCount.sum());
        map.put(SEQUENCE_OVERFLOW, sequenceOverflowCount.sum());
        map.put(CLOCK_BACKWARD, clockBackwardCount.sum());
        map.put(WAIT_COUNT, waits);
        map.put(AVG_WAIT_TIME_NS, waits > 0 ? totalWait / waits : 0L);
        return map;
    }

    @Override
    public String toString() {
        return "SnowflakeMetrics" + toMap();
    }
}
