package com.flakeid.snowflake;

import com.flakeid.BatchGenerationException;
import com.flakeid.ClockBackwardStrategy;
import com.flakeid.ErrorCode;
import com.flakeid.IdGenerator;
import com.flakeid.IdGeneratorException;
import com.flakeid.IdInfo;
import com.flakeid.IdParser;
import com.flakeid.IdValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.LockSupport;
import java.util.function.LongSupplier;

/**
 * Snowflake ID generator with synchronized implementation
 *
 * <p>Produces 64-bit IDs laid out as described in {@link SnowflakeLayout}.
 * Every generation call runs in one critical section guarded by the instance
 * monitor, including any sleep spent waiting out a backward clock or an
 * exhausted sequence. A blocked caller therefore stalls all other callers of
 * the same instance; throughput beyond 4096 IDs per millisecond needs several
 * instances with distinct (datacenter, worker) pairs.</p>
 *
 * <p><b>Key Features:</b>
 * <ul>
 *   <li>Strictly increasing IDs per instance under the ERROR and WAIT strategies</li>
 *   <li>Batch generation spanning as many milliseconds as needed</li>
 *   <li>Configurable clock backward handling</li>
 *   <li>Optional lock-free metrics</li>
 * </ul></p>
 *
 * <p>No background threads are used; all work happens on the calling thread.</p>
 */
public final class SnowflakeGenerator implements IdGenerator {
    private static final Logger logger = LoggerFactory.getLogger(SnowflakeGenerator.class);

    // ==================== Immutable Configuration ====================

    /** Private copy of the configuration */
    private final SnowflakeConfig config;

    private final long datacenterId;

    private final long workerId;

    /** Datacenter and worker bits, fixed for the generator's lifetime */
    private final long precomputedBits;

    /** Null when metrics are disabled */
    private final SnowflakeMetrics metrics;

    /** Source of the current time in Unix milliseconds */
    private final LongSupplier clock;

    private final IdValidator validator;

    private final IdParser parser;

    // ==================== Synchronized State Fields ====================

    /** Last timestamp when ID was generated, -1 before the first ID */
    private long lastTimestamp = -1L;

    /** Last sequence number used within lastTimestamp, -1 before the first ID */
    private long sequence = -1L;

    /**
     * Creates a generator reading the system clock.
     *
     * @param config the configuration; validated and copied
     * @throws IdGeneratorException if the config is null or out of bounds
     */
    public SnowflakeGenerator(SnowflakeConfig config) {
        this(config, System::currentTimeMillis);
    }

    /**
     * Creates a generator reading the given clock.
     *
     * @param config the configuration; validated and copied
     * @param clock source of the current time in Unix milliseconds
     * @throws IdGeneratorException if the config is null or out of bounds
     */
    public SnowflakeGenerator(SnowflakeConfig config, LongSupplier clock) {
        if (config == null) {
            throw new IdGeneratorException(ErrorCode.INVALID_CONFIG, "config cannot be null");
        }
        this.clock = Objects.requireNonNull(clock, "clock");

        SnowflakeConfig effective = config.copy().applyDefaults();
        effective.validate();

        this.config = effective;
        this.datacenterId = effective.getDatacenterId();
        this.workerId = effective.getWorkerId();
        this.precomputedBits = (datacenterId << SnowflakeLayout.DATACENTER_ID_SHIFT)
                | (workerId << SnowflakeLayout.WORKER_ID_SHIFT);
        this.metrics = effective.isEnableMetrics() ? new SnowflakeMetrics() : null;
        this.validator = new SnowflakeValidator(clock);
        this.parser = new SnowflakeParser(validator);

        logger.info("Snowflake generator created: datacenterId={}, workerId={}, strategy={}, metricsEnabled={}",
                datacenterId, workerId, effective.getClockBackwardStrategy(), effective.isEnableMetrics());
    }

    /**
     * Creates a generator with default settings and metrics disabled.
     *
     * @param datacenterId datacenter ID (0-31)
     * @param workerId worker ID (0-31)
     * @return a new generator
     */
    public static SnowflakeGenerator create(long datacenterId, long workerId) {
        return new SnowflakeGenerator(new SnowflakeConfig(datacenterId, workerId));
    }

    // ==================== Core ID Generation Methods ====================

    /**
     * Generates a single unique ID.
     *
     * @return a unique ID, greater than every ID previously returned by this
     *         instance unless USE_LAST_TIMESTAMP absorbed a backward clock
     * @throws IdGeneratorException with {@link ErrorCode#CLOCK_MOVED_BACKWARDS} or
     *         {@link ErrorCode#TIMESTAMP_OVERFLOW}
     */
    @Override
    public synchronized long nextId() {
        long now = currentTimestamp();

        if (now < lastTimestamp) {
            now = handleClockBackward(now);
        }
        checkTimestamp(now);

        if (now == lastTimestamp) {
            if (sequence >= SnowflakeLayout.MAX_SEQUENCE) {
                // Sequence exhausted, wait for next millisecond
                now = waitNextMillis();
                checkTimestamp(now);
                sequence = -1L;
                lastTimestamp = now;
            }
            sequence++;
        } else {
            sequence = 0L;
            lastTimestamp = now;
        }

        long id = ((now - SnowflakeLayout.EPOCH) << SnowflakeLayout.TIMESTAMP_SHIFT) | precomputedBits | sequence;
        if (metrics != null) {
            metrics.recordIds(1);
        }
        return id;
    }

    /**
     * Generates multiple unique IDs in batch.
     *
     * <p>Fills the rest of the current millisecond's sequence space, then moves
     * on to following milliseconds until {@code n} IDs exist. If the clock
     * fails part way, the IDs produced so far are attached to the thrown
     * {@link BatchGenerationException}.</p>
     *
     * @param n number of IDs to generate (1 to 100,000)
     * @return exactly {@code n} IDs in increasing order
     * @throws IdGeneratorException with {@link ErrorCode#INVALID_BATCH_SIZE} if n is out of range
     * @throws BatchGenerationException if generation fails mid-batch
     */
    @Override
    public long[] nextIdBatch(int n) {
        if (n <= 0) {
            throw new IdGeneratorException(ErrorCode.INVALID_BATCH_SIZE,
                    "batch size must be positive, got " + n);
        }
        if (n > SnowflakeLayout.MAX_BATCH_SIZE) {
            throw new IdGeneratorException(ErrorCode.INVALID_BATCH_SIZE,
                    "batch size too large (max " + SnowflakeLayout.MAX_BATCH_SIZE + "), got " + n);
        }
        synchronized (this) {
            return nextIdBatchLocked(n);
        }
    }

    private long[] nextIdBatchLocked(int n) {
        long[] ids = new long[n];
        int produced = 0;

        try {
            while (produced < n) {
                long now = currentTimestamp();

                if (now < lastTimestamp) {
                    now = handleClockBackward(now);
                }
                checkTimestamp(now);

                long available;
                if (now == lastTimestamp) {
                    available = SnowflakeLayout.MAX_SEQUENCE - sequence;
                    if (available <= 0) {
                        now = waitNextMillis();
                        checkTimestamp(now);
                        sequence = -1L;
                        lastTimestamp = now;
                        available = SnowflakeLayout.MAX_SEQUENCE + 1;
                    }
                } else {
                    sequence = -1L;
                    lastTimestamp = now;
                    available = SnowflakeLayout.MAX_SEQUENCE + 1;
                }

                int take = (int) Math.min(n - produced, available);
                long base = ((now - SnowflakeLayout.EPOCH) << SnowflakeLayout.TIMESTAMP_SHIFT) | precomputedBits;
                for (int i = 0; i < take; i++) {
                    sequence++;
                    ids[produced++] = base | sequence;
                }
            }
        } catch (IdGeneratorException e) {
            if (metrics != null) {
                metrics.recordIds(produced);
            }
            logger.warn("Batch generation stopped after {}/{} IDs: {}", produced, n, e.getMessage());
            throw new BatchGenerationException(e, Arrays.copyOf(ids, produced), n);
        }

        if (metrics != null) {
            metrics.recordIds(n);
        }
        return ids;
    }

    // ==================== Clock Handling ====================

    private long currentTimestamp() {
        return clock.getAsLong();
    }

    /**
     * Applies the configured strategy to a clock reading behind lastTimestamp.
     *
     * @param currentTimestamp the clock reading
     * @return the timestamp to continue with
     * @throws IdGeneratorException with {@link ErrorCode#CLOCK_MOVED_BACKWARDS} if the drift is not absorbed
     */
    private long handleClockBackward(long currentTimestamp) {
        long offset = lastTimestamp - currentTimestamp;
        if (metrics != null) {
            metrics.recordClockBackward();
        }
        logger.warn("Clock backward detected: {}ms", offset);

        ClockBackwardStrategy strategy = config.getClockBackwardStrategy();
        long tolerance = config.getClockBackwardToleranceMs();
        switch (strategy) {
            case WAIT:
                if (offset > tolerance) {
                    logger.error("Clock backward too large: {}ms > tolerance {}ms", offset, tolerance);
                    throw new IdGeneratorException(ErrorCode.CLOCK_MOVED_BACKWARDS,
                            "backward drift " + offset + " ms exceeds tolerance " + tolerance + " ms");
                }
                for (int retries = 0; retries < SnowflakeLayout.MAX_WAIT_RETRIES; retries++) {
                    sleepMillis(offset + 1);
                    long now = currentTimestamp();
                    if (now >= lastTimestamp) {
                        return now;
                    }
                    offset = lastTimestamp - now;
                }
                throw new IdGeneratorException(ErrorCode.CLOCK_MOVED_BACKWARDS,
                        "backward drift persisted after " + SnowflakeLayout.MAX_WAIT_RETRIES + " retries");

            case USE_LAST_TIMESTAMP:
                logger.warn("Reusing last timestamp {} to absorb {}ms clock backward, IDs may repeat", lastTimestamp, offset);
                return lastTimestamp;

            case ERROR:
            default:
                throw new IdGeneratorException(ErrorCode.CLOCK_MOVED_BACKWARDS,
                        "detected backward drift of " + offset + " ms");
        }
    }

    /**
     * Waits until the clock passes lastTimestamp after the sequence ran out.
     *
     * @return the first clock reading greater than lastTimestamp
     */
    private long waitNextMillis() {
        if (metrics != null) {
            metrics.recordSequenceOverflow();
        }
        long start = System.nanoTime();
        long timestamp = currentTimestamp();
        while (timestamp <= lastTimestamp) {
            LockSupport.parkNanos(SnowflakeLayout.SEQUENCE_WAIT_SLEEP_NANOS);
            timestamp = currentTimestamp();
        }
        if (metrics != null) {
            metrics.recordWait(System.nanoTime() - start);
        }
        return timestamp;
    }

    /**
     * Sleeps while waiting out a backward clock.
     *
     * @throws IdGeneratorException with {@link ErrorCode#CLOCK_MOVED_BACKWARDS} if interrupted;
     *         the interrupt flag is restored
     */
    private static void sleepMillis(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IdGeneratorException(ErrorCode.CLOCK_MOVED_BACKWARDS,
                    "interrupted during clock backward wait", e);
        }
    }

    private static void checkTimestamp(long timestamp) {
        long diff = timestamp - SnowflakeLayout.EPOCH;
        if (diff < 0) {
            throw new IdGeneratorException(ErrorCode.TIMESTAMP_OVERFLOW,
                    "current time " + timestamp + " is before epoch " + SnowflakeLayout.EPOCH);
        }
        if (diff > SnowflakeLayout.MAX_TIMESTAMP_DIFF) {
            throw new IdGeneratorException(ErrorCode.TIMESTAMP_OVERFLOW,
                    "timestamp difference " + diff + " exceeds maximum " + SnowflakeLayout.MAX_TIMESTAMP_DIFF);
        }
    }

    // ==================== Getter Methods ====================

    @Override
    public long getWorkerId() { return workerId; }

    @Override
    public long getDatacenterId() { return datacenterId; }

    /**
     * Returns a copy of the effective configuration.
     */
    public SnowflakeConfig getConfig() { return config.copy(); }

    // ==================== Monitoring Methods ====================

    @Override
    public Map<String, Long> getMetrics() {
        return metrics == null ? SnowflakeMetrics.DISABLED : metrics.toMap();
    }

    /**
     * Returns a detached copy of the counters, or null when metrics are disabled.
     */
    public SnowflakeMetrics getMetricsSnapshot() {
        return metrics == null ? null : metrics.snapshot();
    }

    @Override
    public void resetMetrics() {
        if (metrics != null) {
            metrics.reset();
        }
    }

    @Override
    public long getIdCount() {
        return metrics == null ? 0L : metrics.getIdCount();
    }

    // ==================== ID Parsing Methods ====================

    @Override
    public IdInfo parseId(long id) {
        return parser.parse(id);
    }

    @Override
    public void validateId(long id) {
        validator.validate(id);
    }

    /**
     * Returns configuration information as formatted string.
     *
     * @return formatted configuration report
     */
    public String getInfo() {
        long years = SnowflakeLayout.MAX_TIMESTAMP_DIFF / (365L * 24 * 3600 * 1000);
        return String.format(
                "═══════════════════════════════════════\n" +
                        "Snowflake Generator Config\n" +
                        "%s\n" +
                        "Timestamp Range : ~%d years from epoch\n" +
                        "Capacity        : %,d IDs/ms per instance\n" +
                        "DatacenterId    : %d (max %d)\n" +
                        "WorkerId        : %d (max %d)\n" +
                        "Clock Backward  : %s (tolerance %d ms)\n" +
                        "Metrics         : %s\n" +
                        "═══════════════════════════════════════\n",
                SnowflakeLayout.describe(), years, SnowflakeLayout.MAX_SEQUENCE + 1,
                datacenterId, SnowflakeLayout.MAX_DATACENTER_ID,
                workerId, SnowflakeLayout.MAX_WORKER_ID,
                config.getClockBackwardStrategy(), config.getClockBackwardToleranceMs(),
                metrics != null ? "enabled" : "disabled"
        );
    }
}
