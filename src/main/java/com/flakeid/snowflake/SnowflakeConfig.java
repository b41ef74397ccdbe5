package com.flakeid.snowflake;

import com.flakeid.ClockBackwardStrategy;
import com.flakeid.ErrorCode;
import com.flakeid.GeneratorConfig;
import com.flakeid.GeneratorType;
import com.flakeid.IdGeneratorException;

/**
 * Configuration of a {@link SnowflakeGenerator}.
 *
 * <p>Setters only record values; bounds are checked by {@link #validate()},
 * which the generator calls at construction. The generator keeps its own
 * {@link #copy()}, so changing this object afterwards has no effect on it.</p>
 */
public final class SnowflakeConfig implements GeneratorConfig {

    /** Datacenter ID, 0-31 */
    private long datacenterId;

    /** Worker ID, 0-31 */
    private long workerId;

    /** Reaction to a clock reading earlier than the last issued timestamp */
    private ClockBackwardStrategy clockBackwardStrategy = ClockBackwardStrategy.ERROR;

    /** Drift the WAIT strategy sleeps out, 0-1000ms */
    private long clockBackwardToleranceMs = SnowflakeLayout.DEFAULT_CLOCK_BACKWARD_TOLERANCE_MS;

    /** Whether the generator maintains counters */
    private boolean enableMetrics;

    public SnowflakeConfig() {
    }

    public SnowflakeConfig(long datacenterId, long workerId) {
        this.datacenterId = datacenterId;
        this.workerId = workerId;
    }

    @Override
    public GeneratorType type() {
        return GeneratorType.SNOWFLAKE;
    }

    // ==================== Configuration Methods ====================

    /**
     * Sets the datacenter ID.
     *
     * @param datacenterId datacenter ID (0-31)
     * @return this config for method chaining
     */
    public SnowflakeConfig setDatacenterId(long datacenterId) {
        this.datacenterId = datacenterId;
        return this;
    }

    /**
     * Sets the worker ID.
     *
     * @param workerId worker ID (0-31)
     * @return this config for method chaining
     */
    public SnowflakeConfig setWorkerId(long workerId) {
        this.workerId = workerId;
        return this;
    }

    /**
     * Sets the reaction to a clock moving backwards. Null is replaced by
     * {@link ClockBackwardStrategy#ERROR} in {@link #applyDefaults()}.
     *
     * @param clockBackwardStrategy the strategy
     * @return this config for method chaining
     */
    public SnowflakeConfig setClockBackwardStrategy(ClockBackwardStrategy clockBackwardStrategy) {
        this.clockBackwardStrategy = clockBackwardStrategy;
        return this;
    }

    /**
     * Sets the clock backward tolerance. Only consulted by the
     * {@link ClockBackwardStrategy#WAIT} strategy.
     *
     * @param ms tolerance in milliseconds (0-1000)
     * @return this config for method chaining
     */
    public SnowflakeConfig setClockBackwardToleranceMs(long ms) {
        this.clockBackwardToleranceMs = ms;
        return this;
    }

    /**
     * Enables or disables generator counters.
     *
     * @param enableMetrics true to maintain counters
     * @return this config for method chaining
     */
    public SnowflakeConfig setEnableMetrics(boolean enableMetrics) {
        this.enableMetrics = enableMetrics;
        return this;
    }

    // ==================== Getter Methods ====================

    /** @return datacenter ID */
    public long getDatacenterId() { return datacenterId; }

    /** @return worker ID */
    public long getWorkerId() { return workerId; }

    /** @return clock backward strategy, possibly null before {@link #applyDefaults()} */
    public ClockBackwardStrategy getClockBackwardStrategy() { return clockBackwardStrategy; }

    /** @return clock backward tolerance in milliseconds */
    public long getClockBackwardToleranceMs() { return clockBackwardToleranceMs; }

    /** @return whether counters are maintained */
    public boolean isEnableMetrics() { return enableMetrics; }

    // ==================== Lifecycle ====================

    /**
     * Checks every field against the layout bounds.
     *
     * @throws IdGeneratorException with {@link ErrorCode#INVALID_DATACENTER_ID},
     *         {@link ErrorCode#INVALID_WORKER_ID} or {@link ErrorCode#INVALID_CONFIG}
     */
    public void validate() {
        if (datacenterId < 0 || datacenterId > SnowflakeLayout.MAX_DATACENTER_ID) {
            throw new IdGeneratorException(ErrorCode.INVALID_DATACENTER_ID,
                    "got " + datacenterId + ", valid range [0, " + SnowflakeLayout.MAX_DATACENTER_ID + "]");
        }
        if (workerId < 0 || workerId > SnowflakeLayout.MAX_WORKER_ID) {
            throw new IdGeneratorException(ErrorCode.INVALID_WORKER_ID,
                    "got " + workerId + ", valid range [0, " + SnowflakeLayout.MAX_WORKER_ID + "]");
        }
        if (clockBackwardToleranceMs < 0) {
            throw new IdGeneratorException(ErrorCode.INVALID_CONFIG,
                    "clock backward tolerance must be non-negative, got " + clockBackwardToleranceMs + " ms");
        }
        if (clockBackwardToleranceMs > SnowflakeLayout.MAX_CLOCK_BACKWARD_TOLERANCE_MS) {
            throw new IdGeneratorException(ErrorCode.INVALID_CONFIG,
                    "clock backward tolerance too large: max " + SnowflakeLayout.MAX_CLOCK_BACKWARD_TOLERANCE_MS
                            + " ms, got " + clockBackwardToleranceMs + " ms");
        }
    }

    /**
     * Fills in values left unset. A missing strategy becomes
     * {@link ClockBackwardStrategy#ERROR}.
     *
     * @return this config for method chaining
     */
    public SnowflakeConfig applyDefaults() {
        if (clockBackwardStrategy == null) {
            clockBackwardStrategy = ClockBackwardStrategy.ERROR;
        }
        return this;
    }

    /**
     * Returns an independent copy of this configuration.
     */
    public SnowflakeConfig copy() {
        return new SnowflakeConfig(datacenterId, workerId)
                .setClockBackwardStrategy(clockBackwardStrategy)
                .setClockBackwardToleranceMs(clockBackwardToleranceMs)
                .setEnableMetrics(enableMetrics);
    }

    @Override
    public String toString() {
        return "SnowflakeConfig{datacenterId=" + datacenterId
                + ", workerId=" + workerId
                + ", clockBackwardStrategy=" + clockBackwardStrategy
                + ", clockBackwardToleranceMs=" + clockBackwardToleranceMs
                + ", enableMetrics=" + enableMetrics + '}';
    }
}
