package com.flakeid.snowflake;

import com.flakeid.ClockBackwardStrategy;
import com.flakeid.ErrorCode;
import com.flakeid.IdGeneratorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Builds a {@link SnowflakeConfig} from the process environment.
 *
 * <p>Priority per field: environment variable → JVM system property → default.
 * The datacenter and worker IDs must still be assigned uniquely by whoever
 * deploys the process; this class only reads them.</p>
 *
 * <table>
 *   <caption>Recognized keys</caption>
 *   <tr><th>Environment</th><th>System property</th></tr>
 *   <tr><td>SNOWFLAKE_DATACENTER_ID</td><td>snowflake.datacenter.id</td></tr>
 *   <tr><td>SNOWFLAKE_WORKER_ID</td><td>snowflake.worker.id</td></tr>
 *   <tr><td>SNOWFLAKE_CLOCK_BACKWARD_STRATEGY</td><td>snowflake.clock-backward.strategy</td></tr>
 *   <tr><td>SNOWFLAKE_CLOCK_BACKWARD_TOLERANCE_MS</td><td>snowflake.clock-backward.tolerance-ms</td></tr>
 *   <tr><td>SNOWFLAKE_METRICS_ENABLED</td><td>snowflake.metrics.enabled</td></tr>
 * </table>
 */
public final class SnowflakeConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(SnowflakeConfigLoader.class);

    static final String DATACENTER_ID_ENV = "SNOWFLAKE_DATACENTER_ID";
    static final String DATACENTER_ID_PROP = "snowflake.datacenter.id";
    static final String WORKER_ID_ENV = "SNOWFLAKE_WORKER_ID";
    static final String WORKER_ID_PROP = "snowflake.worker.id";
    static final String STRATEGY_ENV = "SNOWFLAKE_CLOCK_BACKWARD_STRATEGY";
    static final String STRATEGY_PROP = "snowflake.clock-backward.strategy";
    static final String TOLERANCE_ENV = "SNOWFLAKE_CLOCK_BACKWARD_TOLERANCE_MS";
    static final String TOLERANCE_PROP = "snowflake.clock-backward.tolerance-ms";
    static final String METRICS_ENV = "SNOWFLAKE_METRICS_ENABLED";
    static final String METRICS_PROP = "snowflake.metrics.enabled";

    private final Function<String, String> environment;
    private final Function<String, String> properties;

    /**
     * Loader backed by {@link System#getenv(String)} and {@link System#getProperty(String)}.
     */
    public SnowflakeConfigLoader() {
        this(System::getenv, System::getProperty);
    }

    /**
     * Loader backed by arbitrary lookups; both return null for absent keys.
     */
    public SnowflakeConfigLoader(Function<String, String> environment, Function<String, String> properties) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Resolves every field and validates the result.
     *
     * @return a validated config
     * @throws IdGeneratorException with {@link ErrorCode#INVALID_CONFIG} for malformed values,
     *         or the bound errors raised by {@link SnowflakeConfig#validate()}
     */
    public SnowflakeConfig load() {
        SnowflakeConfig config = new SnowflakeConfig();

        String value = lookup(DATACENTER_ID_ENV, DATACENTER_ID_PROP);
        if (value != null) {
            config.setDatacenterId(parseLong(DATACENTER_ID_PROP, value));
        }
        value = lookup(WORKER_ID_ENV, WORKER_ID_PROP);
        if (value != null) {
            config.setWorkerId(parseLong(WORKER_ID_PROP, value));
        }
        value = lookup(STRATEGY_ENV, STRATEGY_PROP);
        if (value != null) {
            config.setClockBackwardStrategy(parseStrategy(value));
        }
        value = lookup(TOLERANCE_ENV, TOLERANCE_PROP);
        if (value != null) {
            config.setClockBackwardToleranceMs(parseLong(TOLERANCE_PROP, value));
        }
        value = lookup(METRICS_ENV, METRICS_PROP);
        if (value != null) {
            config.setEnableMetrics(parseBoolean(METRICS_PROP, value));
        }

        config.validate();
        logger.info("Loaded snowflake config: {}", config);
        return config;
    }

    private String lookup(String envKey, String propKey) {
        String value = environment.apply(envKey);
        if (value != null && !value.trim().isEmpty()) {
            logger.debug("Using {} from environment variable {}", propKey, envKey);
            return value.trim();
        }
        value = properties.apply(propKey);
        if (value != null && !value.trim().isEmpty()) {
            logger.debug("Using {} from JVM parameter", propKey);
            return value.trim();
        }
        return null;
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IdGeneratorException(ErrorCode.INVALID_CONFIG,
                    key + " is not a number: '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IdGeneratorException(ErrorCode.INVALID_CONFIG,
                key + " must be true or false, got '" + value + "'");
    }

    private static ClockBackwardStrategy parseStrategy(String value) {
        String normalized = value.toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return ClockBackwardStrategy.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IdGeneratorException(ErrorCode.INVALID_CONFIG,
                    STRATEGY_PROP + " must be one of ERROR, WAIT, USE_LAST_TIMESTAMP, got '" + value + "'", e);
        }
    }
}
