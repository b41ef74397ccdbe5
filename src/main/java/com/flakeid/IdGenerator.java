package com.flakeid;

import java.util.Map;

/**
 * Contract shared by every generator implementation.
 *
 * <p>Implementations must be safe for concurrent use. All failures surface as
 * {@link IdGeneratorException}.</p>
 */
public interface IdGenerator {

    /**
     * Generates the next unique ID.
     *
     * @return a positive ID
     * @throws IdGeneratorException if the clock cannot be trusted or has overflowed the layout
     */
    long nextId();

    /**
     * Generates {@code n} unique IDs in one call.
     *
     * @param n number of IDs, 1 to 100,000
     * @return exactly {@code n} IDs in generation order
     * @throws IdGeneratorException with {@link ErrorCode#INVALID_BATCH_SIZE} for a bad {@code n}
     * @throws BatchGenerationException if generation fails after some IDs were produced
     */
    long[] nextIdBatch(int n);

    long getWorkerId();

    long getDatacenterId();

    /**
     * Returns a snapshot of the generator's counters keyed by metric name.
     * A generator with metrics disabled returns only {@code metrics_enabled=0}.
     */
    Map<String, Long> getMetrics();

    void resetMetrics();

    /** Total IDs handed out since the last reset; 0 when metrics are disabled. */
    long getIdCount();

    /**
     * Decodes an ID produced by this kind of generator.
     *
     * @throws IdGeneratorException with {@link ErrorCode#INVALID_SNOWFLAKE_ID} for invalid IDs
     */
    IdInfo parseId(long id);

    /**
     * Checks the structural validity of an ID.
     *
     * @throws IdGeneratorException with {@link ErrorCode#INVALID_SNOWFLAKE_ID} for invalid IDs
     */
    void validateId(long id);
}
