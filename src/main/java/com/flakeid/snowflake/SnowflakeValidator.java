package com.flakeid.snowflake;

import com.flakeid.ErrorCode;
import com.flakeid.IdGeneratorException;
import com.flakeid.IdValidator;

import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Structural checks for Snowflake IDs.
 *
 * <p>An ID is valid when it is positive and its decoded timestamp lies between
 * the epoch and {@link SnowflakeLayout#MAX_FUTURE_TOLERANCE_MS} past the
 * current time.</p>
 */
public final class SnowflakeValidator implements IdValidator {

    private final LongSupplier clock;

    public SnowflakeValidator() {
        this(System::currentTimeMillis);
    }

    /**
     * @param clock source of the current time in Unix milliseconds
     */
    public SnowflakeValidator(LongSupplier clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void validate(long id) {
        if (id <= 0) {
            throw new IdGeneratorException(ErrorCode.INVALID_SNOWFLAKE_ID,
                    "id must be positive, got " + id);
        }

        long timestamp = (id >> SnowflakeLayout.TIMESTAMP_SHIFT) + SnowflakeLayout.EPOCH;
        if (timestamp < SnowflakeLayout.EPOCH) {
            throw new IdGeneratorException(ErrorCode.INVALID_SNOWFLAKE_ID,
                    "timestamp " + timestamp + " is before epoch " + SnowflakeLayout.EPOCH);
        }

        long now = clock.getAsLong();
        if (timestamp > now + SnowflakeLayout.MAX_FUTURE_TOLERANCE_MS) {
            throw new IdGeneratorException(ErrorCode.INVALID_SNOWFLAKE_ID,
                    "timestamp " + timestamp + " is too far in the future (current: " + now
                            + ", max tolerance: " + SnowflakeLayout.MAX_FUTURE_TOLERANCE_MS + " ms)");
        }
    }

    @Override
    public void validateBatch(long[] ids) {
        Objects.requireNonNull(ids, "ids");
        for (int i = 0; i < ids.length; i++) {
            try {
                validate(ids[i]);
            } catch (IdGeneratorException e) {
                throw new IdGeneratorException(e.getCode(), "invalid ID at index " + i, e);
            }
        }
    }
}
