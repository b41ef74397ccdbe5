package com.flakeid.snowflake;

import com.flakeid.ErrorCode;
import com.flakeid.IdGeneratorException;
import com.flakeid.IdInfo;
import com.flakeid.IdParser;
import com.flakeid.IdValidator;

import java.util.Objects;

/**
 * Decodes Snowflake IDs by shift and mask.
 */
public final class SnowflakeParser implements IdParser {

    private final IdValidator validator;

    public SnowflakeParser() {
        this(new SnowflakeValidator());
    }

    /**
     * @param validator consulted by {@link #parse(long)} before decoding
     */
    public SnowflakeParser(IdValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * Validates and decodes an ID.
     *
     * @param id the ID to parse
     * @return IdInfo object containing parsed components
     * @throws IdGeneratorException with {@link ErrorCode#INVALID_SNOWFLAKE_ID} if the ID is invalid
     */
    @Override
    public IdInfo parse(long id) {
        validator.validate(id);
        return decode(id);
    }

    @Override
    public long extractTimestamp(long id) {
        if (id <= 0) {
            return 0;
        }
        return (id >> SnowflakeLayout.TIMESTAMP_SHIFT) + SnowflakeLayout.EPOCH;
    }

    @Override
    public long extractDatacenterId(long id) {
        if (id <= 0) {
            return -1;
        }
        return (id >> SnowflakeLayout.DATACENTER_ID_SHIFT) & SnowflakeLayout.MAX_DATACENTER_ID;
    }

    @Override
    public long extractWorkerId(long id) {
        if (id <= 0) {
            return -1;
        }
        return (id >> SnowflakeLayout.WORKER_ID_SHIFT) & SnowflakeLayout.MAX_WORKER_ID;
    }

    @Override
    public long extractSequence(long id) {
        if (id <= 0) {
            return -1;
        }
        return id & SnowflakeLayout.MAX_SEQUENCE;
    }

    static IdInfo decode(long id) {
        long timestamp = (id >> SnowflakeLayout.TIMESTAMP_SHIFT) + SnowflakeLayout.EPOCH;
        long datacenterId = (id >> SnowflakeLayout.DATACENTER_ID_SHIFT) & SnowflakeLayout.MAX_DATACENTER_ID;
        long workerId = (id >> SnowflakeLayout.WORKER_ID_SHIFT) & SnowflakeLayout.MAX_WORKER_ID;
        long sequence = id & SnowflakeLayout.MAX_SEQUENCE;
        return new IdInfo(id, timestamp, datacenterId, workerId, sequence);
    }
}
