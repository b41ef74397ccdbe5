package com.flakeid;

/**
 * Structural validity checks for IDs.
 */
public interface IdValidator {

    /**
     * @throws IdGeneratorException with {@link ErrorCode#INVALID_SNOWFLAKE_ID} if the ID is invalid
     */
    void validate(long id);

    /**
     * Validates every ID, stopping at the first invalid one. The failure message
     * names the index of the offending element.
     *
     * @throws NullPointerException if {@code ids} is null
     * @throws IdGeneratorException for the first invalid element
     */
    void validateBatch(long[] ids);
}
