package com.flakeid;

import java.util.Date;

/**
 * Decodes IDs into their components.
 *
 * <p>{@link #parse(long)} validates before decoding. The {@code extract*}
 * methods skip validation and return a sentinel for non-positive IDs:
 * {@code 0} for the timestamp, {@code -1} for the other fields.</p>
 */
public interface IdParser {

    IdInfo parse(long id);

    long extractTimestamp(long id);

    long extractDatacenterId(long id);

    long extractWorkerId(long id);

    long extractSequence(long id);

    /**
     * Returns the ID's timestamp as a date, or null when the ID is not positive.
     */
    default Date extractTime(long id) {
        long timestamp = extractTimestamp(id);
        return timestamp <= 0 ? null : new Date(timestamp);
    }
}
