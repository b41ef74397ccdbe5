package com.flakeid.domain;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.flakeid.GeneratorType;
import com.flakeid.IdInfo;
import com.flakeid.registry.ParserRegistry;
import com.flakeid.registry.ValidatorRegistry;

import java.util.Date;

/**
 * Immutable wrapper around a generated ID.
 *
 * <p>In JSON an {@code Id} is written as a decimal string, since values above
 * 2<sup>53</sup>-1 lose precision as JavaScript numbers. Both strings and
 * integer numbers are accepted when reading.</p>
 */
@JsonSerialize(using = IdJsonSerializer.class)
@JsonDeserialize(using = IdJsonDeserializer.class)
public final class Id implements Comparable<Id> {

    /** Longest accepted textual form, prefix included */
    public static final int MAX_TEXT_LENGTH = 100;

    /** Largest integer a JavaScript number represents exactly, 2^53 - 1 */
    public static final long MAX_SAFE_JS_INTEGER = 9_007_199_254_740_991L;

    public static final Id ZERO = new Id(0L);

    private final long value;

    private Id(long value) {
        this.value = value;
    }

    public static Id of(long value) {
        return value == 0L ? ZERO : new Id(value);
    }

    /**
     * Parses decimal, {@code 0x} hexadecimal or {@code 0b} binary text.
     *
     * @throws IllegalArgumentException for null, empty, oversized, negative or malformed text
     */
    public static Id parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("ID text cannot be empty");
        }
        if (text.length() > MAX_TEXT_LENGTH) {
            throw new IllegalArgumentException("ID text too long (max " + MAX_TEXT_LENGTH + "), got " + text.length());
        }
        if (text.charAt(0) == '-') {
            throw new IllegalArgumentException("ID cannot be negative: " + text);
        }

        String digits = text;
        int radix = 10;
        if (text.startsWith("0x") || text.startsWith("0X")) {
            digits = text.substring(2);
            radix = 16;
        } else if (text.startsWith("0b") || text.startsWith("0B")) {
            digits = text.substring(2);
            radix = 2;
        }
        if (digits.isEmpty() || digits.charAt(0) == '+' || digits.charAt(0) == '-') {
            throw new IllegalArgumentException("invalid ID format: " + text);
        }

        long parsed;
        try {
            parsed = Long.parseLong(digits, radix);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid ID format: " + text, e);
        }
        if (parsed < 0) {
            throw new IllegalArgumentException("ID cannot be negative: " + text);
        }
        return of(parsed);
    }

    public long longValue() {
        return value;
    }

    public String toHex() {
        return "0x" + Long.toHexString(value);
    }

    public String toBinary() {
        return "0b" + Long.toBinaryString(value);
    }

    public boolean isZero() {
        return value == 0L;
    }

    /** True for positive values. Structural checks need {@link #validate(ValidatorRegistry)}. */
    public boolean isValid() {
        return value > 0L;
    }

    public boolean isSafeForJavaScript() {
        return value >= 0L && value <= MAX_SAFE_JS_INTEGER;
    }

    // ==================== Registry Helpers ====================

    /** Parses with the snowflake parser. */
    public IdInfo parse(ParserRegistry parsers) {
        return parse(parsers, GeneratorType.SNOWFLAKE);
    }

    public IdInfo parse(ParserRegistry parsers, GeneratorType type) {
        return parsers.get(type).parse(value);
    }

    /** Validates with the snowflake validator. */
    public void validate(ValidatorRegistry validators) {
        validate(validators, GeneratorType.SNOWFLAKE);
    }

    public void validate(ValidatorRegistry validators, GeneratorType type) {
        validators.get(type).validate(value);
    }

    /** Epoch milliseconds, or 0 when this ID is not positive. */
    public long extractTimestamp(ParserRegistry parsers) {
        return extractTimestamp(parsers, GeneratorType.SNOWFLAKE);
    }

    public long extractTimestamp(ParserRegistry parsers, GeneratorType type) {
        return parsers.get(type).extractTimestamp(value);
    }

    /** Timestamp as a date, or null when this ID is not positive. */
    public Date extractTime(ParserRegistry parsers) {
        return extractTime(parsers, GeneratorType.SNOWFLAKE);
    }

    public Date extractTime(ParserRegistry parsers, GeneratorType type) {
        return parsers.get(type).extractTime(value);
    }

    /** -1 when this ID is not positive. */
    public long extractDatacenterId(ParserRegistry parsers) {
        return extractDatacenterId(parsers, GeneratorType.SNOWFLAKE);
    }

    public long extractDatacenterId(ParserRegistry parsers, GeneratorType type) {
        return parsers.get(type).extractDatacenterId(value);
    }

    /** -1 when this ID is not positive. */
    public long extractWorkerId(ParserRegistry parsers) {
        return extractWorkerId(parsers, GeneratorType.SNOWFLAKE);
    }

    public long extractWorkerId(ParserRegistry parsers, GeneratorType type) {
        return parsers.get(type).extractWorkerId(value);
    }

    /** -1 when this ID is not positive. */
    public long extractSequence(ParserRegistry parsers) {
        return extractSequence(parsers, GeneratorType.SNOWFLAKE);
    }

    public long extractSequence(ParserRegistry parsers, GeneratorType type) {
        return parsers.get(type).extractSequence(value);
    }

    @Override
    public int compareTo(Id other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Id)) return false;
        return value == ((Id) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
