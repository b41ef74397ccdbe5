package com.flakeid;

import java.util.Locale;

/**
 * Discriminant selecting which factory, parser and validator a registry uses.
 *
 * <p>Only {@link #SNOWFLAKE} ships with an implementation. {@link #UUID} and
 * {@link #CUSTOM} are reserved so additional implementations can be registered
 * without touching registry code.</p>
 */
public enum GeneratorType {

    /** 64-bit time-ordered IDs: 41-bit timestamp, 5-bit datacenter, 5-bit worker, 12-bit sequence. */
    SNOWFLAKE("snowflake"),

    /** Reserved for 128-bit UUID generators. */
    UUID("uuid"),

    /** Reserved for application-specific generators. */
    CUSTOM("custom");

    private final String value;

    GeneratorType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolves a type from its wire name.
     *
     * @param value the type name, case-insensitive
     * @return the matching type
     * @throws IdGeneratorException with {@link ErrorCode#INVALID_GENERATOR_TYPE} for unknown names
     */
    public static GeneratorType fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (GeneratorType type : values()) {
                if (type.value.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IdGeneratorException(ErrorCode.INVALID_GENERATOR_TYPE, String.valueOf(value));
    }

    @Override
    public String toString() {
        return value;
    }
}
