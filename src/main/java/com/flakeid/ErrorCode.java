package com.flakeid;

/**
 * Failure kinds raised by generators, parsers, validators and registries.
 *
 * <p>Every {@link IdGeneratorException} carries exactly one code so callers can
 * branch on the kind of failure instead of matching messages.</p>
 */
public enum ErrorCode {

    // ==================== Configuration ====================

    INVALID_CONFIG("invalid generator config"),
    INVALID_WORKER_ID("invalid worker id: must be between 0 and 31"),
    INVALID_DATACENTER_ID("invalid datacenter id: must be between 0 and 31"),

    // ==================== Generation ====================

    CLOCK_MOVED_BACKWARDS("clock moved backwards: refusing to generate id"),
    INVALID_BATCH_SIZE("invalid batch size"),
    TIMESTAMP_OVERFLOW("timestamp overflow: exceeds maximum allowed value"),

    // ==================== Parsing / Validation ====================

    INVALID_SNOWFLAKE_ID("invalid snowflake id"),

    // ==================== Type Registries ====================

    INVALID_GENERATOR_TYPE("invalid generator type"),
    FACTORY_NOT_FOUND("factory not found"),
    PARSER_NOT_FOUND("parser not found"),
    VALIDATOR_NOT_FOUND("validator not found"),

    // ==================== Instance Registry ====================

    GENERATOR_ALREADY_EXISTS("generator already exists"),
    GENERATOR_NOT_FOUND("generator not found"),
    MAX_GENERATORS_REACHED("maximum number of generators reached"),
    INVALID_KEY("invalid key"),
    INVALID_KEY_FORMAT("invalid key format");

    private final String description;

    ErrorCode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
