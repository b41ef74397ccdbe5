package com.flakeid;

/**
 * Builds generators of one type from that type's configuration.
 *
 * @param <C> the concrete configuration this factory understands
 */
public interface GeneratorFactory<C extends GeneratorConfig> {

    /** The configuration class accepted by {@link #create(GeneratorConfig)}. */
    Class<C> configType();

    /**
     * Creates a new, independent generator.
     *
     * @param config the configuration; not modified by the call
     * @return a ready-to-use generator
     * @throws IdGeneratorException if the configuration is invalid
     */
    IdGenerator create(C config);

    /**
     * Creates a generator from a configuration whose concrete type is only known
     * at runtime.
     *
     * @throws IdGeneratorException with {@link ErrorCode#INVALID_CONFIG} if the config is null
     *         or not an instance of {@link #configType()}
     */
    default IdGenerator createUnchecked(GeneratorConfig config) {
        if (config == null) {
            throw new IdGeneratorException(ErrorCode.INVALID_CONFIG, "config cannot be null");
        }
        if (!configType().isInstance(config)) {
            throw new IdGeneratorException(ErrorCode.INVALID_CONFIG,
                    "expected " + configType().getName() + ", got " + config.getClass().getName());
        }
        return create(configType().cast(config));
    }
}
