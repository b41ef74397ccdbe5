package com.flakeid.registry;

import com.flakeid.GeneratorType;
import com.flakeid.IdGenerator;
import com.flakeid.snowflake.SnowflakeConfig;
import com.flakeid.snowflake.SnowflakeFactory;
import com.flakeid.snowflake.SnowflakeParser;
import com.flakeid.snowflake.SnowflakeValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the registries an application uses to create, look up, parse and
 * validate IDs.
 *
 * <p>Construct one at the application's composition root and pass it (or the
 * individual registries) to whoever needs them. The built-in
 * {@link GeneratorType#SNOWFLAKE} factory, parser and validator are registered
 * on construction; other types are added through the registries.</p>
 */
public final class IdGenContext {
    private static final Logger logger = LoggerFactory.getLogger(IdGenContext.class);

    /** Key of the instance returned by {@link #defaultGenerator()} */
    public static final String DEFAULT_GENERATOR_KEY = "default";

    private final FactoryRegistry factories = new FactoryRegistry();
    private final ParserRegistry parsers = new ParserRegistry();
    private final ValidatorRegistry validators = new ValidatorRegistry();
    private final GeneratorRegistry generators = new GeneratorRegistry(factories);

    public IdGenContext() {
        SnowflakeValidator validator = new SnowflakeValidator();
        factories.register(GeneratorType.SNOWFLAKE, new SnowflakeFactory());
        parsers.register(GeneratorType.SNOWFLAKE, new SnowflakeParser(validator));
        validators.register(GeneratorType.SNOWFLAKE, validator);
        logger.info("ID generator context initialized, registered types: {}", factories.list());
    }

    public FactoryRegistry factories() {
        return factories;
    }

    public ParserRegistry parsers() {
        return parsers;
    }

    public ValidatorRegistry validators() {
        return validators;
    }

    public GeneratorRegistry generators() {
        return generators;
    }

    /**
     * Returns the {@value #DEFAULT_GENERATOR_KEY} snowflake generator
     * (datacenter 0, worker 0, metrics disabled), creating it on first use.
     */
    public IdGenerator defaultGenerator() {
        return generators.getOrCreate(DEFAULT_GENERATOR_KEY, GeneratorType.SNOWFLAKE, new SnowflakeConfig(0, 0));
    }
}
