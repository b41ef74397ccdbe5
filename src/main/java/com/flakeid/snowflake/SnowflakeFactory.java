package com.flakeid.snowflake;

import com.flakeid.GeneratorFactory;
import com.flakeid.IdGenerator;

/**
 * Creates {@link SnowflakeGenerator} instances from {@link SnowflakeConfig}.
 */
public final class SnowflakeFactory implements GeneratorFactory<SnowflakeConfig> {

    @Override
    public Class<SnowflakeConfig> configType() {
        return SnowflakeConfig.class;
    }

    @Override
    public IdGenerator create(SnowflakeConfig config) {
        return new SnowflakeGenerator(config);
    }
}
