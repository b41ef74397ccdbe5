package com.flakeid.registry;

import com.flakeid.ErrorCode;
import com.flakeid.GeneratorFactory;

/**
 * Generator factories by type. Misses fail with {@link ErrorCode#FACTORY_NOT_FOUND}.
 */
public final class FactoryRegistry extends TypeRegistry<GeneratorFactory<?>> {

    public FactoryRegistry() {
        super("factory", ErrorCode.FACTORY_NOT_FOUND);
    }
}
