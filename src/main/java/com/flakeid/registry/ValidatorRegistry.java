package com.flakeid.registry;

import com.flakeid.ErrorCode;
import com.flakeid.IdValidator;

/**
 * ID validators by type. Misses fail with {@link ErrorCode#VALIDATOR_NOT_FOUND}.
 */
public final class ValidatorRegistry extends TypeRegistry<IdValidator> {

    public ValidatorRegistry() {
        super("validator", ErrorCode.VALIDATOR_NOT_FOUND);
    }
}
