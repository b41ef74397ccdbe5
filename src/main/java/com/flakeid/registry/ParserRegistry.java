package com.flakeid.registry;

import com.flakeid.ErrorCode;
import com.flakeid.IdParser;

/**
 * ID parsers by type. Misses fail with {@link ErrorCode#PARSER_NOT_FOUND}.
 */
public final class ParserRegistry extends TypeRegistry<IdParser> {

    public ParserRegistry() {
        super("parser", ErrorCode.PARSER_NOT_FOUND);
    }
}
