package com.flakeid.domain;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Writes an {@link Id} as its decimal string.
 */
public final class IdJsonSerializer extends StdSerializer<Id> {
    private static final long serialVersionUID = 1L;

    public IdJsonSerializer() {
        super(Id.class);
    }

    @Override
    public void serialize(Id value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeString(value.toString());
    }
}
