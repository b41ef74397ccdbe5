package com.flakeid.domain;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;

/**
 * Reads an {@link Id} from a JSON string (decimal, {@code 0x} or {@code 0b})
 * or from an integer number.
 */
public final class IdJsonDeserializer extends StdDeserializer<Id> {
    private static final long serialVersionUID = 1L;

    public IdJsonDeserializer() {
        super(Id.class);
    }

    @Override
    public Id deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_STRING) {
            String text = p.getText().trim();
            try {
                return Id.parse(text);
            } catch (IllegalArgumentException e) {
                throw InvalidFormatException.from(p, e.getMessage(), text, Id.class);
            }
        }
        if (token == JsonToken.VALUE_NUMBER_INT) {
            if (p.getNumberType() == JsonParser.NumberType.BIG_INTEGER) {
                throw InvalidFormatException.from(p, "ID out of range", p.getText(), Id.class);
            }
            long value = p.getLongValue();
            if (value < 0) {
                throw InvalidFormatException.from(p, "ID cannot be negative", value, Id.class);
            }
            return Id.of(value);
        }
        return (Id) ctxt.handleUnexpectedToken(Id.class, p);
    }
}
