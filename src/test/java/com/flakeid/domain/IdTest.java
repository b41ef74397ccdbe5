package com.flakeid.domain;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flakeid.ErrorCode;
import com.flakeid.GeneratorType;
import com.flakeid.IdGeneratorException;
import com.flakeid.IdInfo;
import com.flakeid.registry.IdGenContext;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IdTest {

    private final ObjectMapper mapper = new ObjectMapper();

    /** Bean carrying an Id field, as an API payload would. */
    public static class Order {
        public Id id;
        public String name;
    }

    // ==================== Text Forms ====================

    @Test
    void testParseText() {
        assertEquals(Id.of(12345), Id.parse("12345"));
        assertEquals(Id.of(255), Id.parse("0xff"));
        assertEquals(Id.of(255), Id.parse("0XFF"));
        assertEquals(Id.of(5), Id.parse("0b101"));
        assertEquals(Id.of(Long.MAX_VALUE), Id.parse("9223372036854775807"));
        assertSame(Id.ZERO, Id.parse("0"));
    }

    @Test
    void testParseRejects() {
        char[] tooLong = new char[Id.MAX_TEXT_LENGTH + 1];
        Arrays.fill(tooLong, '1');
        List<String> bad = Arrays.asList(null, "", "-1", "-0", "abc", "0x", "0b", "0b102", "0x-5", "+7",
                "9223372036854775808", "1.5", new String(tooLong));
        for (String text : bad) {
            assertThrows(IllegalArgumentException.class, () -> Id.parse(text), String.valueOf(text));
        }
    }

    @Test
    void testFormatting() {
        Id id = Id.of(10);
        assertEquals("10", id.toString());
        assertEquals("0xa", id.toHex());
        assertEquals("0b1010", id.toBinary());
        assertEquals(10, id.longValue());
        assertEquals(id, Id.parse(id.toHex()));
        assertEquals(id, Id.parse(id.toBinary()));
    }

    @Test
    void testPredicates() {
        assertTrue(Id.ZERO.isZero());
        assertFalse(Id.ZERO.isValid());
        assertFalse(Id.of(-3).isValid());
        assertTrue(Id.of(1).isValid());

        assertTrue(Id.of(Id.MAX_SAFE_JS_INTEGER).isSafeForJavaScript());
        assertFalse(Id.of(Id.MAX_SAFE_JS_INTEGER + 1).isSafeForJavaScript());
        assertFalse(Id.of(-1).isSafeForJavaScript());
    }

    @Test
    void testOrdering() {
        assertTrue(Id.of(1).compareTo(Id.of(2)) < 0);
        assertEquals(0, Id.of(7).compareTo(Id.parse("7")));
        assertEquals(Id.of(7).hashCode(), Id.parse("0x7").hashCode());
        assertNotEquals(Id.of(7), Id.of(8));
    }

    // ==================== Registry Helpers ====================

    @Test
    void testRegistryHelpers() {
        IdGenContext context = new IdGenContext();
        Id id = Id.of(context.defaultGenerator().nextId());

        id.validate(context.validators());
        IdInfo info = id.parse(context.parsers());
        assertEquals(id.longValue(), info.getId());
        assertEquals(info.getTimestamp(), id.extractTimestamp(context.parsers()));
        assertEquals(0, id.extractDatacenterId(context.parsers()));
        assertEquals(0, id.extractWorkerId(context.parsers()));
        assertEquals(info.getSequence(), id.extractSequence(context.parsers()));

        assertEquals(ErrorCode.INVALID_SNOWFLAKE_ID, assertThrows(IdGeneratorException.class,
                () -> Id.ZERO.validate(context.validators())).getCode());
        assertEquals(ErrorCode.PARSER_NOT_FOUND, assertThrows(IdGeneratorException.class,
                () -> id.parse(context.parsers(), GeneratorType.UUID)).getCode());
        assertEquals(ErrorCode.VALIDATOR_NOT_FOUND, assertThrows(IdGeneratorException.class,
                () -> id.validate(context.validators(), GeneratorType.CUSTOM)).getCode());

        assertEquals(0, Id.ZERO.extractTimestamp(context.parsers()));
        assertEquals(-1, Id.ZERO.extractWorkerId(context.parsers()));
    }

    @Test
    void testTypedExtractors() {
        IdGenContext context = new IdGenContext();
        Id id = Id.of(context.defaultGenerator().nextId());
        IdInfo info = id.parse(context.parsers(), GeneratorType.SNOWFLAKE);

        assertEquals(info.getTimestamp(), id.extractTimestamp(context.parsers(), GeneratorType.SNOWFLAKE));
        assertEquals(info.getDatacenterId(), id.extractDatacenterId(context.parsers(), GeneratorType.SNOWFLAKE));
        assertEquals(info.getWorkerId(), id.extractWorkerId(context.parsers(), GeneratorType.SNOWFLAKE));
        assertEquals(info.getSequence(), id.extractSequence(context.parsers(), GeneratorType.SNOWFLAKE));
        assertEquals(info.getDate(), id.extractTime(context.parsers()));
        assertEquals(info.getDate(), id.extractTime(context.parsers(), GeneratorType.SNOWFLAKE));
        assertNull(Id.ZERO.extractTime(context.parsers()));

        assertEquals(ErrorCode.PARSER_NOT_FOUND, assertThrows(IdGeneratorException.class,
                () -> id.extractSequence(context.parsers(), GeneratorType.UUID)).getCode());
        assertEquals(ErrorCode.PARSER_NOT_FOUND, assertThrows(IdGeneratorException.class,
                () -> id.extractTime(context.parsers(), GeneratorType.CUSTOM)).getCode());
    }

    // ==================== JSON ====================

    @Test
    void testJsonWritesString() throws Exception {
        assertEquals("\"9223372036854775807\"", mapper.writeValueAsString(Id.of(Long.MAX_VALUE)));

        Order order = new Order();
        order.id = Id.of(42);
        order.name = "book";
        assertEquals("{\"id\":\"42\",\"name\":\"book\"}", mapper.writeValueAsString(order));
    }

    @Test
    void testJsonReadsStringOrNumber() throws Exception {
        assertEquals(Id.of(12345), mapper.readValue("\"12345\"", Id.class));
        assertEquals(Id.of(12345), mapper.readValue("12345", Id.class));
        assertEquals(Id.of(255), mapper.readValue("\"0xff\"", Id.class));

        Order order = mapper.readValue("{\"id\":\"9223372036854775807\",\"name\":\"x\"}", Order.class);
        assertEquals(Id.of(Long.MAX_VALUE), order.id);
        assertNull(mapper.readValue("{\"id\":null}", Order.class).id);
    }

    @Test
    void testJsonRejects() {
        for (String json : Arrays.asList("\"-1\"", "-1", "\"\"", "\"abc\"", "1.5", "true",
                "9223372036854775808", "[1]")) {
            assertThrows(JsonMappingException.class, () -> mapper.readValue(json, Id.class), json);
        }
    }
}
