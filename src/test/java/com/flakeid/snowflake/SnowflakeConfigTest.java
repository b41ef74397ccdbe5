package com.flakeid.snowflake;

import com.flakeid.ClockBackwardStrategy;
import com.flakeid.ErrorCode;
import com.flakeid.GeneratorType;
import com.flakeid.IdGeneratorException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SnowflakeConfigTest {

    @Test
    void testDefaults() {
        SnowflakeConfig config = new SnowflakeConfig();
        assertEquals(0, config.getDatacenterId());
        assertEquals(0, config.getWorkerId());
        assertEquals(ClockBackwardStrategy.ERROR, config.getClockBackwardStrategy());
        assertEquals(SnowflakeLayout.DEFAULT_CLOCK_BACKWARD_TOLERANCE_MS, config.getClockBackwardToleranceMs());
        assertFalse(config.isEnableMetrics());
        assertEquals(GeneratorType.SNOWFLAKE, config.type());
        config.validate();
    }

    @Test
    void testBoundaries() {
        new SnowflakeConfig(31, 31).setClockBackwardToleranceMs(0).validate();
        new SnowflakeConfig(0, 0).setClockBackwardToleranceMs(1000).validate();

        assertCode(ErrorCode.INVALID_DATACENTER_ID, new SnowflakeConfig(-1, 0));
        assertCode(ErrorCode.INVALID_DATACENTER_ID, new SnowflakeConfig(32, 0));
        assertCode(ErrorCode.INVALID_WORKER_ID, new SnowflakeConfig(0, -1));
        assertCode(ErrorCode.INVALID_WORKER_ID, new SnowflakeConfig(0, 32));
        assertCode(ErrorCode.INVALID_CONFIG, new SnowflakeConfig().setClockBackwardToleranceMs(-1));
        assertCode(ErrorCode.INVALID_CONFIG, new SnowflakeConfig().setClockBackwardToleranceMs(1001));
    }

    @Test
    void testApplyDefaultsAndCopy() {
        SnowflakeConfig config = new SnowflakeConfig(7, 8).setClockBackwardStrategy(null).setEnableMetrics(true);
        SnowflakeConfig copy = config.copy().applyDefaults();

        assertNull(config.getClockBackwardStrategy());
        assertEquals(ClockBackwardStrategy.ERROR, copy.getClockBackwardStrategy());
        assertEquals(7, copy.getDatacenterId());
        assertEquals(8, copy.getWorkerId());
        assertTrue(copy.isEnableMetrics());

        SnowflakeConfig wait = new SnowflakeConfig().setClockBackwardStrategy(ClockBackwardStrategy.WAIT).applyDefaults();
        assertEquals(ClockBackwardStrategy.WAIT, wait.getClockBackwardStrategy());
    }

    private static void assertCode(ErrorCode expected, SnowflakeConfig config) {
        IdGeneratorException e = assertThrows(IdGeneratorException.class, config::validate);
        assertEquals(expected, e.getCode(), config.toString());
    }
}
