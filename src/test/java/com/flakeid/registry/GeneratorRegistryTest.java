package com.flakeid.registry;

import com.flakeid.ErrorCode;
import com.flakeid.GeneratorFactory;
import com.flakeid.GeneratorType;
import com.flakeid.IdGenerator;
import com.flakeid.IdGeneratorException;
import com.flakeid.snowflake.SnowflakeConfig;
import com.flakeid.snowflake.SnowflakeFactory;
import org.junit.jupiter.api.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class GeneratorRegistryTest {

    private static final Logger logger = LoggerFactory.getLogger(GeneratorRegistryTest.class);

    private FactoryRegistry factories;
    private GeneratorRegistry registry;

    @BeforeEach
    void setUp() {
        factories = new FactoryRegistry();
        factories.register(GeneratorType.SNOWFLAKE, new SnowflakeFactory());
        registry = new GeneratorRegistry(factories);
    }

    static void line() {
        logger.info("═══════════════════════════════════════");
    }

    // ==================== Create / Get ====================

    @Test
    void testCreateAndGet() {
        IdGenerator created = registry.create("orders", GeneratorType.SNOWFLAKE, new SnowflakeConfig(1, 2));

        assertSame(created, registry.get("orders"));
        assertTrue(registry.has("orders"));
        assertEquals(1, registry.count());
        assertEquals(2, registry.get("orders").getWorkerId());
        assertTrue(created.nextId() > 0);
    }

    @Test
    void testCreateUsesConfigType() {
        IdGenerator created = registry.create("users", new SnowflakeConfig(3, 4));
        assertEquals(3, created.getDatacenterId());
    }

    @Test
    void testDuplicateKey() {
        registry.create("orders", GeneratorType.SNOWFLAKE, new SnowflakeConfig(1, 2));
        IdGeneratorException e = assertThrows(IdGeneratorException.class,
                () -> registry.create("orders", GeneratorType.SNOWFLAKE, new SnowflakeConfig(1, 3)));
        assertEquals(ErrorCode.GENERATOR_ALREADY_EXISTS, e.getCode());
        assertEquals(2, registry.get("orders").getWorkerId(), "original instance is kept");
    }

    @Test
    void testMissingFactoryAndBadConfig() {
        assertEquals(ErrorCode.FACTORY_NOT_FOUND, assertThrows(IdGeneratorException.class,
                () -> registry.create("u", GeneratorType.UUID, new SnowflakeConfig())).getCode());
        assertEquals(ErrorCode.INVALID_CONFIG, assertThrows(IdGeneratorException.class,
                () -> registry.create("s", GeneratorType.SNOWFLAKE, null)).getCode());
        assertEquals(ErrorCode.INVALID_GENERATOR_TYPE, assertThrows(IdGeneratorException.class,
                () -> registry.create("s", null, new SnowflakeConfig())).getCode());
        assertEquals(ErrorCode.INVALID_WORKER_ID, assertThrows(IdGeneratorException.class,
                () -> registry.create("s", GeneratorType.SNOWFLAKE, new SnowflakeConfig(0, 32))).getCode());
        assertEquals(0, registry.count(), "failed creations leave nothing behind");
    }

    @Test
    void testGetUnknownKey() {
        assertEquals(ErrorCode.GENERATOR_NOT_FOUND,
                assertThrows(IdGeneratorException.class, () -> registry.get("missing")).getCode());
    }

    // ==================== Keys ====================

    @Test
    void testKeyValidation() {
        SnowflakeConfig config = new SnowflakeConfig();
        char[] longKey = new char[GeneratorRegistry.MAX_KEY_LENGTH + 1];
        Arrays.fill(longKey, 'k');

        assertKeyError(ErrorCode.INVALID_KEY, "");
        assertKeyError(ErrorCode.INVALID_KEY, null);
        assertKeyError(ErrorCode.INVALID_KEY, new String(longKey));
        assertKeyError(ErrorCode.INVALID_KEY_FORMAT, "has space");
        assertKeyError(ErrorCode.INVALID_KEY_FORMAT, "slash/key");
        assertKeyError(ErrorCode.INVALID_KEY_FORMAT, "ключ");

        registry.create("a-b_c.D9", config);
        registry.create(new String(longKey, 0, GeneratorRegistry.MAX_KEY_LENGTH), new SnowflakeConfig(0, 1));
        assertEquals(2, registry.count());

        assertFalse(registry.has(""));
        assertFalse(registry.has(null));
        assertFalse(registry.has("has space"));
    }

    private void assertKeyError(ErrorCode expected, String key) {
        IdGeneratorException e = assertThrows(IdGeneratorException.class,
                () -> registry.create(key, GeneratorType.SNOWFLAKE, new SnowflakeConfig()));
        assertEquals(expected, e.getCode(), String.valueOf(key));
    }

    // ==================== Capacity ====================

    @Test
    void testCapacityLimit() {
        registry.setMaxGenerators(2);
        registry.create("g1", new SnowflakeConfig(0, 1));
        registry.create("g2", new SnowflakeConfig(0, 2));

        IdGeneratorException e = assertThrows(IdGeneratorException.class,
                () -> registry.create("g3", new SnowflakeConfig(0, 3)));
        assertEquals(ErrorCode.MAX_GENERATORS_REACHED, e.getCode());
        assertEquals(2, registry.count());
        assertEquals(ErrorCode.MAX_GENERATORS_REACHED, assertThrows(IdGeneratorException.class,
                () -> registry.getOrCreate("g3", new SnowflakeConfig(0, 3))).getCode());
        assertNotNull(registry.getOrCreate("g1", new SnowflakeConfig(0, 9)), "existing keys stay reachable at capacity");
    }

    @Test
    void testSetMaxGenerators() {
        assertEquals(GeneratorRegistry.DEFAULT_MAX_GENERATORS, registry.getMaxGenerators());

        registry.create("g1", new SnowflakeConfig(0, 1));
        registry.create("g2", new SnowflakeConfig(0, 2));

        for (int invalid : new int[]{0, -1, GeneratorRegistry.ABSOLUTE_MAX_GENERATORS + 1, 1}) {
            IdGeneratorException e = assertThrows(IdGeneratorException.class, () -> registry.setMaxGenerators(invalid));
            assertEquals(ErrorCode.INVALID_CONFIG, e.getCode(), "max " + invalid);
        }
        assertEquals(GeneratorRegistry.DEFAULT_MAX_GENERATORS, registry.getMaxGenerators());

        registry.setMaxGenerators(2);
        assertEquals(2, registry.getMaxGenerators());
        registry.setMaxGenerators(GeneratorRegistry.ABSOLUTE_MAX_GENERATORS);
        assertEquals(GeneratorRegistry.ABSOLUTE_MAX_GENERATORS, registry.getMaxGenerators());
    }

    // ==================== Remove / Clear ====================

    @Test
    void testRemoveClearAndList() {
        registry.create("a", new SnowflakeConfig(0, 1));
        registry.create("b", new SnowflakeConfig(0, 2));
        registry.create("c", new SnowflakeConfig(0, 3));

        assertEquals(new HashSet<>(Arrays.asList("a", "b", "c")), new HashSet<>(registry.listKeys()));

        registry.remove("b");
        assertFalse(registry.has("b"));
        assertEquals(ErrorCode.GENERATOR_NOT_FOUND,
                assertThrows(IdGeneratorException.class, () -> registry.remove("b")).getCode());
        assertEquals(2, registry.count());

        registry.clear();
        assertEquals(0, registry.count());
        assertTrue(registry.listKeys().isEmpty());
    }

    // ==================== getOrCreate ====================

    @Test
    void testGetOrCreateReturnsExisting() {
        IdGenerator first = registry.getOrCreate("svc", GeneratorType.SNOWFLAKE, new SnowflakeConfig(1, 1));
        IdGenerator second = registry.getOrCreate("svc", GeneratorType.SNOWFLAKE, new SnowflakeConfig(2, 2));

        assertSame(first, second);
        assertEquals(1, second.getDatacenterId(), "config of later calls is ignored");
        assertEquals(1, registry.count());
    }

    @Test
    void testGetOrCreateConcurrentExactlyOnce() throws InterruptedException {
        line();
        logger.info("Test: [testGetOrCreateConcurrentExactlyOnce] 16 threads racing for one key");
        line();

        AtomicInteger factoryCalls = new AtomicInteger();
        FactoryRegistry counting = new FactoryRegistry();
        SnowflakeFactory delegate = new SnowflakeFactory();
        counting.register(GeneratorType.SNOWFLAKE, new GeneratorFactory<SnowflakeConfig>() {
            @Override
            public Class<SnowflakeConfig> configType() {
                return SnowflakeConfig.class;
            }

            @Override
            public IdGenerator create(SnowflakeConfig config) {
                factoryCalls.incrementAndGet();
                return delegate.create(config);
            }
        });
        GeneratorRegistry racing = new GeneratorRegistry(counting);

        int threads = 16;
        Set<IdGenerator> seen = ConcurrentHashMap.newKeySet();
        CountDownLatch startGate = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    startGate.await();
                    seen.add(racing.getOrCreate("shared", new SnowflakeConfig(7, 7)));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    finished.countDown();
                }
            });
        }
        startGate.countDown();
        assertTrue(finished.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, factoryCalls.get(), "factory should run exactly once");
        assertEquals(1, seen.size(), "all callers share one instance");
        assertEquals(1, racing.count());
        logger.info("Factory calls: {}, distinct instances: {}", factoryCalls.get(), seen.size());
        line();
    }
}
