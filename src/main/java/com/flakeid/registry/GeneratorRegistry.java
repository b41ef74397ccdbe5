package com.flakeid.registry;

import com.flakeid.ErrorCode;
import com.flakeid.GeneratorConfig;
import com.flakeid.GeneratorFactory;
import com.flakeid.GeneratorType;
import com.flakeid.IdGenerator;
import com.flakeid.IdGeneratorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;

/**
 * Keyed registry of live generator instances.
 *
 * <p>One read-write lock guards the whole map: {@code get}, {@code has},
 * {@code count} and {@code listKeys} share it, while {@code create},
 * {@code getOrCreate} (on a miss), {@code remove}, {@code clear} and capacity
 * changes hold it exclusively. Generators are built by the factory registered
 * for the requested type while the exclusive lock is held, so creation for a
 * given key happens at most once.</p>
 *
 * <p>Keys match {@code ^[a-zA-Z0-9_\-.]+$} and are at most 256 characters.</p>
 */
public final class GeneratorRegistry {
    private static final Logger logger = LoggerFactory.getLogger(GeneratorRegistry.class);

    /** Default capacity */
    public static final int DEFAULT_MAX_GENERATORS = 100;

    /** Hard ceiling for {@link #setMaxGenerators(int)} */
    public static final int ABSOLUTE_MAX_GENERATORS = 100_000;

    public static final int MAX_KEY_LENGTH = 256;

    private static final Pattern KEY_FORMAT = Pattern.compile("^[a-zA-Z0-9_\\-.]+$");

    private final FactoryRegistry factories;
    private final Map<String, IdGenerator> generators = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private int maxGenerators = DEFAULT_MAX_GENERATORS;

    /**
     * @param factories where generator factories are looked up by type
     */
    public GeneratorRegistry(FactoryRegistry factories) {
        this.factories = Objects.requireNonNull(factories, "factories");
    }

    // ==================== Creation ====================

    /**
     * Creates and registers a generator of the config's own type.
     *
     * @see #create(String, GeneratorType, GeneratorConfig)
     */
    public IdGenerator create(String key, GeneratorConfig config) {
        return create(key, typeOf(config), config);
    }

    /**
     * Creates a generator and registers it under a new key.
     *
     * @param key unique key
     * @param type which factory to use
     * @param config configuration understood by that factory
     * @return the new generator
     * @throws IdGeneratorException with {@link ErrorCode#INVALID_KEY}, {@link ErrorCode#INVALID_KEY_FORMAT},
     *         {@link ErrorCode#INVALID_GENERATOR_TYPE}, {@link ErrorCode#GENERATOR_ALREADY_EXISTS},
     *         {@link ErrorCode#MAX_GENERATORS_REACHED}, {@link ErrorCode#FACTORY_NOT_FOUND}
     *         or any error raised by the factory
     */
    public IdGenerator create(String key, GeneratorType type, GeneratorConfig config) {
        validateKey(key);
        requireType(type);

        lock.writeLock().lock();
        try {
            if (generators.containsKey(key)) {
                throw new IdGeneratorException(ErrorCode.GENERATOR_ALREADY_EXISTS, "key '" + key + "'");
            }
            return createLocked(key, type, config);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the generator for a key, creating it if absent.
     *
     * @see #getOrCreate(String, GeneratorType, GeneratorConfig)
     */
    public IdGenerator getOrCreate(String key, GeneratorConfig config) {
        return getOrCreate(key, typeOf(config), config);
    }

    /**
     * Returns the generator registered under {@code key}, creating and
     * registering one if there is none yet. Concurrent first calls for the same
     * key all receive the same instance. When the key already exists the type
     * and config arguments are ignored.
     *
     * @throws IdGeneratorException as {@link #create(String, GeneratorType, GeneratorConfig)},
     *         except that an existing key is not an error
     */
    public IdGenerator getOrCreate(String key, GeneratorType type, GeneratorConfig config) {
        validateKey(key);
        requireType(type);

        lock.readLock().lock();
        try {
            IdGenerator existing = generators.get(key);
            if (existing != null) {
                return existing;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            IdGenerator existing = generators.get(key);
            if (existing != null) {
                return existing;
            }
            return createLocked(key, type, config);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private IdGenerator createLocked(String key, GeneratorType type, GeneratorConfig config) {
        if (generators.size() >= maxGenerators) {
            throw new IdGeneratorException(ErrorCode.MAX_GENERATORS_REACHED,
                    "current " + generators.size() + ", max " + maxGenerators);
        }
        GeneratorFactory<?> factory = factories.get(type);
        IdGenerator generator = factory.createUnchecked(config);
        generators.put(key, generator);
        logger.info("Generator created: key={}, type={}", key, type);
        return generator;
    }

    // ==================== Lookup ====================

    /**
     * @throws IdGeneratorException with {@link ErrorCode#GENERATOR_NOT_FOUND} if the key is unknown
     */
    public IdGenerator get(String key) {
        validateKey(key);
        lock.readLock().lock();
        try {
            IdGenerator generator = generators.get(key);
            if (generator == null) {
                throw new IdGeneratorException(ErrorCode.GENERATOR_NOT_FOUND, "key '" + key + "'");
            }
            return generator;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return false for unknown or malformed keys
     */
    public boolean has(String key) {
        if (!isValidKey(key)) {
            return false;
        }
        lock.readLock().lock();
        try {
            return generators.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return number of registered generators
     */
    public int count() {
        lock.readLock().lock();
        try {
            return generators.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Registered keys, in no particular order. */
    public List<String> listKeys() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(generators.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Removal ====================

    /**
     * @throws IdGeneratorException with {@link ErrorCode#GENERATOR_NOT_FOUND} if the key is unknown
     */
    public void remove(String key) {
        validateKey(key);
        lock.writeLock().lock();
        try {
            if (generators.remove(key) == null) {
                throw new IdGeneratorException(ErrorCode.GENERATOR_NOT_FOUND, "key '" + key + "'");
            }
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Generator removed: key={}", key);
    }

    /**
     * Removes every generator. Capacity is unchanged.
     */
    public void clear() {
        int removed;
        lock.writeLock().lock();
        try {
            removed = generators.size();
            generators.clear();
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Registry cleared: {} generators removed", removed);
    }

    // ==================== Capacity ====================

    /**
     * Changes the capacity.
     *
     * @param max new capacity, 1 to {@value #ABSOLUTE_MAX_GENERATORS}, not below the current count
     * @throws IdGeneratorException with {@link ErrorCode#INVALID_CONFIG} if the value is rejected
     */
    public void setMaxGenerators(int max) {
        if (max <= 0) {
            throw new IdGeneratorException(ErrorCode.INVALID_CONFIG,
                    "max generators must be positive, got " + max);
        }
        if (max > ABSOLUTE_MAX_GENERATORS) {
            throw new IdGeneratorException(ErrorCode.INVALID_CONFIG,
                    "max generators cannot exceed absolute limit " + ABSOLUTE_MAX_GENERATORS + ", got " + max);
        }
        int current;
        lock.writeLock().lock();
        try {
            current = generators.size();
            if (current > max) {
                throw new IdGeneratorException(ErrorCode.INVALID_CONFIG,
                        "current generator count " + current + " exceeds new max " + max);
            }
            maxGenerators = max;
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Registry capacity changed: max={}, current={}", max, current);
    }

    /**
     * @return current capacity
     */
    public int getMaxGenerators() {
        lock.readLock().lock();
        try {
            return maxGenerators;
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Key Validation ====================

    private static void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IdGeneratorException(ErrorCode.INVALID_KEY, "key cannot be empty");
        }
        if (key.length() > MAX_KEY_LENGTH) {
            throw new IdGeneratorException(ErrorCode.INVALID_KEY,
                    "key too long (max " + MAX_KEY_LENGTH + "), got " + key.length());
        }
        if (!KEY_FORMAT.matcher(key).matches()) {
            throw new IdGeneratorException(ErrorCode.INVALID_KEY_FORMAT,
                    "key '" + key + "' contains invalid characters");
        }
    }

    private static boolean isValidKey(String key) {
        return key != null && !key.isEmpty() && key.length() <= MAX_KEY_LENGTH
                && KEY_FORMAT.matcher(key).matches();
    }

    private static void requireType(GeneratorType type) {
        if (type == null) {
            throw new IdGeneratorException(ErrorCode.INVALID_GENERATOR_TYPE, "type cannot be null");
        }
    }

    private static GeneratorType typeOf(GeneratorConfig config) {
        if (config == null) {
            throw new IdGeneratorException(ErrorCode.INVALID_CONFIG, "config cannot be null");
        }
        return config.type();
    }
}
