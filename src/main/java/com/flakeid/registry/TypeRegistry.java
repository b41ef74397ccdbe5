package com.flakeid.registry;

import com.flakeid.ErrorCode;
import com.flakeid.GeneratorType;
import com.flakeid.IdGeneratorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Map from {@link GeneratorType} to one implementation of a per-type service.
 *
 * <p>Registration overwrites any previous entry for the same type. Lookups take
 * a shared lock and may run concurrently; registration takes the exclusive
 * lock.</p>
 *
 * @param <T> the service held per type
 */
abstract class TypeRegistry<T> {
    private static final Logger logger = LoggerFactory.getLogger(TypeRegistry.class);

    private final Map<GeneratorType, T> entries = new EnumMap<>(GeneratorType.class);
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final String kind;
    private final ErrorCode notFound;

    TypeRegistry(String kind, ErrorCode notFound) {
        this.kind = kind;
        this.notFound = notFound;
    }

    /**
     * Registers an implementation, replacing any previous one for the type.
     *
     * @throws IdGeneratorException with {@link ErrorCode#INVALID_GENERATOR_TYPE} if the type is null
     * @throws NullPointerException if the implementation is null
     */
    public void register(GeneratorType type, T implementation) {
        if (type == null) {
            throw new IdGeneratorException(ErrorCode.INVALID_GENERATOR_TYPE, "type cannot be null");
        }
        Objects.requireNonNull(implementation, kind);
        T previous;
        lock.writeLock().lock();
        try {
            previous = entries.put(type, implementation);
        } finally {
            lock.writeLock().unlock();
        }
        if (previous != null) {
            logger.info("Replaced {} for type {}", kind, type);
        } else {
            logger.info("Registered {} for type {}", kind, type);
        }
    }

    /**
     * @throws IdGeneratorException with this registry's not-found code if nothing is registered
     */
    public T get(GeneratorType type) {
        if (type == null) {
            throw new IdGeneratorException(ErrorCode.INVALID_GENERATOR_TYPE, "type cannot be null");
        }
        T implementation;
        lock.readLock().lock();
        try {
            implementation = entries.get(type);
        } finally {
            lock.readLock().unlock();
        }
        if (implementation == null) {
            throw new IdGeneratorException(notFound, type.getValue());
        }
        return implementation;
    }

    public boolean has(GeneratorType type) {
        if (type == null) {
            return false;
        }
        lock.readLock().lock();
        try {
            return entries.containsKey(type);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes the implementation for a type.
     *
     * @return true if something was removed
     */
    public boolean unregister(GeneratorType type) {
        if (type == null) {
            return false;
        }
        lock.writeLock().lock();
        try {
            return entries.remove(type) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Registered types in declaration order. */
    public List<GeneratorType> list() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(entries.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }
}
