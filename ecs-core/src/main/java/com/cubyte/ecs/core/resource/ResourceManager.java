package com.cubyte.ecs.core.resource;

import com.cubyte.ecs.core.reflection.TypeDescriptor;
import com.cubyte.ecs.core.reflection.TypeRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Holds exactly one instance per registered resource type, each behind a read/write lock.
 * <p>
 * Lock acquisition blocks without timeout. Lock ordering across resources is the caller's
 * responsibility; a deadlock is a programming error, not something this class recovers from.
 * Registration and {@link #clear()} must not run concurrently with reads or writes.
 */
public final class ResourceManager {
    private static final Logger log = LogManager.getLogger(ResourceManager.class);

    private final TypeRegistry types;
    private final ConcurrentHashMap<Class<?>, ResourceEntry<?>> resources = new ConcurrentHashMap<>();

    static final class ResourceEntry<T> {
        final TypeDescriptor<T> descriptor;
        final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        volatile T value;

        ResourceEntry(TypeDescriptor<T> descriptor, T value) {
            this.descriptor = descriptor;
            this.value = value;
        }
    }

    public ResourceManager(TypeRegistry types) {
        this.types = types;
    }

    /**
     * Register a resource instance. A type can only be registered once; a duplicate logs an error.
     *
     * @return true if the resource was added
     */
    public <T> boolean add(Class<T> type, T instance) {
        Objects.requireNonNull(instance, "instance");
        if (resources.containsKey(type)) {
            log.error("Resource '{}' is already registered", type.getName());
            return false;
        }
        ResourceEntry<T> entry = new ResourceEntry<>(types.register(type), type.cast(instance));
        if (resources.putIfAbsent(type, entry) != null) {
            log.error("Resource '{}' is already registered", type.getName());
            return false;
        }
        log.trace("Registered resource '{}'", type.getName());
        return true;
    }

    /**
     * Register a resource built by the factory. The factory is not invoked for a duplicate.
     */
    public <T> boolean addFactory(Class<T> type, Supplier<? extends T> factory) {
        if (resources.containsKey(type)) {
            log.error("Resource '{}' is already registered", type.getName());
            return false;
        }
        return add(type, factory.get());
    }

    public boolean contains(Class<?> type) {
        return resources.containsKey(type);
    }

    /**
     * Acquire a shared lock on a resource, blocking while a writer holds it.
     * An unregistered type logs an error and yields an invalid guard.
     */
    public <T> ReadResource<T> read(Class<T> type) {
        ResourceEntry<T> entry = entry(type);
        if (entry == null) {
            log.error("Resource '{}' is not registered", type.getName());
            return ReadResource.invalid(type);
        }
        return new ReadResource<>(type, entry);
    }

    /**
     * Acquire an exclusive lock on a resource, blocking while any reader or writer holds it.
     * An unregistered type logs an error and yields an invalid guard.
     */
    public <T> WriteResource<T> write(Class<T> type) {
        ResourceEntry<T> entry = entry(type);
        if (entry == null) {
            log.error("Resource '{}' is not registered", type.getName());
            return WriteResource.invalid(type);
        }
        return new WriteResource<>(type, entry);
    }

    public int size() {
        return resources.size();
    }

    /**
     * Destruct and drop every resource. Each resource is destructed under its write lock,
     * so this waits for outstanding guards to be released.
     */
    public void clear() {
        List<Class<?>> registered = new ArrayList<>(resources.keySet());
        for (Class<?> type : registered) {
            destroy(resources.remove(type));
        }
    }

    private <T> void destroy(ResourceEntry<T> entry) {
        if (entry == null) return;
        ReentrantReadWriteLock.WriteLock writeLock = entry.lock.writeLock();
        writeLock.lock();
        try {
            entry.descriptor.trait().destruct(entry.value);
        } finally {
            writeLock.unlock();
        }
    }

    @SuppressWarnings("unchecked")
    private <T> ResourceEntry<T> entry(Class<T> type) {
        return (ResourceEntry<T>) resources.get(type);
    }
}
