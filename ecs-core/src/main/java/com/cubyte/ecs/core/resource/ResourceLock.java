package com.cubyte.ecs.core.resource;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;

/**
 * Scoped guard over a resource. The lock is held from construction until {@link #close()}, which
 * releases it exactly once; use it with try-with-resources so every exit path releases.
 * <p>
 * An invalid guard (unregistered resource type) holds no lock and refuses access.
 *
 * @param <T> the resource type
 */
public abstract class ResourceLock<T> implements AutoCloseable {
    private final Class<T> type;
    private final ResourceManager.ResourceEntry<T> entry;
    private final Lock lock;
    private final AtomicBoolean released = new AtomicBoolean();

    ResourceLock(Class<T> type, ResourceManager.ResourceEntry<T> entry, Lock lock) {
        this.type = type;
        this.entry = entry;
        this.lock = lock;
        if (lock != null) {
            lock.lock();
        }
    }

    public Class<T> type() {
        return type;
    }

    /**
     * False when the resource type was never registered.
     */
    public boolean isValid() {
        return entry != null;
    }

    /**
     * @throws IllegalStateException if the guard is invalid or already released
     */
    public T get() {
        checkAccess();
        return entry.value;
    }

    ResourceManager.ResourceEntry<T> entry() {
        checkAccess();
        return entry;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (lock != null && released.compareAndSet(false, true)) {
            lock.unlock();
        }
    }

    private void checkAccess() {
        if (entry == null) {
            throw new IllegalStateException("Resource " + type.getName() + " is not registered");
        }
        if (released.get()) {
            throw new IllegalStateException("Lock on resource " + type.getName() + " was already released");
        }
    }
}
