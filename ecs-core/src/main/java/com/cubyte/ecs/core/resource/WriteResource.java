package com.cubyte.ecs.core.resource;

import java.util.Objects;

/**
 * Exclusive lock on a resource: no reader or other writer holds the resource while this is open.
 */
public final class WriteResource<T> extends ResourceLock<T> {

    WriteResource(Class<T> type, ResourceManager.ResourceEntry<T> entry) {
        super(type, entry, entry != null ? entry.lock.writeLock() : null);
    }

    static <T> WriteResource<T> invalid(Class<T> type) {
        return new WriteResource<>(type, null);
    }

    /**
     * Replace the resource instance. The previous instance is destructed.
     */
    public void set(T value) {
        Objects.requireNonNull(value, "value");
        ResourceManager.ResourceEntry<T> entry = entry();
        T previous = entry.value;
        entry.value = type().cast(value);
        if (previous != value) {
            entry.descriptor.trait().destruct(previous);
        }
    }
}
