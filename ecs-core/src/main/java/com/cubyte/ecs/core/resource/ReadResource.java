package com.cubyte.ecs.core.resource;

/**
 * Shared lock on a resource: any number of readers may hold one at the same time.
 */
public final class ReadResource<T> extends ResourceLock<T> {

    ReadResource(Class<T> type, ResourceManager.ResourceEntry<T> entry) {
        super(type, entry, entry != null ? entry.lock.readLock() : null);
    }

    static <T> ReadResource<T> invalid(Class<T> type) {
        return new ReadResource<>(type, null);
    }
}
