package com.cubyte.ecs.core.component;

import com.cubyte.ecs.core.reflection.TypeDescriptor;

import java.util.Arrays;
import java.util.function.ObjIntConsumer;

/**
 * Storage for every value of one component type, keyed by entity index.
 * <p>
 * Values are packed densely through a {@link SparseSet}. Overwritten and erased values are released
 * through the type's destructor. Reads of absent entries fail fast: the entity mask is the guard
 * callers are expected to check first.
 *
 * @param <T> the component type
 */
public final class ComponentStorage<T> {
    private final TypeDescriptor<T> descriptor;
    private final SparseSet indices;
    private Object[] values;

    public ComponentStorage(TypeDescriptor<T> descriptor, int initialCapacity) {
        this.descriptor = descriptor;
        this.indices = new SparseSet(initialCapacity);
        this.values = new Object[Math.max(initialCapacity, 16)];
    }

    public TypeDescriptor<T> descriptor() {
        return descriptor;
    }

    /**
     * Store a value at the entity index, destructing any previous value there.
     */
    public void insert(int entityIndex, T value) {
        T cast = descriptor.type().cast(value);
        int slot = indices.getDenseIndex(entityIndex);
        if (slot >= 0) {
            T previous = valueAt(slot);
            values[slot] = cast;
            if (previous != cast) {
                descriptor.trait().destruct(previous);
            }
            return;
        }
        slot = indices.add(entityIndex);
        if (slot >= values.length) {
            values = Arrays.copyOf(values, Math.max(slot + 1, values.length << 1));
        }
        values[slot] = cast;
    }

    /**
     * Destruct and erase the value at the entity index. Erasing an absent entry is a no-op.
     *
     * @return true if a value was erased
     */
    public boolean erase(int entityIndex) {
        int slot = indices.getDenseIndex(entityIndex);
        if (slot < 0) {
            return false;
        }
        T previous = valueAt(slot);
        int last = indices.size() - 1;
        indices.remove(entityIndex);
        values[slot] = values[last];
        values[last] = null;
        descriptor.trait().destruct(previous);
        return true;
    }

    /**
     * Value at the entity index.
     *
     * @throws IllegalStateException if there is no value for that index
     */
    public T get(int entityIndex) {
        int slot = indices.getDenseIndex(entityIndex);
        if (slot < 0) {
            throw new IllegalStateException("No '" + descriptor.name() + "' component stored for entity index " + entityIndex);
        }
        return valueAt(slot);
    }

    public boolean contains(int entityIndex) {
        return indices.has(entityIndex);
    }

    public int size() {
        return indices.size();
    }

    /**
     * Bytes taken by the stored values according to the type's reflected layout.
     */
    public long byteSize() {
        return (long) indices.size() * descriptor.size();
    }

    /**
     * Visit every stored value with its entity index, in dense order.
     */
    public void forEach(ObjIntConsumer<T> action) {
        for (int slot = 0; slot < indices.size(); slot++) {
            action.accept(valueAt(slot), indices.getEntity(slot));
        }
    }

    /**
     * Destruct every stored value.
     */
    public void clear() {
        int count = indices.size();
        Object[] released = Arrays.copyOf(values, count);
        indices.clear();
        Arrays.fill(values, 0, count, null);
        for (Object value : released) {
            descriptor.trait().destructErased(value);
        }
    }

    @SuppressWarnings("unchecked")
    private T valueAt(int slot) {
        return (T) values[slot];
    }
}
