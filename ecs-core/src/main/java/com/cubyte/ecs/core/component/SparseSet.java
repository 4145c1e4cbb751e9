package com.cubyte.ecs.core.component;

import java.util.Arrays;

/**
 * Sparse Set for fast entity-to-component mapping.
 * - O(1) insertion, deletion, lookup
 * - Maintains dense packing for cache-friendly iteration
 * - Grows on demand as larger entity indices are inserted
 */
public class SparseSet {
    private int[] sparse;  // entity index -> dense index
    private int[] dense;   // dense index -> entity index
    private int size;

    public SparseSet(int initialCapacity) {
        int capacity = Math.max(initialCapacity, 16);
        this.sparse = new int[capacity];
        this.dense = new int[capacity];
        this.size = 0;
        Arrays.fill(sparse, -1);
    }

    /**
     * Add an entity index to the set, returning its dense index
     */
    public int add(int entityIndex) {
        if (entityIndex < 0) {
            throw new IllegalArgumentException("Negative entity index: " + entityIndex);
        }
        if (has(entityIndex)) {
            return sparse[entityIndex];
        }
        ensureSparseCapacity(entityIndex + 1);
        if (size == dense.length) {
            dense = Arrays.copyOf(dense, dense.length << 1);
        }

        int denseIndex = size;
        sparse[entityIndex] = denseIndex;
        dense[denseIndex] = entityIndex;
        size++;
        return denseIndex;
    }

    /**
     * Remove an entity index using swap-and-pop.
     * The last dense element is moved into the freed slot.
     *
     * @return the dense index that was freed, or -1 if the index was absent
     */
    public int remove(int entityIndex) {
        if (!has(entityIndex)) {
            return -1;
        }

        int denseIndex = sparse[entityIndex];
        int lastEntity = dense[size - 1];

        // Swap with last element
        dense[denseIndex] = lastEntity;
        sparse[lastEntity] = denseIndex;

        // Mark as removed
        sparse[entityIndex] = -1;
        size--;
        return denseIndex;
    }

    /**
     * Check if entity index exists in the set
     */
    public boolean has(int entityIndex) {
        return entityIndex >= 0 && entityIndex < sparse.length && sparse[entityIndex] != -1;
    }

    /**
     * Get the dense index for an entity index, or -1 if absent
     */
    public int getDenseIndex(int entityIndex) {
        return has(entityIndex) ? sparse[entityIndex] : -1;
    }

    /**
     * Get the entity index at a dense index
     */
    public int getEntity(int denseIndex) {
        return dense[denseIndex];
    }

    /**
     * Get the number of entity indices in the set
     */
    public int size() {
        return size;
    }

    /**
     * Clear all entity indices
     */
    public void clear() {
        Arrays.fill(sparse, -1);
        size = 0;
    }

    private void ensureSparseCapacity(int minCapacity) {
        if (minCapacity <= sparse.length) return;
        int oldLength = sparse.length;
        int newLength = Math.max(minCapacity, oldLength << 1);
        sparse = Arrays.copyOf(sparse, newLength);
        Arrays.fill(sparse, oldLength, newLength, -1);
    }
}
