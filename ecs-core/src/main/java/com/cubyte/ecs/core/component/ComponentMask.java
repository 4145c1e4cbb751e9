package com.cubyte.ecs.core.component;

import java.util.BitSet;

/**
 * Immutable set of component type ids held per entity.
 * The capacity is fixed at {@link #MAX_COMPONENTS}; ids outside {@code [0, MAX_COMPONENTS)} are rejected.
 */
public final class ComponentMask {
    public static final int MAX_COMPONENTS = 256;
    public static final ComponentMask EMPTY = new ComponentMask();

    private final BitSet mask;
    private final int hashCode;

    public ComponentMask() {
        this.mask = new BitSet(MAX_COMPONENTS);
        this.hashCode = mask.hashCode();
    }

    private ComponentMask(BitSet mask) {
        this.mask = (BitSet) mask.clone();
        this.hashCode = mask.hashCode();
    }

    public static ComponentMask of(int... componentIds) {
        Builder builder = builder();
        for (int id : componentIds) {
            builder.with(id);
        }
        return builder.build();
    }

    /**
     * Set a component bit in the mask
     */
    public ComponentMask set(int componentId) {
        checkId(componentId);
        if (mask.get(componentId)) return this;
        BitSet newMask = (BitSet) mask.clone();
        newMask.set(componentId);
        return new ComponentMask(newMask);
    }

    /**
     * Clear a component bit from the mask
     */
    public ComponentMask clear(int componentId) {
        checkId(componentId);
        if (!mask.get(componentId)) return this;
        BitSet newMask = (BitSet) mask.clone();
        newMask.clear(componentId);
        return new ComponentMask(newMask);
    }

    /**
     * Check if a component is present in the mask
     */
    public boolean has(int componentId) {
        return componentId >= 0 && mask.get(componentId);
    }

    /**
     * Return true if this mask is a superset of other (WITH semantics).
     */
    public boolean containsAll(ComponentMask other) {
        // other - this == empty ?
        BitSet diff = (BitSet) other.mask.clone();
        diff.andNot(this.mask);
        return diff.isEmpty();
    }

    /**
     * Return true if this mask shares at least one bit with other (ANY semantics).
     */
    public boolean intersects(ComponentMask other) {
        return this.mask.intersects(other.mask);
    }

    /**
     * Return true if this mask has no bits in common with other (WITHOUT semantics).
     */
    public boolean containsNone(ComponentMask other) {
        return !this.mask.intersects(other.mask);
    }

    public boolean isEmpty() {
        return mask.isEmpty();
    }

    /**
     * Get the number of components in this mask
     */
    public int cardinality() {
        return mask.cardinality();
    }

    /**
     * Return all set component IDs in ascending order.
     */
    public int[] toComponentIdArray() {
        return mask.stream().toArray();
    }

    private static void checkId(int componentId) {
        if (componentId < 0 || componentId >= MAX_COMPONENTS) {
            throw new IllegalArgumentException("Component id out of range [0, " + MAX_COMPONENTS + "): " + componentId);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ComponentMask that = (ComponentMask) o;
        return mask.equals(that.mask);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "ComponentMask{" + mask + '}';
    }

    /**
     * Create a builder for fluent API
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final BitSet mask = new BitSet(MAX_COMPONENTS);

        public Builder with(int componentId) {
            checkId(componentId);
            mask.set(componentId);
            return this;
        }

        public Builder with(ComponentMask other) {
            mask.or(other.mask);
            return this;
        }

        public ComponentMask build() {
            return new ComponentMask(mask);
        }
    }
}
