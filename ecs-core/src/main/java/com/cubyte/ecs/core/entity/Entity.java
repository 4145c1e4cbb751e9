package com.cubyte.ecs.core.entity;

/**
 * Identifier of an entity: a dense, reused index plus the generation it was allocated with.
 * <p>
 * An {@code Entity} is a weak reference. Once the entity is destroyed its index may be handed out again
 * with a higher generation, and the old handle is detectably stale.
 *
 * @param index      slot in the entity table
 * @param generation number of times the slot had been freed when this handle was allocated
 */
public record Entity(int index, int generation) {

    /** Handle that never refers to a live entity. */
    public static final Entity NULL = new Entity(-1, 0);

    public boolean isNull() {
        return index < 0;
    }

    @Override
    public String toString() {
        return isNull() ? "Entity(null)" : "Entity(" + index + "#" + generation + ")";
    }
}
