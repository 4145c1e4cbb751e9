package com.cubyte.ecs.core.entity;

import com.cubyte.ecs.core.component.ComponentMask;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Allocates entity identifiers and tracks the live component mask of each entity.
 * <p>
 * Freed indices are reused with a bumped generation so stale handles never alias new entities.
 * Not thread-safe: structural changes must be serialized by the caller.
 */
public final class EntityManager implements Iterable<Entity> {
    private static final Logger log = LogManager.getLogger(EntityManager.class);

    private final BitSet alive = new BitSet();
    private int[] generations;
    private ComponentMask[] masks;
    private int nextIndex = 0;
    private int liveCount = 0;

    // free-list without boxing
    private int[] free = new int[256];
    private int freeSize = 0;

    public EntityManager(int initialCapacity) {
        int capacity = Math.max(initialCapacity, 16);
        this.generations = new int[capacity];
        this.masks = new ComponentMask[capacity];
    }

    /**
     * Allocate an entity with the given initial mask.
     */
    public Entity create(ComponentMask mask) {
        final int index;
        if (freeSize > 0) {
            index = free[--freeSize];
        } else {
            index = nextIndex++;
            ensureCapacity(nextIndex);
        }
        alive.set(index);
        masks[index] = mask;
        liveCount++;
        return new Entity(index, generations[index]);
    }

    /**
     * Free an entity. Destroying a dead entity logs an error and does nothing.
     *
     * @return true if the entity was alive
     */
    public boolean destroy(Entity entity) {
        if (!isValid(entity)) {
            log.error("Entity {} doesn't exist!", entity);
            return false;
        }
        int index = entity.index();
        alive.clear(index);
        masks[index] = ComponentMask.EMPTY;
        generations[index]++;
        liveCount--;

        // push into free-list
        if (freeSize == free.length) {
            free = Arrays.copyOf(free, free.length << 1);
        }
        free[freeSize++] = index;
        return true;
    }

    /**
     * True if the index is in range, the slot is in use and the generation matches.
     */
    public boolean isValid(Entity entity) {
        int index = entity.index();
        return index >= 0 && index < nextIndex && alive.get(index) && generations[index] == entity.generation();
    }

    public boolean isAlive(Entity entity) {
        return isValid(entity);
    }

    /**
     * @throws IllegalArgumentException if the entity is not alive
     */
    public ComponentMask getMask(Entity entity) {
        requireValid(entity);
        return masks[entity.index()];
    }

    /**
     * @throws IllegalArgumentException if the entity is not alive
     */
    public void setMask(Entity entity, ComponentMask mask) {
        requireValid(entity);
        masks[entity.index()] = mask;
    }

    /**
     * Live handle currently occupying an index, or {@link Entity#NULL}.
     */
    public Entity entityAt(int index) {
        if (index < 0 || index >= nextIndex || !alive.get(index)) {
            return Entity.NULL;
        }
        return new Entity(index, generations[index]);
    }

    /**
     * Number of live entities.
     */
    public int size() {
        return liveCount;
    }

    /**
     * Size of the index space, live or free.
     */
    public int capacity() {
        return nextIndex;
    }

    /**
     * Live entities in index order. Each call starts a new pass.
     */
    @Override
    public Iterator<Entity> iterator() {
        return new Iterator<>() {
            private int cursor = alive.nextSetBit(0);

            @Override
            public boolean hasNext() {
                return cursor >= 0 && cursor < nextIndex;
            }

            @Override
            public Entity next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Entity entity = new Entity(cursor, generations[cursor]);
                cursor = alive.nextSetBit(cursor + 1);
                return entity;
            }
        };
    }

    private void requireValid(Entity entity) {
        if (!isValid(entity)) {
            throw new IllegalArgumentException("Entity " + entity + " is not alive");
        }
    }

    private void ensureCapacity(int minCapacity) {
        if (minCapacity <= generations.length) return;
        int newCapacity = Math.max(minCapacity, generations.length << 1);
        generations = Arrays.copyOf(generations, newCapacity);
        masks = Arrays.copyOf(masks, newCapacity);
    }
}
