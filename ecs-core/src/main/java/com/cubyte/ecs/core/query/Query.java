package com.cubyte.ecs.core.query;

import com.cubyte.ecs.core.api.IQuery;
import com.cubyte.ecs.core.component.ComponentManager;
import com.cubyte.ecs.core.component.ComponentMask;
import com.cubyte.ecs.core.entity.Entity;
import com.cubyte.ecs.core.entity.EntityManager;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Query over the entities of a world, filtered by component masks.
 * <p>
 * Supports:
 * - with(): entities MUST have these components
 * - without(): entities MUST NOT have these components
 * - any(): entities must have AT LEAST ONE of the components of each group
 * <p>
 * The candidate entities are captured when iteration starts. Before an entity is yielded it is checked
 * again, so structural changes made while iterating never expose dead or non-matching entities.
 * Adding entities during iteration does not make them visible to the running pass.
 */
public final class Query implements IQuery {
    private final EntityManager entities;
    private final ComponentManager components;
    private final ComponentMask with;
    private final ComponentMask without;
    private final List<ComponentMask> anyMasks;
    private final Map<Class<?>, Integer> withTypes;
    private final boolean matchesNothing;

    Query(EntityManager entities, ComponentManager components, ComponentMask with, ComponentMask without,
          List<ComponentMask> anyMasks, Map<Class<?>, Integer> withTypes, boolean matchesNothing) {
        this.entities = entities;
        this.components = components;
        this.with = with;
        this.without = without;
        this.anyMasks = List.copyOf(anyMasks);
        this.withTypes = Map.copyOf(withTypes);
        this.matchesNothing = matchesNothing;
    }

    /**
     * True if a component mask satisfies every term of this query.
     */
    public boolean matches(ComponentMask mask) {
        if (matchesNothing) {
            return false;
        }
        // WITH: mask must contain all required bits
        if (!mask.containsAll(with)) {
            return false;
        }
        // WITHOUT: mask must contain none of the excluded bits
        if (!mask.containsNone(without)) {
            return false;
        }
        // ANY: mask must intersect every any-group
        for (ComponentMask anyMask : anyMasks) {
            if (!mask.intersects(anyMask)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Iterator<Match> iterator() {
        List<Entity> snapshot = new ArrayList<>();
        if (!matchesNothing) {
            for (Entity entity : entities) {
                if (matches(entities.getMask(entity))) {
                    snapshot.add(entity);
                }
            }
        }
        return new MatchIterator(snapshot);
    }

    @Override
    public <A> void forEach(Class<A> type, BiConsumer<Entity, A> consumer) {
        requireWithType(type);
        for (Match match : this) {
            consumer.accept(match.entity(), match.get(type));
        }
    }

    @Override
    public <A, B> void forEach(Class<A> first, Class<B> second, BiComponentConsumer<A, B> consumer) {
        requireWithType(first);
        requireWithType(second);
        for (Match match : this) {
            consumer.accept(match.entity(), match.get(first), match.get(second));
        }
    }

    @Override
    public int count() {
        int count = 0;
        for (Iterator<Match> it = iterator(); it.hasNext(); it.next()) {
            count++;
        }
        return count;
    }

    @Override
    public Optional<Match> first() {
        Iterator<Match> it = iterator();
        return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
    }

    private int requireWithType(Class<?> type) {
        Integer typeId = withTypes.get(type);
        if (typeId == null) {
            throw new IllegalArgumentException(type.getName() + " is not a required component of this query");
        }
        return typeId;
    }

    private final class MatchIterator implements Iterator<Match> {
        private final List<Entity> snapshot;
        private int cursor;
        private Match next;

        MatchIterator(List<Entity> snapshot) {
            this.snapshot = snapshot;
        }

        @Override
        public boolean hasNext() {
            while (next == null && cursor < snapshot.size()) {
                Entity candidate = snapshot.get(cursor++);
                if (entities.isAlive(candidate) && matches(entities.getMask(candidate))) {
                    next = new Match(candidate);
                }
            }
            return next != null;
        }

        @Override
        public Match next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Match match = next;
            next = null;
            return match;
        }
    }

    /**
     * One matched entity, with access to the query's required components.
     */
    public final class Match {
        private final Entity entity;

        private Match(Entity entity) {
            this.entity = entity;
        }

        public Entity entity() {
            return entity;
        }

        /**
         * Typed reference to a required component.
         *
         * @throws IllegalArgumentException if the type is not one of the query's required components
         * @throws IllegalStateException    if the component was removed since the match was yielded
         */
        public <T> T get(Class<T> type) {
            return type.cast(components.get(entity.index(), requireWithType(type)));
        }

        /**
         * Replace the value of a required component.
         *
         * @throws IllegalArgumentException if the value's type is not one of the query's required components
         * @throws IllegalStateException    if the entity was destroyed or the component removed since the match was yielded
         */
        public <T> void set(T value) {
            int typeId = requireWithType(value.getClass());
            if (!entities.isAlive(entity)) {
                throw new IllegalStateException("Entity " + entity + " was destroyed");
            }
            if (!entities.getMask(entity).has(typeId)) {
                throw new IllegalStateException("Entity " + entity + " no longer has a '"
                        + components.getDescriptor(typeId).name() + "' component");
            }
            components.add(entity.index(), typeId, value);
        }

        @Override
        public String toString() {
            return "Match{" + entity + '}';
        }
    }
}
