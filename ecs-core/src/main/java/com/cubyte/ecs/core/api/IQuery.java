package com.cubyte.ecs.core.api;

import com.cubyte.ecs.core.entity.Entity;
import com.cubyte.ecs.core.query.Query;

import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Immutable query over the entities of a world.
 * <p>
 * Iteration is lazy: every {@link #iterator()} call takes a fresh snapshot of the matching entities and
 * re-checks each one before yielding it, so entities destroyed or changed by the loop body are skipped.
 * Instances are created through {@link IQueryBuilder#build()}.
 */
public interface IQuery extends Iterable<Query.Match> {

    /**
     * Functional interface for consuming an entity with two of its components.
     */
    @FunctionalInterface
    interface BiComponentConsumer<A, B> {
        void accept(Entity entity, A first, B second);
    }

    /**
     * Iterate matching entities with one required component.
     *
     * @throws IllegalArgumentException if the type is not one of the query's required components
     */
    <A> void forEach(Class<A> type, BiConsumer<Entity, A> consumer);

    /**
     * Iterate matching entities with two required components.
     *
     * @throws IllegalArgumentException if a type is not one of the query's required components
     */
    <A, B> void forEach(Class<A> first, Class<B> second, BiComponentConsumer<A, B> consumer);

    /**
     * Count the entities currently matching this query.
     */
    int count();

    /**
     * First match in entity index order, if any.
     */
    Optional<Query.Match> first();
}
