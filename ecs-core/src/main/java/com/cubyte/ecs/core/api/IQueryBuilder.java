package com.cubyte.ecs.core.api;

/**
 * Mutable builder for entity queries.
 * <p>
 * Example usage:
 * <pre>{@code
 * IQuery query = world.query()
 *     .with(Position.class)
 *     .with(Velocity.class)
 *     .without(Frozen.class)
 *     .build();
 * }</pre>
 *
 * @see IQuery
 */
public interface IQueryBuilder {

    /**
     * Entities must have this component to match the query.
     *
     * @param componentClass the component class to require
     * @param <T>            the component type
     * @return this builder for chaining
     */
    <T> IQueryBuilder with(Class<T> componentClass);

    /**
     * Entities must NOT have this component to match the query.
     *
     * @param componentClass the component class to exclude
     * @param <T>            the component type
     * @return this builder for chaining
     */
    <T> IQueryBuilder without(Class<T> componentClass);

    /**
     * Entities must have at least ONE of these components to match the query.
     * Each call adds a separate group.
     *
     * @param componentClasses the component classes (at least one required)
     * @return this builder for chaining
     */
    IQueryBuilder any(Class<?>... componentClasses);

    /**
     * Build an immutable query from this builder's configuration.
     * This builder can continue to be used after calling build().
     *
     * @return an immutable query instance
     */
    IQuery build();
}
