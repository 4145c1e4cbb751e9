package com.cubyte.ecs.core.api;

import com.cubyte.ecs.core.command.CommandBuffer;
import com.cubyte.ecs.core.data.PackContext;
import com.cubyte.ecs.core.data.Package;
import com.cubyte.ecs.core.entity.Entity;
import com.cubyte.ecs.core.resource.ReadResource;
import com.cubyte.ecs.core.resource.WriteResource;

import java.util.function.Supplier;

/**
 * Public API for the ECS world: entities, components, resources and queries.
 * <p>
 * Lookup and liveness failures never throw across this interface. They are logged and reported
 * through the return value ({@code false}, {@code null}, {@link Entity#NULL} or an invalid lock guard).
 */
public interface IWorld extends AutoCloseable, Iterable<Entity> {

    /**
     * Register a component type in the world.
     *
     * @param componentClass The component class to register.
     * @return The unique type ID assigned to this component.
     */
    <T> int registerComponent(Class<T> componentClass);

    /**
     * Register a resource with its initial value. Registering the same type twice fails.
     *
     * @return true if the resource was added
     */
    <T> boolean registerResource(Class<T> type, T instance);

    /**
     * Register a resource built by the factory. The factory does not run when the type is already registered.
     */
    <T> boolean registerResourceFactory(Class<T> type, Supplier<? extends T> factory);

    /**
     * Acquire shared access to a resource. Blocks while a writer holds it.
     */
    <T> ReadResource<T> read(Class<T> type);

    /**
     * Acquire exclusive access to a resource. Blocks while any reader or writer holds it.
     */
    <T> WriteResource<T> write(Class<T> type);

    /**
     * Create a new entity holding the given component values.
     *
     * @return the new entity, or {@link Entity#NULL} if a component type is not registered
     */
    Entity create(Object... components);

    /**
     * Destroy an entity and every component it holds.
     */
    void destroy(Entity entity);

    boolean isAlive(Entity entity);

    /**
     * Add or overwrite components on an entity.
     *
     * @return false if the entity is dead or a component type is not registered
     */
    boolean add(Entity entity, Object... components);

    /**
     * Remove components from an entity. Removing an absent component is a no-op.
     *
     * @return false if the entity is dead or a component type is not registered
     */
    boolean remove(Entity entity, Class<?>... componentClasses);

    <T> boolean has(Entity entity, Class<T> componentClass);

    /**
     * @return the component, or null if the entity is dead or does not hold it
     */
    <T> T get(Entity entity, Class<T> componentClass);

    Package pack(Entity entity);

    Package pack(Entity entity, PackContext context);

    boolean unpack(Entity entity, Package pkg);

    boolean unpack(Entity entity, Package pkg, PackContext context);

    /**
     * Create a query for filtering entities based on component requirements.
     */
    IQueryBuilder query();

    /**
     * Query requiring every given component.
     */
    IQuery query(Class<?>... componentClasses);

    /**
     * New buffer of deferred structural changes against this world.
     */
    CommandBuffer commands();

    /**
     * Get the total number of entities currently in the world.
     */
    int entityCount();

    /**
     * Get the component type ID for a registered component class.
     *
     * @return The type ID, or null if not registered.
     */
    Integer componentTypeId(Class<?> componentClass);

    /**
     * Close the world and release all associated resources.
     */
    @Override
    void close();
}
