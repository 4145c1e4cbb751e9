package com.cubyte.ecs.core;

import com.cubyte.ecs.core.api.IWorld;
import com.cubyte.ecs.core.command.CommandBuffer;
import com.cubyte.ecs.core.component.ComponentManager;
import com.cubyte.ecs.core.component.ComponentMask;
import com.cubyte.ecs.core.data.PackContext;
import com.cubyte.ecs.core.data.Package;
import com.cubyte.ecs.core.data.PackageException;
import com.cubyte.ecs.core.data.Packer;
import com.cubyte.ecs.core.entity.Entity;
import com.cubyte.ecs.core.entity.EntityManager;
import com.cubyte.ecs.core.query.Query;
import com.cubyte.ecs.core.query.QueryBuilder;
import com.cubyte.ecs.core.reflection.TypeDescriptor;
import com.cubyte.ecs.core.reflection.TypeRegistry;
import com.cubyte.ecs.core.resource.ReadResource;
import com.cubyte.ecs.core.resource.ResourceManager;
import com.cubyte.ecs.core.resource.WriteResource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * World - the data store tying entities, components and resources together.
 * <p>
 * Owns one {@link TypeRegistry}, {@link ComponentManager}, {@link EntityManager} and {@link ResourceManager}.
 * Each entity's component mask is kept in step with the component storages: every structural operation
 * validates all of its inputs before touching either.
 * <p>
 * Structural operations are unsafe during concurrent reads or writes; only resources may be shared
 * across threads, through {@link #read(Class)} and {@link #write(Class)}.
 */
public final class World implements IWorld {
    private static final Logger log = LogManager.getLogger(World.class);

    public static final int DEFAULT_INITIAL_CAPACITY = 1024;

    private final TypeRegistry typeRegistry;
    private final ComponentManager componentManager;
    private final EntityManager entityManager;
    private final ResourceManager resourceManager;
    private final Packer packer;
    private boolean closed;

    public World() {
        this(DEFAULT_INITIAL_CAPACITY);
    }

    public World(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive: " + initialCapacity);
        }
        this.typeRegistry = new TypeRegistry();
        this.componentManager = new ComponentManager(typeRegistry, initialCapacity);
        this.entityManager = new EntityManager(initialCapacity);
        this.resourceManager = new ResourceManager(typeRegistry);
        this.packer = new Packer(typeRegistry);
    }

    // ---------------------------------------------------------------------
    // Registration and resources
    // ---------------------------------------------------------------------

    @Override
    public <T> int registerComponent(Class<T> componentClass) {
        return componentManager.registerComponent(componentClass);
    }

    @Override
    public <T> boolean registerResource(Class<T> type, T instance) {
        return resourceManager.add(type, instance);
    }

    @Override
    public <T> boolean registerResourceFactory(Class<T> type, Supplier<? extends T> factory) {
        return resourceManager.addFactory(type, factory);
    }

    @Override
    public <T> ReadResource<T> read(Class<T> type) {
        return resourceManager.read(type);
    }

    @Override
    public <T> WriteResource<T> write(Class<T> type) {
        return resourceManager.write(type);
    }

    // ---------------------------------------------------------------------
    // Entities and components
    // ---------------------------------------------------------------------

    @Override
    public Entity create(Object... components) {
        int[] typeIds = resolveValues(components);
        if (typeIds == null) {
            return Entity.NULL;
        }
        ComponentMask mask = ComponentMask.of(typeIds);
        Entity entity = entityManager.create(mask);
        for (int i = 0; i < components.length; i++) {
            componentManager.add(entity.index(), typeIds[i], components[i]);
        }
        if (log.isDebugEnabled()) {
            log.debug("Created entity {} with components {}", entity, describe(mask));
        }
        return entity;
    }

    @Override
    public void destroy(Entity entity) {
        if (!entityManager.isAlive(entity)) {
            log.error("Entity {} doesn't exist!", entity);
            return;
        }
        for (int typeId : entityManager.getMask(entity).toComponentIdArray()) {
            componentManager.remove(entity.index(), typeId);
        }
        entityManager.destroy(entity);
        log.debug("Destroyed entity {}", entity);
    }

    @Override
    public boolean isAlive(Entity entity) {
        return entityManager.isAlive(entity);
    }

    @Override
    public boolean add(Entity entity, Object... components) {
        if (!entityManager.isAlive(entity)) {
            log.error("Entity {} doesn't exist!", entity);
            return false;
        }
        int[] typeIds = resolveValues(components);
        if (typeIds == null) {
            return false;
        }
        ComponentMask mask = entityManager.getMask(entity);
        try {
            for (int i = 0; i < components.length; i++) {
                componentManager.add(entity.index(), typeIds[i], components[i]);
                mask = mask.set(typeIds[i]);
            }
        } finally {
            entityManager.setMask(entity, mask);
        }
        log.debug("Added components {} to entity {}", typeIds, entity);
        return true;
    }

    @Override
    public boolean remove(Entity entity, Class<?>... componentClasses) {
        if (!entityManager.isAlive(entity)) {
            log.error("Entity {} doesn't exist!", entity);
            return false;
        }
        int[] typeIds = resolveTypes(componentClasses);
        if (typeIds == null) {
            return false;
        }
        ComponentMask mask = entityManager.getMask(entity);
        try {
            for (int typeId : typeIds) {
                componentManager.remove(entity.index(), typeId);
                mask = mask.clear(typeId);
            }
        } finally {
            entityManager.setMask(entity, mask);
        }
        log.debug("Removed components {} from entity {}", typeIds, entity);
        return true;
    }

    @Override
    public <T> boolean has(Entity entity, Class<T> componentClass) {
        if (!entityManager.isAlive(entity)) {
            log.error("Entity {} doesn't exist!", entity);
            return false;
        }
        Integer typeId = componentManager.getTypeId(componentClass);
        if (typeId == null) {
            log.error("Component {} isn't registered", componentClass.getName());
            return false;
        }
        return entityManager.getMask(entity).has(typeId);
    }

    @Override
    public <T> T get(Entity entity, Class<T> componentClass) {
        if (!entityManager.isAlive(entity)) {
            log.error("Entity {} doesn't exist!", entity);
            return null;
        }
        Integer typeId = componentManager.getTypeId(componentClass);
        if (typeId == null) {
            log.error("Component {} isn't registered", componentClass.getName());
            return null;
        }
        if (!entityManager.getMask(entity).has(typeId)) {
            log.error("Entity {} has no {} component", entity, componentClass.getSimpleName());
            return null;
        }
        return componentClass.cast(componentManager.get(entity.index(), typeId));
    }

    // ---------------------------------------------------------------------
    // Serialization
    // ---------------------------------------------------------------------

    @Override
    public Package pack(Entity entity) {
        return pack(entity, PackContext.defaults());
    }

    /**
     * Pack every component of an entity into an object keyed by component name, in type id order.
     *
     * @return the package, or {@link Package#none()} if the entity is dead or a component cannot be packed
     */
    @Override
    public Package pack(Entity entity, PackContext context) {
        if (!entityManager.isAlive(entity)) {
            log.error("Entity {} doesn't exist!", entity);
            return Package.none();
        }
        Package.ObjectBuilder builder = Package.objectBuilder();
        for (int typeId : entityManager.getMask(entity).toComponentIdArray()) {
            TypeDescriptor<?> descriptor = componentManager.getDescriptor(typeId);
            try {
                builder.put(descriptor.name(), packComponent(descriptor, componentManager.get(entity.index(), typeId), context));
            } catch (PackageException e) {
                log.error("Could not pack component '{}' of entity {}: {}", descriptor.name(), entity, e.getMessage());
                return Package.none();
            }
        }
        return builder.build();
    }

    @Override
    public boolean unpack(Entity entity, Package pkg) {
        return unpack(entity, pkg, PackContext.defaults());
    }

    /**
     * Replace every component of an entity with the ones described by the package.
     * Existing components are removed first; on failure the entity is left without components.
     */
    @Override
    public boolean unpack(Entity entity, Package pkg, PackContext context) {
        if (!entityManager.isAlive(entity)) {
            log.error("Entity {} doesn't exist!", entity);
            return false;
        }
        for (int typeId : entityManager.getMask(entity).toComponentIdArray()) {
            componentManager.remove(entity.index(), typeId);
        }
        entityManager.setMask(entity, ComponentMask.EMPTY);

        if (pkg.kind() != Package.Kind.OBJECT) {
            log.error("Could not unpack entity {}: expected an object package, got {}", entity, pkg.kind());
            return false;
        }

        int count = pkg.size();
        int[] typeIds = new int[count];
        Object[] values = new Object[count];
        int i = 0;
        for (Map.Entry<String, Package> field : pkg.fields().entrySet()) {
            Integer typeId = componentManager.findByName(field.getKey());
            if (typeId == null) {
                log.error("Could not unpack entity {}: unknown component '{}'", entity, field.getKey());
                return false;
            }
            TypeDescriptor<?> descriptor = componentManager.getDescriptor(typeId);
            try {
                values[i] = packer.unpack(descriptor, field.getValue(), context);
            } catch (PackageException e) {
                log.error("Could not unpack component '{}' of entity {}: {}", field.getKey(), entity, e.getMessage());
                return false;
            }
            typeIds[i++] = typeId;
        }

        ComponentMask mask = ComponentMask.EMPTY;
        try {
            for (int k = 0; k < count; k++) {
                componentManager.add(entity.index(), typeIds[k], values[k]);
                mask = mask.set(typeIds[k]);
            }
        } finally {
            entityManager.setMask(entity, mask);
        }
        return true;
    }

    private <T> Package packComponent(TypeDescriptor<T> descriptor, Object value, PackContext context) {
        return packer.pack(descriptor, descriptor.type().cast(value), context);
    }

    // ---------------------------------------------------------------------
    // Queries and iteration
    // ---------------------------------------------------------------------

    @Override
    public QueryBuilder query() {
        return new QueryBuilder(entityManager, componentManager);
    }

    @Override
    public Query query(Class<?>... componentClasses) {
        QueryBuilder builder = query();
        for (Class<?> componentClass : componentClasses) {
            builder.with(componentClass);
        }
        return builder.build();
    }

    @Override
    public CommandBuffer commands() {
        return new CommandBuffer(this);
    }

    /**
     * Live entities in index order, including entities without components.
     */
    @Override
    public Iterator<Entity> iterator() {
        return entityManager.iterator();
    }

    @Override
    public int entityCount() {
        return entityManager.size();
    }

    @Override
    public Integer componentTypeId(Class<?> componentClass) {
        return componentManager.getTypeId(componentClass);
    }

    public TypeRegistry getTypeRegistry() {
        return typeRegistry;
    }

    public ComponentManager getComponentManager() {
        return componentManager;
    }

    public EntityManager getEntityManager() {
        return entityManager;
    }

    public ResourceManager getResourceManager() {
        return resourceManager;
    }

    /**
     * Destruct every component and resource. Resources are released under their write locks.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        componentManager.clear();
        resourceManager.clear();
        log.debug("World closed with {} live entities", entityManager.size());
    }

    // Type ids of the component values, or null (after logging) if one cannot be stored
    private int[] resolveValues(Object[] components) {
        int[] typeIds = new int[components.length];
        for (int i = 0; i < components.length; i++) {
            Object component = components[i];
            if (component == null) {
                log.error("Cannot store a null component");
                return null;
            }
            Integer typeId = componentManager.getTypeId(component.getClass());
            if (typeId == null) {
                log.error("Component {} isn't registered", component.getClass().getName());
                return null;
            }
            typeIds[i] = typeId;
        }
        return typeIds;
    }

    private int[] resolveTypes(Class<?>[] componentClasses) {
        int[] typeIds = new int[componentClasses.length];
        for (int i = 0; i < componentClasses.length; i++) {
            Integer typeId = componentManager.getTypeId(componentClasses[i]);
            if (typeId == null) {
                log.error("Component {} isn't registered", componentClasses[i].getName());
                return null;
            }
            typeIds[i] = typeId;
        }
        return typeIds;
    }

    private List<String> describe(ComponentMask mask) {
        List<String> names = new ArrayList<>(mask.cardinality());
        for (int typeId : mask.toComponentIdArray()) {
            names.add(componentManager.getDescriptor(typeId).name());
        }
        return names;
    }
}
