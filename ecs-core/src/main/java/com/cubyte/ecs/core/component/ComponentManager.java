package com.cubyte.ecs.core.component;

import com.cubyte.ecs.core.reflection.TypeDescriptor;
import com.cubyte.ecs.core.reflection.TypeRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ComponentManager - owns one {@link ComponentStorage} per registered component type.
 * <p>
 * Type ids are stable and follow first-registration order, so they double as mask bits.
 * Accessors assume the caller already checked the entity mask: absent entries fail fast.
 */
public class ComponentManager {
    private static final Logger log = LogManager.getLogger(ComponentManager.class);

    private final TypeRegistry types;
    private final int initialCapacity;
    private final ConcurrentHashMap<Class<?>, Integer> componentTypeIds = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Integer> componentTypeIdsByName = new ConcurrentHashMap<>();
    private final List<ComponentStorage<?>> storages = new ArrayList<>();

    public ComponentManager(TypeRegistry types, int initialCapacity) {
        this.types = types;
        this.initialCapacity = initialCapacity;
    }

    /**
     * Register a component type and create its storage.
     * Registering the same type again logs a warning and returns the existing id.
     *
     * @return the stable type id
     * @throws IllegalStateException if {@link ComponentMask#MAX_COMPONENTS} types are already registered,
     *                               or another component type is registered under the same name
     */
    public synchronized <T> int registerComponent(Class<T> componentClass) {
        Integer existing = componentTypeIds.get(componentClass);
        if (existing != null) {
            log.warn("Component '{}' is already registered with id {}", componentClass.getName(), existing);
            return existing;
        }
        int typeId = storages.size();
        if (typeId >= ComponentMask.MAX_COMPONENTS) {
            throw new IllegalStateException("Cannot register " + componentClass.getName()
                    + ": at most " + ComponentMask.MAX_COMPONENTS + " component types are supported");
        }
        TypeDescriptor<T> descriptor = types.register(componentClass);
        Integer sameName = componentTypeIdsByName.get(descriptor.name());
        if (sameName != null) {
            throw new IllegalStateException("Cannot register " + componentClass.getName() + ": component "
                    + getDescriptor(sameName).type().getName() + " is already registered under the name '"
                    + descriptor.name() + "'; use @Component.Name to disambiguate");
        }
        storages.add(new ComponentStorage<>(descriptor, initialCapacity));
        componentTypeIds.put(componentClass, typeId);
        componentTypeIdsByName.put(descriptor.name(), typeId);
        log.trace("Registered component '{}' with id {}", descriptor.name(), typeId);
        return typeId;
    }

    /**
     * Get component type ID, or null if the type is not registered
     */
    public Integer getTypeId(Class<?> componentClass) {
        return componentTypeIds.get(componentClass);
    }

    /**
     * Get component type ID.
     *
     * @throws IllegalArgumentException if the type is not registered
     */
    public int getId(Class<?> componentClass) {
        Integer id = componentTypeIds.get(componentClass);
        if (id == null) {
            throw new IllegalArgumentException("Component " + componentClass.getName() + " not registered");
        }
        return id;
    }

    /**
     * Find a component type id by its registered name, or null.
     */
    public Integer findByName(String name) {
        return componentTypeIdsByName.get(name);
    }

    public TypeDescriptor<?> getDescriptor(int typeId) {
        return getStorage(typeId).descriptor();
    }

    public <T> ComponentStorage<T> getStorage(Class<T> componentClass) {
        @SuppressWarnings("unchecked")
        ComponentStorage<T> storage = (ComponentStorage<T>) getStorage(getId(componentClass));
        return storage;
    }

    public ComponentStorage<?> getStorage(int typeId) {
        if (typeId < 0 || typeId >= storages.size()) {
            throw new IllegalArgumentException("Unknown component type id " + typeId);
        }
        return storages.get(typeId);
    }

    /**
     * Store a component value at the entity index, overwriting any previous value of that type.
     */
    public void add(int entityIndex, Object component) {
        add(entityIndex, getId(component.getClass()), component);
    }

    @SuppressWarnings("unchecked")
    public void add(int entityIndex, int typeId, Object component) {
        ((ComponentStorage<Object>) getStorage(typeId)).insert(entityIndex, component);
    }

    /**
     * Destruct and erase a component. Removing an absent entry is a no-op.
     */
    public boolean remove(int entityIndex, Class<?> componentClass) {
        return remove(entityIndex, getId(componentClass));
    }

    public boolean remove(int entityIndex, int typeId) {
        return getStorage(typeId).erase(entityIndex);
    }

    /**
     * Typed reference to a stored component.
     *
     * @throws IllegalStateException if no component of that type is stored for the index
     */
    public <T> T get(int entityIndex, Class<T> componentClass) {
        return getStorage(componentClass).get(entityIndex);
    }

    public Object get(int entityIndex, int typeId) {
        return getStorage(typeId).get(entityIndex);
    }

    public boolean contains(int entityIndex, int typeId) {
        return getStorage(typeId).contains(entityIndex);
    }

    public int getComponentCount() {
        return storages.size();
    }

    /**
     * Get all registered component classes, keyed by type id
     */
    public Map<Class<?>, Integer> registeredTypes() {
        return Collections.unmodifiableMap(componentTypeIds);
    }

    /**
     * Destruct every stored component. Storages stay registered.
     */
    public void clear() {
        for (ComponentStorage<?> storage : storages) {
            storage.clear();
        }
    }
}
