package com.cubyte.ecs;

import com.cubyte.ecs.core.World;
import com.cubyte.ecs.core.entity.Entity;
import com.cubyte.ecs.core.query.Query;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * ECS - The single entry point (Facade) for the entity component store.
 * <p>
 * Wraps a configured {@link World}. Provides a Builder for fluent initialization and resource
 * management via AutoCloseable.
 */
public final class ECS implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(ECS.class);

    static final String GENERATED_COMPONENTS = "com.cubyte.ecs.generated.GeneratedComponents";

    private final World world;
    private final WorldConfig config;

    // Private constructor, use ECS.builder() instead.
    private ECS(World world, WorldConfig config) {
        this.world = world;
        this.config = config;
    }

    /**
     * Create a new Builder, starting from {@link WorldConfig#load()}.
     */
    public static Builder builder() {
        return new Builder(WorldConfig.load());
    }

    public Entity create(Object... components) {
        return world.create(components);
    }

    public Query query(Class<?>... componentClasses) {
        return world.query(componentClasses);
    }

    /**
     * Access the underlying World.
     */
    public World getWorld() {
        return world;
    }

    public WorldConfig getConfig() {
        return config;
    }

    /**
     * Closes the world, destructing every component and resource.
     */
    @Override
    public void close() {
        world.close();
    }

    // =================================================================
    // Builder Implementation
    // =================================================================

    public static class Builder {
        private WorldConfig config;
        private final List<Class<?>> components = new ArrayList<>();
        private final List<Consumer<World>> resources = new ArrayList<>();

        private Builder(WorldConfig config) {
            this.config = config;
        }

        /**
         * Replace the configuration loaded from the classpath.
         */
        public Builder config(WorldConfig config) {
            this.config = config;
            return this;
        }

        public Builder initialCapacity(int initialCapacity) {
            this.config = config.withInitialCapacity(initialCapacity);
            return this;
        }

        /**
         * Disable automatic registration of components found by the Annotation Processor.
         * Use this if you want to manually control component registration order.
         */
        public Builder noAutoRegistration() {
            this.config = config.withAutoRegisterComponents(false);
            return this;
        }

        /**
         * Manually register a component. Manual registrations are applied first, in call order.
         */
        public Builder registerComponent(Class<?> componentClass) {
            components.add(componentClass);
            return this;
        }

        public <T> Builder registerResource(Class<T> type, T instance) {
            resources.add(world -> world.registerResource(type, instance));
            return this;
        }

        /**
         * Build the World.
         * This will:
         * 1. Create the World with the configured capacity.
         * 2. Register manual components, then generated ones (if enabled).
         * 3. Register resources.
         */
        public ECS build() {
            World world = new World(config.initialCapacity());
            for (Class<?> componentClass : components) {
                world.registerComponent(componentClass);
            }
            if (config.autoRegisterComponents()) {
                registerGenerated(world);
            }
            for (Consumer<World> resource : resources) {
                resource.accept(world);
            }
            log.debug("Built world with {} component types", world.getComponentManager().getComponentCount());
            return new ECS(world, config);
        }

        private void registerGenerated(World world) {
            try {
                // The generated class may not exist yet, so it is looked up reflectively
                Class<?> generated = Class.forName(GENERATED_COMPONENTS, true, getClass().getClassLoader());
                Method registerAll = generated.getMethod("registerAll", World.class);
                registerAll.invoke(null, world);
            } catch (ClassNotFoundException e) {
                log.warn("'GeneratedComponents' class not found. Automatic component registration skipped. "
                        + "Ensure annotation processing is enabled and the project is built.");
            } catch (InvocationTargetException e) {
                throw new IllegalStateException("GeneratedComponents.registerAll failed", e.getCause());
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Failed to invoke GeneratedComponents.registerAll", e);
            }
        }
    }
}
