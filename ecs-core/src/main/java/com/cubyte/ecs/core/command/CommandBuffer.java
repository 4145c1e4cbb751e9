package com.cubyte.ecs.core.command;

import com.cubyte.ecs.core.World;
import com.cubyte.ecs.core.entity.Entity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Records structural changes for later playback against a {@link World}.
 * <p>
 * Entities created through the buffer are reserved right away as tag-only entities so their handles
 * can be stored in other components before the commit; their components are only added on
 * {@link #commit()}. {@link #abort()} (and {@link #close()} on uncommitted work) destroys the reserved
 * entities and drops every pending command.
 * <p>
 * Not thread-safe. Commands replay in recording order.
 */
public final class CommandBuffer implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(CommandBuffer.class);

    private final World world;
    private final List<Command> commands = new ArrayList<>();
    private final List<Entity> reserved = new ArrayList<>();

    public CommandBuffer(World world) {
        this.world = world;
    }

    /**
     * Reserve a new entity and defer adding the given components to it.
     */
    public EntityBuilder create(Object... components) {
        Entity entity = world.create();
        reserved.add(entity);
        List<Object> pending = new ArrayList<>(Arrays.asList(components));
        commands.add(w -> w.add(entity, pending.toArray()));
        return new EntityBuilder(entity, pending);
    }

    public CommandBuffer add(Entity entity, Object... components) {
        Object[] copy = components.clone();
        commands.add(w -> w.add(entity, copy));
        return this;
    }

    public CommandBuffer remove(Entity entity, Class<?>... componentClasses) {
        Class<?>[] copy = componentClasses.clone();
        commands.add(w -> w.remove(entity, copy));
        return this;
    }

    public CommandBuffer destroy(Entity entity) {
        commands.add(w -> {
            if (!w.isAlive(entity)) {
                return false;
            }
            w.destroy(entity);
            return true;
        });
        return this;
    }

    /**
     * Number of recorded commands not yet committed.
     */
    public int size() {
        return commands.size();
    }

    /**
     * Replay every recorded command against the world and clear the buffer.
     *
     * @return the number of commands that applied successfully
     */
    public int commit() {
        int applied = 0;
        for (Command command : commands) {
            if (command.apply(world)) {
                applied++;
            }
        }
        log.debug("Committed {} of {} commands", applied, commands.size());
        commands.clear();
        reserved.clear();
        return applied;
    }

    /**
     * Drop every recorded command and destroy the entities reserved by {@link #create(Object...)}.
     */
    public void abort() {
        for (Entity entity : reserved) {
            if (world.isAlive(entity)) {
                world.destroy(entity);
            }
        }
        log.debug("Aborted {} commands, released {} reserved entities", commands.size(), reserved.size());
        commands.clear();
        reserved.clear();
    }

    @Override
    public void close() {
        if (!commands.isEmpty() || !reserved.isEmpty()) {
            abort();
        }
    }

    @FunctionalInterface
    private interface Command {
        boolean apply(World world);
    }

    /**
     * Handle to an entity reserved by a {@link CommandBuffer}.
     */
    public static final class EntityBuilder {
        private final Entity entity;
        private final List<Object> pending;

        private EntityBuilder(Entity entity, List<Object> pending) {
            this.entity = entity;
            this.pending = pending;
        }

        /**
         * Defer one more component for the reserved entity.
         */
        public EntityBuilder add(Object component) {
            pending.add(component);
            return this;
        }

        public Entity entity() {
            return entity;
        }
    }
}
