package com.cubyte.ecs.core.command;

import com.cubyte.ecs.core.Fixtures.Health;
import com.cubyte.ecs.core.Fixtures.Position;
import com.cubyte.ecs.core.Fixtures.Velocity;
import com.cubyte.ecs.core.World;
import com.cubyte.ecs.core.entity.Entity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CommandBuffer")
public class CommandBufferTest {

    private World world;

    @BeforeEach
    void setUp() {
        world = new World(16);
        world.registerComponent(Position.class);
        world.registerComponent(Velocity.class);
        world.registerComponent(Health.class);
    }

    @AfterEach
    void tearDown() {
        world.close();
    }

    @Test
    @DisplayName("Created entities are reserved immediately and receive components on commit")
    void createThenCommit() {
        CommandBuffer commands = world.commands();
        Entity e = commands.create(new Position(1, 2, 3)).add(new Velocity(0, 1, 0)).entity();

        assertTrue(world.isAlive(e));
        assertFalse(world.has(e, Position.class));

        assertEquals(1, commands.commit());
        assertEquals(new Position(1, 2, 3), world.get(e, Position.class));
        assertTrue(world.has(e, Velocity.class));
        assertEquals(0, commands.size());
    }

    @Test
    @DisplayName("Commands replay in recording order")
    void ordering() {
        Entity e = world.create(new Position(0, 0, 0));
        CommandBuffer commands = world.commands()
                .add(e, new Health(1, 1))
                .remove(e, Position.class)
                .add(e, new Health(2, 2));

        assertTrue(world.has(e, Position.class));
        assertEquals(3, commands.commit());
        assertFalse(world.has(e, Position.class));
        assertEquals(2, world.get(e, Health.class).current);
    }

    @Test
    @DisplayName("Failed commands are not counted")
    void failedCommands() {
        Entity e = world.create(new Position(0, 0, 0));
        CommandBuffer commands = world.commands().destroy(e).destroy(e).add(e, new Health(1, 1));

        assertEquals(1, commands.commit());
        assertFalse(world.isAlive(e));
    }

    @Test
    @DisplayName("abort and close release reserved entities and drop commands")
    void abortAndClose() {
        Entity existing = world.create(new Position(0, 0, 0));
        Entity reserved;
        try (CommandBuffer commands = world.commands()) {
            reserved = commands.create(new Health(1, 1)).entity();
            commands.destroy(existing);
        }

        assertFalse(world.isAlive(reserved));
        assertTrue(world.isAlive(existing));

        CommandBuffer commands = world.commands();
        Entity other = commands.create().entity();
        commands.abort();
        assertFalse(world.isAlive(other));
        assertEquals(0, commands.commit());
    }
}
