package com.cubyte.ecs.core;

import com.cubyte.ecs.core.Fixtures.Clock;
import com.cubyte.ecs.core.Fixtures.Frozen;
import com.cubyte.ecs.core.Fixtures.Handle;
import com.cubyte.ecs.core.Fixtures.Health;
import com.cubyte.ecs.core.Fixtures.Position;
import com.cubyte.ecs.core.Fixtures.Unregistered;
import com.cubyte.ecs.core.Fixtures.Velocity;
import com.cubyte.ecs.core.component.ComponentMask;
import com.cubyte.ecs.core.entity.Entity;
import com.cubyte.ecs.core.resource.ReadResource;
import com.cubyte.ecs.core.resource.WriteResource;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("World")
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class WorldTest {

    private World world;

    @BeforeEach
    void setUp() {
        world = new World(64);
        world.registerComponent(Position.class);
        world.registerComponent(Velocity.class);
        world.registerComponent(Health.class);
        world.registerComponent(Frozen.class);
    }

    @AfterEach
    void tearDown() {
        world.close();
    }

    @Test
    @Order(1)
    @DisplayName("create stores every component and sets the mask")
    void createWithComponents() {
        Entity e = world.create(new Position(1, 2, 3), new Health(10, 20));

        assertAll(
                () -> assertTrue(world.isAlive(e)),
                () -> assertTrue(world.has(e, Position.class)),
                () -> assertTrue(world.has(e, Health.class)),
                () -> assertFalse(world.has(e, Velocity.class)),
                () -> assertEquals(new Position(1, 2, 3), world.get(e, Position.class)),
                () -> assertEquals(20, world.get(e, Health.class).max),
                () -> assertEquals(1, world.entityCount())
        );
    }

    @Test
    @Order(2)
    @DisplayName("create with an unregistered component returns NULL and creates nothing")
    void createUnregistered() {
        Entity e = world.create(new Position(0, 0, 0), new Unregistered(1));

        assertTrue(e.isNull());
        assertEquals(0, world.entityCount());
        assertTrue(world.create((Object) null).isNull());
    }

    @Test
    @Order(3)
    @DisplayName("add then remove leaves the entity as before")
    void addHasRemove() {
        Entity e = world.create(new Position(0, 0, 0));

        assertTrue(world.add(e, new Velocity(1, 0, 0)));
        assertTrue(world.has(e, Velocity.class));
        assertTrue(world.remove(e, Velocity.class));
        assertFalse(world.has(e, Velocity.class));
        assertTrue(world.has(e, Position.class));
        assertNull(world.get(e, Velocity.class));

        // removing an absent component is a no-op
        assertTrue(world.remove(e, Velocity.class));
    }

    @Test
    @Order(4)
    @DisplayName("add overwrites an existing component")
    void addOverwrites() {
        Entity e = world.create(new Position(0, 0, 0));
        world.add(e, new Position(5, 5, 5));

        assertEquals(new Position(5, 5, 5), world.get(e, Position.class));
        assertEquals(1, world.getComponentManager().getStorage(Position.class).size());
    }

    @Test
    @Order(5)
    @DisplayName("Unregistered types leave the mask untouched")
    void unregisteredAddRemove() {
        Entity e = world.create(new Position(0, 0, 0));
        ComponentMask before = world.getEntityManager().getMask(e);

        assertFalse(world.add(e, new Velocity(1, 1, 1), new Unregistered(3)));
        assertFalse(world.remove(e, Position.class, Unregistered.class));

        assertAll(
                () -> assertEquals(before, world.getEntityManager().getMask(e)),
                () -> assertFalse(world.has(e, Velocity.class)),
                () -> assertTrue(world.has(e, Position.class)),
                () -> assertFalse(world.has(e, Unregistered.class))
        );
    }

    @Test
    @Order(6)
    @DisplayName("Destroying twice is harmless and stale handles see nothing")
    void doubleDestroy() {
        Entity e = world.create(new Position(0, 0, 0));
        world.destroy(e);
        int count = world.entityCount();

        world.destroy(e);

        assertAll(
                () -> assertEquals(count, world.entityCount()),
                () -> assertFalse(world.isAlive(e)),
                () -> assertFalse(world.has(e, Position.class)),
                () -> assertNull(world.get(e, Position.class)),
                () -> assertFalse(world.add(e, new Velocity(0, 0, 0))),
                () -> assertFalse(world.remove(e, Position.class))
        );
    }

    @Test
    @Order(7)
    @DisplayName("destroy purges storages so a reused index starts clean")
    void destroyPurges() {
        Entity first = world.create(new Position(1, 1, 1), new Velocity(1, 1, 1));
        world.destroy(first);
        Entity second = world.create(new Health(1, 1));

        assertAll(
                () -> assertEquals(first.index(), second.index()),
                () -> assertFalse(world.has(second, Position.class)),
                () -> assertEquals(0, world.getComponentManager().getStorage(Position.class).size()),
                () -> assertEquals(0, world.getComponentManager().getStorage(Velocity.class).size())
        );
    }

    @Test
    @Order(8)
    @DisplayName("Removed and destroyed components are destructed")
    void destructsComponents() {
        world.registerComponent(Handle.class);
        int before = Handle.CLOSED.get();
        Entity a = world.create(new Handle(1));
        Entity b = world.create(new Handle(2));
        world.create(new Handle(3));

        world.remove(a, Handle.class);
        world.destroy(b);
        world.close();

        assertEquals(before + 3, Handle.CLOSED.get());
    }

    @Test
    @Order(9)
    @DisplayName("Tag-only entities are iterated in index order")
    void iteration() {
        Entity a = world.create();
        Entity b = world.create(new Frozen());
        Entity c = world.create(new Position(0, 0, 0));
        world.destroy(b);

        List<Entity> seen = new ArrayList<>();
        for (Entity e : world) {
            seen.add(e);
        }
        assertEquals(List.of(a, c), seen);
    }

    @Test
    @Order(10)
    @DisplayName("Resources are reachable through the world")
    void resources() {
        assertTrue(world.registerResource(Clock.class, new Clock(0)));
        assertFalse(world.registerResourceFactory(Clock.class, Clock::new));
        assertTrue(world.registerResourceFactory(StringBuilder.class, () -> new StringBuilder("log")));
        try (ReadResource<StringBuilder> log = world.read(StringBuilder.class)) {
            assertEquals("log", log.get().toString());
        }

        try (WriteResource<Clock> clock = world.write(Clock.class)) {
            clock.get().elapsed = 1.5;
        }
        try (ReadResource<Clock> clock = world.read(Clock.class)) {
            assertEquals(1.5, clock.get().elapsed);
        }
        try (ReadResource<Health> missing = world.read(Health.class)) {
            assertFalse(missing.isValid());
        }
    }

    @Test
    @Order(11)
    @DisplayName("Closing twice is a no-op")
    void closeTwice() {
        world.create(new Position(0, 0, 0));
        world.close();
        assertDoesNotThrow(world::close);
    }
}
