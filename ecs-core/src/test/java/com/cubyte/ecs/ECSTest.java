package com.cubyte.ecs;

import com.cubyte.ecs.core.Fixtures.Clock;
import com.cubyte.ecs.core.Fixtures.Position;
import com.cubyte.ecs.core.Fixtures.Velocity;
import com.cubyte.ecs.core.entity.Entity;
import com.cubyte.ecs.core.resource.ReadResource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ECS builder")
public class ECSTest {

    @Test
    @DisplayName("Builder registers components and resources in call order")
    void builder() {
        try (ECS ecs = ECS.builder()
                .initialCapacity(8)
                .registerComponent(Position.class)
                .registerComponent(Velocity.class)
                .registerResource(Clock.class, new Clock(3))
                .build()) {

            assertAll(
                    () -> assertEquals(8, ecs.getConfig().initialCapacity()),
                    () -> assertEquals(Integer.valueOf(0), ecs.getWorld().componentTypeId(Position.class)),
                    () -> assertEquals(Integer.valueOf(1), ecs.getWorld().componentTypeId(Velocity.class))
            );
            Entity e = ecs.create(new Position(0, 0, 0), new Velocity(1, 1, 1));
            assertEquals(1, ecs.query(Position.class, Velocity.class).count());
            assertTrue(ecs.getWorld().isAlive(e));
            try (ReadResource<Clock> clock = ecs.getWorld().read(Clock.class)) {
                assertEquals(3.0, clock.get().elapsed);
            }
        }
    }

    @Test
    @DisplayName("A missing generated registry does not prevent building")
    void missingGeneratedRegistry() {
        WorldConfig config = WorldConfig.defaults().withAutoRegisterComponents(true);

        try (ECS ecs = ECS.builder().config(config).build()) {
            assertEquals(0, ecs.getWorld().getComponentManager().getComponentCount());
        }
    }
}
