package com.cubyte.ecs.demo;

import com.cubyte.ecs.ECS;
import com.cubyte.ecs.core.World;
import com.cubyte.ecs.core.reflection.ConstructibleTrait;
import com.cubyte.ecs.core.reflection.TypeDescriptor;
import com.cubyte.ecs.generated.GeneratedComponents;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Generated component metadata")
public class GeneratedComponentsTest {

    @Test
    @DisplayName("Builder registers every processed component")
    void autoRegistration() {
        try (ECS ecs = ECS.builder().build()) {
            World world = ecs.getWorld();

            assertTrue(ecs.getConfig().autoRegisterComponents());
            assertAll(
                    () -> assertNotNull(world.componentTypeId(HealthComponent.class)),
                    () -> assertNotNull(world.componentTypeId(PositionComponent.class)),
                    () -> assertNotNull(world.componentTypeId(VelocityComponent.class)),
                    () -> assertNotNull(world.componentTypeId(TeamComponent.class)),
                    () -> assertNotNull(world.componentTypeId(SpawnPoint.class)),
                    () -> assertNotNull(world.componentTypeId(BuffComponent.class)),
                    () -> assertEquals(6, world.getComponentManager().getComponentCount())
            );
        }
    }

    @Test
    @DisplayName("Manual registrations keep their ids and are not registered twice")
    void manualRegistrationFirst() {
        try (ECS ecs = ECS.builder()
                .registerComponent(VelocityComponent.class)
                .registerComponent(TeamComponent.class)
                .build()) {
            World world = ecs.getWorld();

            assertEquals(Integer.valueOf(0), world.componentTypeId(VelocityComponent.class));
            assertEquals(Integer.valueOf(1), world.componentTypeId(TeamComponent.class));
            GeneratedComponents.registerAll(world);
            assertEquals(6, world.getComponentManager().getComponentCount());
        }
    }

    @Test
    @DisplayName("Registered descriptors use the generated traits")
    void generatedTraitsAreUsed() {
        try (ECS ecs = ECS.builder().build()) {
            World world = ecs.getWorld();

            assertSame(HealthComponentMeta.TRAIT, world.getTypeRegistry().get(HealthComponent.class).trait());
            assertSame(TeamComponentMeta.TRAIT, world.getTypeRegistry().get(TeamComponent.class).trait());
            assertEquals("Team", world.getTypeRegistry().get(TeamComponent.class).name());
        }
    }

    @Test
    @DisplayName("Generated layouts")
    void layouts() {
        assertAll(
                () -> assertEquals(32L, HealthComponentMeta.SIZE),
                () -> assertEquals(8, HealthComponentMeta.ALIGNMENT),
                () -> assertEquals(16L, HealthComponentMeta.OFFSET_LASTDAMAGETIME),
                () -> assertEquals(24L, HealthComponentMeta.OFFSET_ARMOR),
                () -> assertEquals(8L, PositionComponentMeta.SIZE),
                () -> assertEquals(4, PositionComponentMeta.ALIGNMENT),
                () -> assertEquals(4L, VelocityComponentMeta.OFFSET_VY),
                () -> assertEquals("Team", TeamComponentMeta.NAME),
                () -> assertEquals(5L, TeamComponentMeta.SIZE),
                () -> assertEquals(1, TeamComponentMeta.ALIGNMENT),
                () -> assertEquals(8L, SpawnPointMeta.OFFSET_OWNER),
                () -> assertEquals(16L, SpawnPointMeta.SIZE),
                () -> assertEquals(0L, BuffComponentMeta.OFFSET_STRENGTH),
                () -> assertEquals(8L, BuffComponentMeta.OFFSET_DURATION),
                () -> assertEquals(12L, BuffComponentMeta.SIZE)
        );
    }

    @Test
    @DisplayName("Generated layouts agree with reflected field offsets")
    void generatedMatchesReflection() {
        try (World world = new World()) {
            world.registerComponent(HealthComponent.class);
            world.registerComponent(SpawnPoint.class);
            TypeDescriptor<HealthComponent> health = world.getTypeRegistry().get(HealthComponent.class);
            TypeDescriptor<SpawnPoint> spawn = world.getTypeRegistry().get(SpawnPoint.class);

            assertEquals(HealthComponentMeta.OFFSET_CURRENTHEALTH, health.fields().field("currentHealth").offset());
            assertEquals(HealthComponentMeta.OFFSET_REGENERATIONRATE, health.fields().field("regenerationRate").offset());
            assertEquals(HealthComponentMeta.OFFSET_ARMOR, health.fields().field("armor").offset());
            assertEquals(SpawnPointMeta.OFFSET_POSITION, spawn.fields().field("position").offset());
            assertEquals(SpawnPointMeta.OFFSET_OWNER, spawn.fields().field("owner").offset());
        }
    }

    @Test
    @DisplayName("Generated constructors")
    void constructors() {
        ConstructibleTrait<HealthComponent> health = HealthComponentMeta.TRAIT;
        HealthComponent original = new HealthComponent(50, 2f);
        original.armor = 3;

        HealthComponent copy = health.copyConstruct(original).orElseThrow();
        assertNotSame(original, copy);
        assertEquals(50, copy.maxHealth);
        assertEquals(3, copy.armor);
        assertEquals(0, health.defaultConstruct().orElseThrow().maxHealth);

        TeamComponent team = new TeamComponent(4, true);
        assertSame(team, TeamComponentMeta.TRAIT.copyConstruct(team).orElseThrow());
        assertEquals(new TeamComponent(0, false), TeamComponentMeta.TRAIT.defaultConstruct().orElseThrow());
        assertEquals(new SpawnPoint(null, null), SpawnPointMeta.TRAIT.defaultConstruct().orElseThrow());
    }

    @Test
    @DisplayName("Generated and reflected traits both copy inherited state field by field")
    void fieldwiseCopy() {
        BuffComponent original = new BuffComponent(5, 2, 30f);

        BuffComponent generated = BuffComponentMeta.TRAIT.copyConstruct(original).orElseThrow();
        assertNotSame(original, generated);
        assertEquals(5, generated.strength);
        assertEquals(2, generated.agility);
        assertEquals(30f, generated.duration);

        try (World world = new World()) {
            world.registerComponent(BuffComponent.class);
            TypeDescriptor<BuffComponent> descriptor = world.getTypeRegistry().get(BuffComponent.class);

            assertSame(BuffComponentMeta.TRAIT, descriptor.trait());
            assertEquals(BuffComponentMeta.OFFSET_AGILITY, descriptor.fields().field("agility").offset());
            assertEquals(BuffComponentMeta.SIZE, descriptor.size());
        }
    }
}
