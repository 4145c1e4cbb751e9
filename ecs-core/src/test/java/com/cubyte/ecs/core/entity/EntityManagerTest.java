package com.cubyte.ecs.core.entity;

import com.cubyte.ecs.core.component.ComponentMask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EntityManager")
public class EntityManagerTest {

    private EntityManager entities;

    @BeforeEach
    void setUp() {
        entities = new EntityManager(4);
    }

    @Test
    @DisplayName("A reused index gets a new generation and the old handle goes stale")
    void generationStaleness() {
        Entity first = entities.create(ComponentMask.EMPTY);
        assertTrue(entities.destroy(first));

        Entity second = entities.create(ComponentMask.EMPTY);

        assertAll(
                () -> assertEquals(first.index(), second.index()),
                () -> assertNotEquals(first.generation(), second.generation()),
                () -> assertFalse(entities.isAlive(first)),
                () -> assertTrue(entities.isAlive(second)),
                () -> assertThrows(IllegalArgumentException.class, () -> entities.getMask(first))
        );
    }

    @Test
    @DisplayName("Destroying a dead entity fails without side effects")
    void doubleDestroy() {
        Entity entity = entities.create(ComponentMask.of(1));
        assertTrue(entities.destroy(entity));
        int size = entities.size();

        assertFalse(entities.destroy(entity));
        assertFalse(entities.destroy(Entity.NULL));
        assertEquals(size, entities.size());
    }

    @Test
    @DisplayName("Iteration yields live entities in index order and can be restarted")
    void iteration() {
        List<Entity> created = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            created.add(entities.create(i % 2 == 0 ? ComponentMask.EMPTY : ComponentMask.of(0)));
        }
        entities.destroy(created.get(3));
        entities.destroy(created.get(17));

        List<Entity> firstPass = new ArrayList<>();
        entities.forEach(firstPass::add);
        List<Entity> secondPass = new ArrayList<>();
        entities.forEach(secondPass::add);

        List<Entity> expected = new ArrayList<>(created);
        expected.remove(17);
        expected.remove(3);
        assertEquals(expected, firstPass);
        assertEquals(firstPass, secondPass);
        assertEquals(38, entities.size());
    }

    @Test
    @DisplayName("Masks follow setMask and reset on destroy")
    void masks() {
        Entity entity = entities.create(ComponentMask.of(2));
        entities.setMask(entity, ComponentMask.of(2, 4));

        assertEquals(ComponentMask.of(2, 4), entities.getMask(entity));
        assertEquals(entity, entities.entityAt(entity.index()));
        entities.destroy(entity);
        assertEquals(Entity.NULL, entities.entityAt(entity.index()));
    }
}
