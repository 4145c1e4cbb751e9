package com.cubyte.ecs.core.reflection;

import com.cubyte.ecs.core.Fixtures.Health;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConstructibleTrait")
public class ConstructibleTraitTest {

    @Test
    @DisplayName("Alignment must be a positive power of two")
    void rejectsBadAlignment() {
        assertThrows(IllegalArgumentException.class,
                () -> new ConstructibleTrait<>(Health.class, 8, 3, ConstructibleTrait.noDestructor()));
        assertThrows(IllegalArgumentException.class,
                () -> new ConstructibleTrait<>(Health.class, 8, 0, ConstructibleTrait.noDestructor()));
        assertDoesNotThrow(() -> new ConstructibleTrait<>(Health.class, 8, 16, ConstructibleTrait.noDestructor()));
    }

    @Test
    @DisplayName("A destructor is mandatory")
    void rejectsNullDestructor() {
        assertThrows(IllegalArgumentException.class, () -> new ConstructibleTrait<>(Health.class, 8, 4, null));
    }

    @Test
    @DisplayName("Each constructor kind can only be set once")
    void constructorsSetOnce() {
        ConstructibleTrait<Health> trait = new ConstructibleTrait<>(Health.class, 8, 4, ConstructibleTrait.noDestructor())
                .withDefaultConstructor(Health::new)
                .withCopyConstructor(Health::new)
                .withMoveConstructor(h -> h);

        assertThrows(IllegalStateException.class, () -> trait.withDefaultConstructor(Health::new));
        assertThrows(IllegalStateException.class, () -> trait.withCopyConstructor(Health::new));
        assertThrows(IllegalStateException.class, () -> trait.withMoveConstructor(h -> h));
    }

    @Test
    @DisplayName("Missing constructors report absence instead of failing")
    void absentConstructorsAreEmpty() {
        ConstructibleTrait<Health> trait = new ConstructibleTrait<>(Health.class, 8, 4, ConstructibleTrait.noDestructor());

        assertAll(
                () -> assertFalse(trait.hasDefaultConstructor()),
                () -> assertTrue(trait.defaultConstruct().isEmpty()),
                () -> assertTrue(trait.copyConstruct(new Health(1, 2)).isEmpty()),
                () -> assertTrue(trait.moveConstruct(new Health(1, 2)).isEmpty())
        );
    }

    @Test
    @DisplayName("Constructors and destructor are invoked")
    void invokesConstructorsAndDestructor() {
        List<Health> destroyed = new ArrayList<>();
        ConstructibleTrait<Health> trait = new ConstructibleTrait<>(Health.class, 8, 4, destroyed::add)
                .withDefaultConstructor(() -> new Health(10, 10))
                .withCopyConstructor(Health::new);

        Health original = trait.defaultConstruct().orElseThrow();
        Health copy = trait.copyConstruct(original).orElseThrow();
        trait.destruct(copy);

        assertAll(
                () -> assertEquals(10, original.current),
                () -> assertNotSame(original, copy),
                () -> assertEquals(original.max, copy.max),
                () -> assertEquals(List.of(copy), destroyed)
        );
    }

    @Test
    @DisplayName("A registered trait is immutable")
    void frozenAfterRegistration() {
        ConstructibleTrait<Health> trait = new ConstructibleTrait<>(Health.class, 8, 4, ConstructibleTrait.noDestructor());
        new TypeRegistry().register(Health.class, trait);

        assertTrue(trait.isFrozen());
        assertThrows(IllegalStateException.class, () -> trait.withDefaultConstructor(Health::new));
    }
}
