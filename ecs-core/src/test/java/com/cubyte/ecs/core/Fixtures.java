package com.cubyte.ecs.core;

import com.cubyte.ecs.core.component.Component;
import com.cubyte.ecs.core.entity.Entity;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Component and resource types shared by the core tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public record Position(float x, float y, float z) {
    }

    public record Velocity(float x, float y, float z) {
    }

    public record Frozen() {
    }

    public enum Team {
        RED,
        BLUE
    }

    @Component.Name("Target")
    public record TargetRef(Entity target, String label, Team team) {
    }

    public record Transform(Position position, Velocity velocity, double scale) {
    }

    public record Unregistered(int value) {
    }

    public static final class Health {
        public int current;
        public int max;

        public Health() {
        }

        public Health(int current, int max) {
            this.current = current;
            this.max = max;
        }

        public Health(Health other) {
            this(other.current, other.max);
        }
    }

    /**
     * Counts how many of its instances were closed.
     */
    public static final class Handle implements AutoCloseable {
        public static final AtomicInteger CLOSED = new AtomicInteger();

        public int id;

        public Handle() {
        }

        public Handle(int id) {
            this.id = id;
        }

        @Override
        public void close() {
            CLOSED.incrementAndGet();
        }
    }

    public static final class Clock {
        public double elapsed;

        public Clock() {
        }

        public Clock(double elapsed) {
            this.elapsed = elapsed;
        }
    }
}
