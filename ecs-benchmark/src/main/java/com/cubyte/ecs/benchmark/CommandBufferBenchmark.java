package com.cubyte.ecs.benchmark;

import com.cubyte.ecs.core.World;
import com.cubyte.ecs.core.command.CommandBuffer;
import com.cubyte.ecs.core.entity.Entity;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.TimeUnit;

/**
 * Direct structural changes vs the same changes recorded in a command buffer and committed once.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 1, jvmArgs = {"-Xms1G", "-Xmx1G"})
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class CommandBufferBenchmark {

    @State(Scope.Thread)
    public static class MutateState {
        @Param({"1000", "10000"})
        public int entityCount;

        public World world;
        public Entity[] entities;

        @Setup(Level.Invocation)
        public void setup() {
            world = new World(entityCount);
            world.registerComponent(Pos.class);
            world.registerComponent(Tag.class);
            entities = new Entity[entityCount];
            for (int i = 0; i < entityCount; i++) {
                entities[i] = world.create(new Pos(i, i));
            }
        }

        @TearDown(Level.Invocation)
        public void tearDown() {
            world.close();
        }
    }

    @Benchmark
    public void direct(MutateState state) {
        for (Entity e : state.entities) {
            state.world.add(e, new Tag());
        }
    }

    @Benchmark
    public int buffered(MutateState state) {
        try (CommandBuffer commands = state.world.commands()) {
            for (Entity e : state.entities) {
                commands.add(e, new Tag());
            }
            return commands.commit();
        }
    }
}
