package com.cubyte.ecs.benchmark;

import com.cubyte.ecs.core.World;
import com.cubyte.ecs.core.data.Package;
import com.cubyte.ecs.core.entity.Entity;
import com.cubyte.ecs.core.query.Query;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

/**
 * Microbenchmarks of the world's hot paths:
 * - entity creation with components, followed by destruction
 * - single component add/remove on live entities
 * - query iteration over a partially matching population
 * - pack/unpack of one entity
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Fork(value = 1, jvmArgs = {"-Xms1G", "-Xmx1G"})
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class WorldBenchmark {

    @State(Scope.Thread)
    public static class Populated {
        @Param({"1000", "10000"})
        public int entityCount;

        public World world;
        public Entity[] entities;

        @Setup(Level.Trial)
        public void setup() {
            world = new World(entityCount);
            world.registerComponent(Pos.class);
            world.registerComponent(Tag.class);
            entities = new Entity[entityCount];
            for (int i = 0; i < entityCount; i++) {
                // every other entity is tagged
                entities[i] = i % 2 == 0
                        ? world.create(new Pos(i, i), new Tag())
                        : world.create(new Pos(i, -i));
            }
        }

        @TearDown(Level.Trial)
        public void tearDown() {
            world.close();
        }
    }

    @Benchmark
    public void createAndDestroy(Populated state, Blackhole bh) {
        Entity e = state.world.create(new Pos(1, 2), new Tag());
        bh.consume(e);
        state.world.destroy(e);
    }

    @Benchmark
    public void addRemoveTag(Populated state) {
        Entity e = state.entities[1];
        state.world.add(e, new Tag());
        state.world.remove(e, Tag.class);
    }

    @Benchmark
    public float queryTagged(Populated state) {
        float sum = 0;
        for (Query.Match match : state.world.query(Pos.class, Tag.class)) {
            sum += match.get(Pos.class).x();
        }
        return sum;
    }

    @Benchmark
    public int queryCount(Populated state) {
        return state.world.query().with(Pos.class).without(Tag.class).build().count();
    }

    @Benchmark
    public boolean packUnpack(Populated state) {
        Entity e = state.entities[0];
        Package pkg = state.world.pack(e);
        return state.world.unpack(e, pkg);
    }
}
