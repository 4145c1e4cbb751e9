package com.cubyte.ecs.demo;

import com.cubyte.ecs.ECS;
import com.cubyte.ecs.core.World;
import com.cubyte.ecs.core.data.Package;
import com.cubyte.ecs.core.data.PackageJson;
import com.cubyte.ecs.core.entity.Entity;
import com.cubyte.ecs.core.query.Query;
import com.cubyte.ecs.core.resource.WriteResource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Demo of the world lifecycle: generated registration, queries, deferred commands and packing.
 */
public class WorldDemo {
    private static final Logger log = LogManager.getLogger(WorldDemo.class);

    public static void main(String[] args) {
        int frames = args.length > 0 ? Integer.parseInt(args[0]) : 10;
        try (ECS ecs = ECS.builder()
                .registerResource(GameTime.class, new GameTime(0.1f))
                .build()) {
            run(ecs.getWorld(), frames);
        }
    }

    static void run(World world, int frames) {
        log.info("Registered component types: {}", world.getComponentManager().registeredTypes().keySet());

        Entity hero = world.create(
                new PositionComponent(0, 0),
                new VelocityComponent(1.5f, -0.5f),
                new HealthComponent(100, 20f),
                new TeamComponent(1, true),
                new BuffComponent(5, 2, 30f));
        for (int i = 0; i < 5; i++) {
            world.create(new PositionComponent(i, i), new VelocityComponent(-1, 1), new TeamComponent(2, false));
        }
        Entity victim = world.create(new HealthComponent(10, 0f), new SpawnPoint(new PositionComponent(4, 2), hero));

        MovementSystem movement = new MovementSystem(world);
        HealthRegenerationSystem regeneration = new HealthRegenerationSystem(world);

        world.get(hero, HealthComponent.class).damage(35, 0);
        world.get(victim, HealthComponent.class).damage(10, 0);

        for (int frame = 0; frame < frames; frame++) {
            try (WriteResource<GameTime> time = world.write(GameTime.class)) {
                time.get().frame = frame;
            }
            movement.onUpdate();
            int destroyed = regeneration.onUpdate();
            if (destroyed > 0) {
                log.info("Frame {}: {} entities destroyed", frame, destroyed);
            }
        }

        log.info("Hero after {} frames: {} {}", frames,
                world.get(hero, PositionComponent.class), world.get(hero, HealthComponent.class));
        log.info("Victim alive: {}", world.isAlive(victim));
        long team2 = 0;
        for (Query.Match match : world.query().with(TeamComponent.class).without(HealthComponent.class).build()) {
            if (match.get(TeamComponent.class).teamId() == 2) {
                team2++;
            }
        }
        log.info("Team 2 members: {}", team2);

        Package snapshot = world.pack(hero);
        log.info("Hero package: {}", new PackageJson().toJson(snapshot));
    }
}
