package com.cubyte.ecs.demo;

import com.cubyte.ecs.core.World;
import com.cubyte.ecs.core.api.IQuery;
import com.cubyte.ecs.core.resource.ReadResource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Moves every entity that has both a position and a velocity.
 */
class MovementSystem {
    private static final Logger log = LogManager.getLogger(MovementSystem.class);

    private final World world;
    private final IQuery movingEntities;

    MovementSystem(World world) {
        this.world = world;
        this.movingEntities = world.query(PositionComponent.class, VelocityComponent.class);
    }

    void onUpdate() {
        float dt;
        try (ReadResource<GameTime> time = world.read(GameTime.class)) {
            dt = time.get().deltaTime;
        }
        movingEntities.forEach(PositionComponent.class, VelocityComponent.class, (entity, position, velocity) -> {
            position.x += velocity.vx * dt;
            position.y += velocity.vy * dt;
            log.trace("Moved {} to {}", entity, position);
        });
    }
}
