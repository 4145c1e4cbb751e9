package com.cubyte.ecs.demo;

import com.cubyte.ecs.core.World;
import com.cubyte.ecs.core.api.IQuery;
import com.cubyte.ecs.core.command.CommandBuffer;
import com.cubyte.ecs.core.query.Query;
import com.cubyte.ecs.core.resource.ReadResource;

/**
 * Regenerates living entities and schedules dead ones for removal.
 */
class HealthRegenerationSystem {
    private final World world;
    private final IQuery healthyEntities;

    HealthRegenerationSystem(World world) {
        this.world = world;
        this.healthyEntities = world.query(HealthComponent.class);
    }

    /**
     * @return number of entities destroyed this frame
     */
    int onUpdate() {
        float dt;
        try (ReadResource<GameTime> time = world.read(GameTime.class)) {
            dt = time.get().deltaTime;
        }
        try (CommandBuffer commands = world.commands()) {
            for (Query.Match match : healthyEntities) {
                HealthComponent health = match.get(HealthComponent.class);
                if (health.isDead) {
                    commands.destroy(match.entity());
                } else if (health.currentHealth < health.maxHealth) {
                    int regen = Math.max(1, (int) (health.regenerationRate * dt));
                    health.currentHealth = Math.min(health.maxHealth, health.currentHealth + regen);
                }
            }
            return commands.commit();
        }
    }
}
