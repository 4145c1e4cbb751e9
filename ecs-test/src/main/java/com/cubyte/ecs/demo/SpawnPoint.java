package com.cubyte.ecs.demo;

import com.cubyte.ecs.core.component.Component;
import com.cubyte.ecs.core.entity.Entity;

/**
 * Where an entity respawns, and who spawned it.
 */
@Component.Layout
public record SpawnPoint(PositionComponent position, Entity owner) implements Component {
}
