package com.cubyte.ecs.demo;

import com.cubyte.ecs.core.component.Component;

/**
 * Team membership, packed under the name "Team".
 */
@Component.Name("Team")
@Component.Layout
public record TeamComponent(@Component.Field int teamId, @Component.Field boolean leader) implements Component {
}
