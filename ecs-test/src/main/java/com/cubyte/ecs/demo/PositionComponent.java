package com.cubyte.ecs.demo;

import com.cubyte.ecs.core.component.Component;

/**
 * Position in world space, aligned fields.
 */
@Component.Layout(Component.LayoutType.PADDING)
public class PositionComponent implements Component {
    @Component.Field
    public float x;
    @Component.Field
    public float y;

    public PositionComponent() {}

    public PositionComponent(float x, float y) {
        this.x = x;
        this.y = y;
    }

    public PositionComponent(PositionComponent other) {
        this(other.x, other.y);
    }

    @Override
    public String toString() {
        return "Position(" + x + ", " + y + ")";
    }
}
