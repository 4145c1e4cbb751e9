package com.cubyte.ecs.demo;

import com.cubyte.ecs.core.component.Component;

@Component.Layout(Component.LayoutType.PADDING)
public class VelocityComponent implements Component {
    @Component.Field
    public float vx;
    @Component.Field
    public float vy;

    public VelocityComponent() {}

    public VelocityComponent(float vx, float vy) {
        this.vx = vx;
        this.vy = vy;
    }

    public VelocityComponent(VelocityComponent other) {
        this(other.vx, other.vy);
    }

    @Override
    public String toString() {
        return "Velocity(" + vx + ", " + vy + ")";
    }
}
