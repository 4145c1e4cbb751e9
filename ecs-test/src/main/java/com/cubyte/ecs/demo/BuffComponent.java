package com.cubyte.ecs.demo;

import com.cubyte.ecs.core.component.Component;

/**
 * Timed stat bonus. Has no copy constructor, so copies are made field by field.
 */
@Component.Layout(Component.LayoutType.PADDING)
public class BuffComponent extends Stats implements Component {
    public float duration;

    public BuffComponent() {}

    public BuffComponent(int strength, int agility, float duration) {
        this.strength = strength;
        this.agility = agility;
        this.duration = duration;
    }

    @Override
    public String toString() {
        return "Buff(str=" + strength + ", agi=" + agility + ", " + duration + "s)";
    }
}
