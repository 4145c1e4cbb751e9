package com.cubyte.ecs.demo;

/**
 * Global resource shared by the demo systems.
 */
public class GameTime {
    public float deltaTime;
    public long frame;

    public GameTime(float deltaTime) {
        this.deltaTime = deltaTime;
    }
}
