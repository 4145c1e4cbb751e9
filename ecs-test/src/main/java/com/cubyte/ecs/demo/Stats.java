package com.cubyte.ecs.demo;

/**
 * Attributes shared by stat-modifying components.
 */
public abstract class Stats {
    public int strength;
    public int agility;
}
