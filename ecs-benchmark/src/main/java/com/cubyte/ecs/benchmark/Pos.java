package com.cubyte.ecs.benchmark;

public record Pos(float x, float y) {
}
