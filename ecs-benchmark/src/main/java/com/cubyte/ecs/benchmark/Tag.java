package com.cubyte.ecs.benchmark;

public record Tag() {
}
