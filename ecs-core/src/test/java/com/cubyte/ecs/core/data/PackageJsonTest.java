package com.cubyte.ecs.core.data;

import com.cubyte.ecs.core.Fixtures.Position;
import com.cubyte.ecs.core.World;
import com.cubyte.ecs.core.entity.Entity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Package JSON encoding")
public class PackageJsonTest {

    private final PackageJson json = new PackageJson();

    private static Package sample() {
        return Package.objectBuilder()
                .put("Position", Package.objectBuilder()
                        .put("x", Package.of(1.5))
                        .put("y", Package.of(-2L))
                        .build())
                .put("Name", Package.objectBuilder()
                        .put("value", Package.of("hero"))
                        .put("alias", Package.none())
                        .put("active", Package.of(true))
                        .build())
                .put("Path", Package.array(List.of(Package.of(1), Package.of(2), Package.of(3))))
                .build();
    }

    @Test
    @DisplayName("JSON text round trips to an equal package")
    void textRoundTrip() {
        Package pkg = sample();
        String text = json.toJson(pkg);

        assertEquals(pkg, json.fromJson(text));
        assertTrue(text.startsWith("{\"Position\""), "field order is kept: " + text);
    }

    @Test
    @DisplayName("Streams round trip to an equal package")
    void streamRoundTrip() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        json.write(sample(), out);

        Package read = json.read(new ByteArrayInputStream(out.toByteArray()));
        assertEquals(sample(), read);
    }

    @Test
    @DisplayName("Integral numbers read as integers, others as doubles")
    void numbers() {
        Package pkg = json.fromJson("{\"a\": 3, \"b\": 3.25, \"c\": null}");

        assertAll(
                () -> assertEquals(3L, pkg.field("a").asLong()),
                () -> assertEquals(3.25, pkg.field("b").asDouble()),
                () -> assertTrue(pkg.field("c").isNone()),
                () -> assertThrows(PackageException.class, () -> pkg.field("b").asLong())
        );
    }

    @Test
    @DisplayName("Malformed JSON raises PackageException")
    void malformed() {
        assertThrows(PackageException.class, () -> json.fromJson("{\"a\": "));
        assertThrows(PackageException.class,
                () -> json.read(new ByteArrayInputStream("[1, 2".getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    @DisplayName("Typed accessors reject the wrong kind")
    void kindMismatch() {
        Package pkg = sample();

        assertAll(
                () -> assertThrows(PackageException.class, () -> pkg.asLong()),
                () -> assertThrows(PackageException.class, () -> pkg.field("Path").fields()),
                () -> assertThrows(PackageException.class, () -> pkg.field("Missing")),
                () -> assertEquals(3, pkg.field("Path").elements().size())
        );
    }

    @Test
    @DisplayName("NaN and infinities survive the JSON round trip")
    void nonFiniteNumbers() {
        Package pkg = Package.objectBuilder()
                .put("nan", Package.of(Double.NaN))
                .put("up", Package.of(Double.POSITIVE_INFINITY))
                .put("down", Package.of(Double.NEGATIVE_INFINITY))
                .build();

        Package back = json.fromJson(json.toJson(pkg));

        assertEquals(pkg, back);
        assertTrue(Double.isNaN(back.field("nan").asDouble()));

        try (World world = new World(4)) {
            world.registerComponent(Position.class);
            Entity e = world.create(new Position(Float.NaN, Float.POSITIVE_INFINITY, 0));
            Entity copy = world.create();

            assertTrue(world.unpack(copy, json.fromJson(json.toJson(world.pack(e)))));
            assertEquals(world.get(e, Position.class), world.get(copy, Position.class));
        }
    }
}
