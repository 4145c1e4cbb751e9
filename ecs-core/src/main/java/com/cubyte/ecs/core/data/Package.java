package com.cubyte.ecs.core.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Type-erased, serializable tree of values.
 * <p>
 * A package is either nothing ({@link Kind#NONE}), a scalar (boolean, 64-bit integer, double or string),
 * an object with ordered named fields, or an array. Integral scalars are widened to {@code long} and
 * floating point scalars to {@code double}. Packages are immutable.
 */
public final class Package {

    public enum Kind {
        NONE,
        SCALAR,
        OBJECT,
        ARRAY
    }

    private static final Package NONE = new Package(Kind.NONE, null, Map.of(), List.of());

    private final Kind kind;
    private final Object scalar;
    private final Map<String, Package> fields;
    private final List<Package> elements;

    private Package(Kind kind, Object scalar, Map<String, Package> fields, List<Package> elements) {
        this.kind = kind;
        this.scalar = scalar;
        this.fields = fields;
        this.elements = elements;
    }

    public static Package none() {
        return NONE;
    }

    public static Package of(boolean value) {
        return new Package(Kind.SCALAR, value, Map.of(), List.of());
    }

    public static Package of(long value) {
        return new Package(Kind.SCALAR, value, Map.of(), List.of());
    }

    public static Package of(double value) {
        return new Package(Kind.SCALAR, value, Map.of(), List.of());
    }

    /**
     * String scalar; a null string packs as {@link Kind#NONE}.
     */
    public static Package of(String value) {
        return value == null ? NONE : new Package(Kind.SCALAR, value, Map.of(), List.of());
    }

    public static Package object(Map<String, Package> fields) {
        Map<String, Package> copy = new LinkedHashMap<>();
        fields.forEach((name, value) -> copy.put(Objects.requireNonNull(name, "field name"),
                Objects.requireNonNull(value, "field value")));
        return new Package(Kind.OBJECT, null, Collections.unmodifiableMap(copy), List.of());
    }

    public static Package array(List<Package> elements) {
        return new Package(Kind.ARRAY, null, Map.of(), List.copyOf(elements));
    }

    public static ObjectBuilder objectBuilder() {
        return new ObjectBuilder();
    }

    public Kind kind() {
        return kind;
    }

    public boolean isNone() {
        return kind == Kind.NONE;
    }

    public boolean asBoolean() {
        if (scalar instanceof Boolean b) return b;
        throw mismatch("boolean");
    }

    public long asLong() {
        if (scalar instanceof Long l) return l;
        throw mismatch("integer");
    }

    /**
     * Floating point value; integral scalars are accepted and converted.
     */
    public double asDouble() {
        if (scalar instanceof Double d) return d;
        if (scalar instanceof Long l) return l;
        throw mismatch("number");
    }

    public String asString() {
        if (scalar instanceof String s) return s;
        throw mismatch("string");
    }

    /**
     * Raw scalar value ({@code Boolean}, {@code Long}, {@code Double} or {@code String}), or null.
     */
    public Object scalar() {
        return scalar;
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    /**
     * @throws PackageException if this is not an object or the field is missing
     */
    public Package field(String name) {
        if (kind != Kind.OBJECT) {
            throw mismatch("object");
        }
        Package value = fields.get(name);
        if (value == null) {
            throw new PackageException("Missing field '" + name + "'");
        }
        return value;
    }

    /**
     * Fields of an object package in insertion order.
     *
     * @throws PackageException if this is not an object
     */
    public Map<String, Package> fields() {
        if (kind != Kind.OBJECT) {
            throw mismatch("object");
        }
        return fields;
    }

    /**
     * @throws PackageException if this is not an array
     */
    public List<Package> elements() {
        if (kind != Kind.ARRAY) {
            throw mismatch("array");
        }
        return elements;
    }

    /**
     * Number of fields of an object or elements of an array; 0 otherwise.
     */
    public int size() {
        return switch (kind) {
            case OBJECT -> fields.size();
            case ARRAY -> elements.size();
            default -> 0;
        };
    }

    private PackageException mismatch(String expected) {
        return new PackageException("Expected " + expected + " but package holds " + describe());
    }

    private String describe() {
        if (kind == Kind.SCALAR) {
            return scalar.getClass().getSimpleName().toLowerCase() + " " + scalar;
        }
        return kind.name().toLowerCase();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Package other)) return false;
        return kind == other.kind
                && Objects.equals(scalar, other.scalar)
                && fields.equals(other.fields)
                && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, scalar, fields, elements);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NONE -> "none";
            case SCALAR -> scalar instanceof String s ? '"' + s + '"' : String.valueOf(scalar);
            case OBJECT -> fields.toString();
            case ARRAY -> elements.toString();
        };
    }

    public static final class ObjectBuilder {
        private final Map<String, Package> fields = new LinkedHashMap<>();

        private ObjectBuilder() {
        }

        public ObjectBuilder put(String name, Package value) {
            fields.put(name, value);
            return this;
        }

        public Package build() {
            return Package.object(fields);
        }
    }
}
