package com.cubyte.ecs.core.reflection;

import java.lang.reflect.Field;
import java.util.Objects;

/**
 * A single reflected field: its name, kind, position in the layout and reflective accessors.
 */
public final class FieldDescriptor {
    private final String name;
    private final FieldType type;
    private final long offset;
    private final long size;
    private final int alignment;
    private final Field field;

    public FieldDescriptor(String name, FieldType type, long offset, long size, int alignment, Field field) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.offset = offset;
        this.size = size;
        this.alignment = alignment;
        this.field = Objects.requireNonNull(field, "field");
    }

    public String name() {
        return name;
    }

    public FieldType type() {
        return type;
    }

    public long offset() {
        return offset;
    }

    public long size() {
        return size;
    }

    public int alignment() {
        return alignment;
    }

    /**
     * Declared Java type of the field.
     */
    public Class<?> javaType() {
        return field.getType();
    }

    public Object get(Object instance) {
        try {
            return field.get(instance);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read field '" + name + "' of " + field.getDeclaringClass().getName(), e);
        }
    }

    public void set(Object instance, Object value) {
        try {
            field.set(instance, value);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot write field '" + name + "' of " + field.getDeclaringClass().getName(), e);
        }
    }

    @Override
    public String toString() {
        return String.format("%s: %s @ offset %d (size=%d, align=%d)", name, type, offset, size, alignment);
    }
}
