package com.cubyte.ecs.core.reflection;

import com.cubyte.ecs.core.component.Component;
import com.cubyte.ecs.core.entity.Entity;

/**
 * Kind of a reflected field, with the size and natural alignment it takes in a component layout.
 */
public enum FieldType {
    BYTE(1, 1),
    SHORT(2, 2),
    INT(4, 4),
    LONG(8, 8),
    FLOAT(4, 4),
    DOUBLE(8, 8),
    BOOLEAN(1, 1),
    CHAR(2, 2),
    STRING(8, 8),
    ENUM(4, 4),
    ENTITY(8, 4),
    /** A nested reflected type; size and alignment come from its own descriptor. */
    COMPOSITE(0, 1),
    /** Any other reference, packed only through a codec supplied by the pack context. */
    OBJECT(8, 8);

    private final long size;
    private final int naturalAlignment;

    FieldType(long size, int naturalAlignment) {
        this.size = size;
        this.naturalAlignment = naturalAlignment;
    }

    public long getSize() {
        return size;
    }

    public int getNaturalAlignment() {
        return naturalAlignment;
    }

    /**
     * Maps a Java field type to its field kind. Primitives and their boxes map to the same kind.
     */
    public static FieldType fromJavaType(Class<?> type) {
        if (type == byte.class || type == Byte.class) return BYTE;
        if (type == short.class || type == Short.class) return SHORT;
        if (type == int.class || type == Integer.class) return INT;
        if (type == long.class || type == Long.class) return LONG;
        if (type == float.class || type == Float.class) return FLOAT;
        if (type == double.class || type == Double.class) return DOUBLE;
        if (type == boolean.class || type == Boolean.class) return BOOLEAN;
        if (type == char.class || type == Character.class) return CHAR;
        if (type == String.class) return STRING;
        if (type == Entity.class) return ENTITY;
        if (type.isEnum()) return ENUM;
        if (type.isRecord() || isComponentLike(type)) return COMPOSITE;
        return OBJECT;
    }

    private static boolean isComponentLike(Class<?> type) {
        return !type.isInterface() && Component.class.isAssignableFrom(type);
    }
}
