package com.cubyte.ecs.core.reflection;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Collections;
import java.util.List;

/**
 * Ordered field list of a reflected type.
 * <p>
 * Record types cannot have their fields written reflectively; for them the trait keeps the canonical
 * constructor and new instances are built from a full value array through {@link #instantiate(Object[])}.
 */
public final class FieldsTrait {
    private final List<FieldDescriptor> fields;
    private final Constructor<?> canonicalConstructor;

    public FieldsTrait(List<FieldDescriptor> fields, Constructor<?> canonicalConstructor) {
        this.fields = List.copyOf(fields);
        this.canonicalConstructor = canonicalConstructor;
    }

    public static FieldsTrait empty() {
        return new FieldsTrait(Collections.emptyList(), null);
    }

    public List<FieldDescriptor> fields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public FieldDescriptor field(String name) {
        for (FieldDescriptor f : fields) {
            if (f.name().equals(name)) return f;
        }
        return null;
    }

    public int indexOf(String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equals(name)) return i;
        }
        return -1;
    }

    /**
     * True if instances must be created through the canonical constructor instead of field writes.
     */
    public boolean isConstructorBased() {
        return canonicalConstructor != null;
    }

    /**
     * Builds an instance from values given in field order. Only valid for constructor-based types.
     */
    public Object instantiate(Object[] values) {
        if (canonicalConstructor == null) {
            throw new IllegalStateException("Type has no canonical constructor");
        }
        if (values.length != fields.size()) {
            throw new IllegalArgumentException("Expected " + fields.size() + " values, got " + values.length);
        }
        try {
            return canonicalConstructor.newInstance(values);
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("Canonical constructor of "
                    + canonicalConstructor.getDeclaringClass().getName() + " failed", e.getCause());
        } catch (InstantiationException | IllegalAccessException e) {
            throw new IllegalStateException("Cannot invoke canonical constructor of "
                    + canonicalConstructor.getDeclaringClass().getName(), e);
        }
    }
}
