package com.cubyte.ecs.core.reflection;

import com.cubyte.ecs.core.component.Component;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Registry of type descriptors owned by a single world.
 * <p>
 * Descriptors are built once per type: a trait generated at compile time ({@code <FQN>Meta.TRAIT})
 * is preferred, otherwise size, alignment, constructors and fields are derived through reflection.
 * Registering a type twice returns the existing descriptor.
 */
public final class TypeRegistry {
    private static final Logger log = LogManager.getLogger(TypeRegistry.class);

    private final ConcurrentHashMap<Class<?>, TypeDescriptor<?>> descriptors = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TypeDescriptor<?>> descriptorsByName = new ConcurrentHashMap<>();
    // Types whose descriptor is being built; guards self-referencing composites
    private final Set<Class<?>> building = ConcurrentHashMap.newKeySet();

    /**
     * Register a type, building its descriptor if it is not known yet.
     */
    public <T> TypeDescriptor<T> register(Class<T> type) {
        TypeDescriptor<T> existing = get(type);
        if (existing != null) {
            return existing;
        }
        ConstructibleTrait<T> generated = tryLoadGeneratedTrait(type);
        if (generated != null) {
            log.trace("Using generated trait for '{}'", type.getName());
            return install(type, generated, buildFields(type));
        }
        return install(type, null, buildFields(type));
    }

    /**
     * Register a type with a hand-built trait. The trait becomes immutable.
     */
    public <T> TypeDescriptor<T> register(Class<T> type, ConstructibleTrait<T> trait) {
        if (trait.type() != type) {
            throw new IllegalArgumentException("Trait describes " + trait.type().getName() + ", not " + type.getName());
        }
        TypeDescriptor<T> existing = get(type);
        if (existing != null) {
            log.warn("Type '{}' is already registered, ignoring the new trait", type.getName());
            return existing;
        }
        return install(type, trait, buildFields(type));
    }

    @SuppressWarnings("unchecked")
    public <T> TypeDescriptor<T> get(Class<T> type) {
        return (TypeDescriptor<T>) descriptors.get(type);
    }

    public TypeDescriptor<?> findByName(String name) {
        return descriptorsByName.get(name);
    }

    public boolean contains(Class<?> type) {
        return descriptors.containsKey(type);
    }

    public Collection<TypeDescriptor<?>> descriptors() {
        return Collections.unmodifiableCollection(descriptors.values());
    }

    /**
     * Registered name of a type: {@link Component.Name} if present, else the simple class name.
     */
    public static String nameOf(Class<?> type) {
        Component.Name name = type.getAnnotation(Component.Name.class);
        return name != null ? name.value() : type.getSimpleName();
    }

    private <T> TypeDescriptor<T> install(Class<T> type, ConstructibleTrait<T> trait, Layout<T> layout) {
        ConstructibleTrait<T> finalTrait = trait != null ? trait : buildTrait(type, layout);
        finalTrait.freeze();
        TypeDescriptor<T> descriptor = new TypeDescriptor<>(type, nameOf(type), finalTrait, layout.fields);
        TypeDescriptor<?> raced = descriptors.putIfAbsent(type, descriptor);
        if (raced != null) {
            return get(type);
        }
        TypeDescriptor<?> sameName = descriptorsByName.putIfAbsent(descriptor.name(), descriptor);
        if (sameName != null) {
            log.warn("Types '{}' and '{}' share the name '{}'; packages resolve it to the first",
                    sameName.type().getName(), type.getName(), descriptor.name());
        }
        log.trace("Registered type '{}' ({})", descriptor.name(), finalTrait);
        return descriptor;
    }

    // ---------------------------------------------------------------------
    // Layout through reflection
    // ---------------------------------------------------------------------

    private static final class Layout<T> {
        final FieldsTrait fields;
        final long size;
        final int alignment;

        Layout(FieldsTrait fields, long size, int alignment) {
            this.fields = fields;
            this.size = size;
            this.alignment = alignment;
        }
    }

    private <T> Layout<T> buildFields(Class<T> type) {
        Component.Layout layoutAnnotation = type.getAnnotation(Component.Layout.class);
        Component.LayoutType layoutType = layoutAnnotation != null
                ? layoutAnnotation.value() : Component.LayoutType.PADDING;

        // Fields of platform classes are not reachable; treat them as opaque
        if (type.getModule().isNamed() || type.isInterface() || type.isPrimitive() || type.isArray()) {
            return new Layout<>(FieldsTrait.empty(), 0, 1);
        }

        building.add(type);
        try {
            List<Field> candidates = collectFields(type);
            boolean annotatedOnly = candidates.stream().anyMatch(f -> f.isAnnotationPresent(Component.Field.class));
            if (annotatedOnly) {
                candidates.removeIf(f -> !f.isAnnotationPresent(Component.Field.class));
            }
            if (layoutType == Component.LayoutType.EXPLICIT) {
                candidates.sort(Comparator.comparingInt(TypeRegistry::explicitOffset));
            }

            List<FieldDescriptor> fieldDescriptors = new ArrayList<>();
            long currentOffset = 0;
            long end = 0;
            int maxAlignment = 1;
            for (Field field : candidates) {
                field.setAccessible(true);
                Component.Field fieldAnnotation = field.getAnnotation(Component.Field.class);

                FieldType fieldType = FieldType.fromJavaType(field.getType());
                long naturalSize = fieldType.getSize();
                int naturalAlignment = fieldType.getNaturalAlignment();
                if (fieldType == FieldType.COMPOSITE) {
                    if (building.contains(field.getType())) {
                        fieldType = FieldType.OBJECT;
                        naturalSize = fieldType.getSize();
                        naturalAlignment = fieldType.getNaturalAlignment();
                    } else {
                        TypeDescriptor<?> nested = register(field.getType());
                        naturalSize = nested.size();
                        naturalAlignment = nested.alignment();
                    }
                }

                long fieldSize = fieldAnnotation != null && fieldAnnotation.size() > 0
                        ? fieldAnnotation.size() : naturalSize;
                int alignment = fieldAnnotation != null && fieldAnnotation.alignment() > 0
                        ? fieldAnnotation.alignment() : naturalAlignment;

                long offset;
                if (layoutType == Component.LayoutType.EXPLICIT && fieldAnnotation != null && fieldAnnotation.offset() >= 0) {
                    offset = fieldAnnotation.offset();
                } else if (layoutType == Component.LayoutType.SEQUENTIAL) {
                    offset = currentOffset;
                } else {
                    offset = alignUp(currentOffset, alignment);
                }

                fieldDescriptors.add(new FieldDescriptor(field.getName(), fieldType, offset, fieldSize, alignment, field));
                currentOffset = offset + fieldSize;
                end = Math.max(end, currentOffset);
                maxAlignment = Math.max(maxAlignment, alignment);
            }

            int alignment;
            if (layoutAnnotation != null && layoutAnnotation.alignment() > 0) {
                alignment = layoutAnnotation.alignment();
            } else if (layoutType == Component.LayoutType.SEQUENTIAL) {
                alignment = 1;
            } else {
                alignment = maxAlignment;
            }

            long size;
            if (layoutAnnotation != null && layoutAnnotation.size() > 0) {
                size = layoutAnnotation.size();
            } else if (layoutType == Component.LayoutType.SEQUENTIAL) {
                size = end;
            } else {
                size = alignUp(end, alignment);
            }

            Constructor<?> canonical = type.isRecord() ? canonicalConstructor(type) : null;
            return new Layout<>(new FieldsTrait(fieldDescriptors, canonical), size, alignment);
        } finally {
            building.remove(type);
        }
    }

    private static List<Field> collectFields(Class<?> type) {
        List<Field> result = new ArrayList<>();
        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                try {
                    result.add(type.getDeclaredField(component.getName()));
                } catch (NoSuchFieldException e) {
                    throw new IllegalStateException("Record component without field: " + component.getName(), e);
                }
            }
            return result;
        }
        // Superclass fields come first; a field shadowed by a subclass is left out
        Set<String> seen = new HashSet<>();
        for (Class<?> c = type; c != null && c != Object.class && !c.getModule().isNamed(); c = c.getSuperclass()) {
            List<Field> declared = new ArrayList<>();
            for (Field field : c.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                // Skip static, transient and compiler-generated fields (e.g. this$0)
                if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
                    continue;
                }
                if (seen.add(field.getName())) {
                    declared.add(field);
                }
            }
            result.addAll(0, declared);
        }
        return result;
    }

    private static int explicitOffset(Field field) {
        Component.Field annotation = field.getAnnotation(Component.Field.class);
        return annotation != null && annotation.offset() >= 0 ? annotation.offset() : Integer.MAX_VALUE;
    }

    private static Constructor<?> canonicalConstructor(Class<?> recordType) {
        RecordComponent[] components = recordType.getRecordComponents();
        Class<?>[] parameterTypes = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) {
            parameterTypes[i] = components[i].getType();
        }
        try {
            Constructor<?> constructor = recordType.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
            return constructor;
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("Record without canonical constructor: " + recordType.getName(), e);
        }
    }

    private static long alignUp(long offset, int alignment) {
        return ((offset + alignment - 1) / alignment) * alignment;
    }

    // ---------------------------------------------------------------------
    // Trait through reflection
    // ---------------------------------------------------------------------

    private <T> ConstructibleTrait<T> buildTrait(Class<T> type, Layout<T> layout) {
        ConstructibleTrait<T> trait = new ConstructibleTrait<>(type, layout.size, layout.alignment,
                AutoCloseable.class.isAssignableFrom(type)
                        ? ConstructibleTrait.closeDestructor()
                        : ConstructibleTrait.noDestructor());

        if (type.getModule().isNamed() || type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            return trait.withMoveConstructor(UnaryOperator.identity());
        }

        Supplier<T> defaultConstructor = null;
        if (type.isRecord()) {
            FieldsTrait fields = layout.fields;
            defaultConstructor = () -> type.cast(fields.instantiate(zeroValues(fields)));
        } else {
            Constructor<T> noArgs = findConstructor(type);
            if (noArgs != null) {
                defaultConstructor = () -> newInstance(noArgs);
            }
        }
        if (defaultConstructor != null) {
            trait.withDefaultConstructor(defaultConstructor);
        }

        Constructor<T> copying = findConstructor(type, type);
        if (copying != null) {
            trait.withCopyConstructor(other -> newInstance(copying, other));
        } else if (type.isRecord()) {
            // Record state is final: sharing the instance is a valid copy
            trait.withCopyConstructor(UnaryOperator.identity());
        } else if (defaultConstructor != null) {
            trait.withCopyConstructor(fieldwiseCopy(type, defaultConstructor));
        }

        return trait.withMoveConstructor(UnaryOperator.identity());
    }

    private static Object[] zeroValues(FieldsTrait fields) {
        Object[] values = new Object[fields.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = zeroValue(fields.fields().get(i).javaType());
        }
        return values;
    }

    private static Object zeroValue(Class<?> type) {
        if (!type.isPrimitive()) return null;
        if (type == boolean.class) return false;
        if (type == char.class) return '\0';
        if (type == byte.class) return (byte) 0;
        if (type == short.class) return (short) 0;
        if (type == int.class) return 0;
        if (type == long.class) return 0L;
        if (type == float.class) return 0f;
        return 0d;
    }

    private static <T> Constructor<T> findConstructor(Class<T> type, Class<?>... parameterTypes) {
        try {
            Constructor<T> constructor = type.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
            return constructor;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    private static <T> T newInstance(Constructor<T> constructor, Object... args) {
        try {
            return constructor.newInstance(args);
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("Constructor of " + constructor.getDeclaringClass().getName() + " failed", e.getCause());
        } catch (InstantiationException | IllegalAccessException e) {
            throw new IllegalStateException("Cannot invoke constructor of " + constructor.getDeclaringClass().getName(), e);
        }
    }

    /**
     * Copy constructor that default-constructs a new instance and copies every instance field into it,
     * superclass fields included. Used for types without a {@code T(T)} constructor.
     */
    public static <T> UnaryOperator<T> fieldwiseCopy(Class<T> type, Supplier<? extends T> blank) {
        List<Field> state = instanceFields(type);
        return other -> copyFields(blank.get(), other, state);
    }

    private static List<Field> instanceFields(Class<?> type) {
        List<Field> result = new ArrayList<>();
        for (Class<?> c = type; c != null && c != Object.class && !c.getModule().isNamed(); c = c.getSuperclass()) {
            for (Field field : c.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) continue;
                field.setAccessible(true);
                result.add(field);
            }
        }
        return result;
    }

    private static <T> T copyFields(T target, T source, List<Field> fields) {
        try {
            for (Field field : fields) {
                field.set(target, field.get(source));
            }
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot copy " + source.getClass().getName(), e);
        }
        return target;
    }

    // Try to load a generated meta class <FQN> + "Meta" exposing a TRAIT field.
    @SuppressWarnings("unchecked")
    private static <T> ConstructibleTrait<T> tryLoadGeneratedTrait(Class<T> type) {
        String metaName = type.getName() + "Meta";
        Class<?> meta;
        try {
            meta = Class.forName(metaName, true, type.getClassLoader());
        } catch (ClassNotFoundException | LinkageError e) {
            return null; // no generated meta for this type
        }
        try {
            Object value = meta.getField("TRAIT").get(null);
            if (value instanceof ConstructibleTrait<?> trait && trait.type() == type) {
                return (ConstructibleTrait<T>) trait;
            }
            log.warn("Generated meta '{}' does not describe {}", metaName, type.getName());
        } catch (NoSuchFieldException | IllegalAccessException e) {
            log.warn("Generated meta '{}' has no accessible TRAIT field", metaName, e);
        }
        return null;
    }
}
