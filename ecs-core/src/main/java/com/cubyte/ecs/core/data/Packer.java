package com.cubyte.ecs.core.data;

import com.cubyte.ecs.core.entity.Entity;
import com.cubyte.ecs.core.reflection.FieldDescriptor;
import com.cubyte.ecs.core.reflection.FieldsTrait;
import com.cubyte.ecs.core.reflection.TypeDescriptor;
import com.cubyte.ecs.core.reflection.TypeRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Converts reflected values to {@link Package} trees and back.
 * <p>
 * Each reflected field becomes a named field of an object package. Integral fields pack as 64-bit
 * integers, floating point fields as doubles, chars as their code, enums by constant name and entity
 * references as {@code {index, generation}} objects. Nested composites recurse. Any other field type
 * needs a {@link FieldCodec} in the {@link PackContext}; codecs registered for a type always win over
 * the built-in rules.
 */
public final class Packer {
    private static final Logger log = LogManager.getLogger(Packer.class);

    static final String ENTITY_INDEX = "index";
    static final String ENTITY_GENERATION = "generation";

    private final TypeRegistry types;

    public Packer(TypeRegistry types) {
        this.types = types;
    }

    public <T> Package pack(TypeDescriptor<T> descriptor, T value) {
        return pack(descriptor, value, PackContext.defaults());
    }

    /**
     * Pack a whole value of a registered type.
     *
     * @throws PackageException if a field cannot be packed
     */
    public <T> Package pack(TypeDescriptor<T> descriptor, T value, PackContext context) {
        FieldCodec<T> codec = context.codecFor(descriptor.type());
        if (codec != null) {
            return codec.encode(value);
        }
        if (value == null) {
            return Package.none();
        }
        Package.ObjectBuilder builder = Package.objectBuilder();
        for (FieldDescriptor field : descriptor.fields().fields()) {
            builder.put(field.name(), packField(field, field.get(value), context));
        }
        return builder.build();
    }

    public <T> T unpack(TypeDescriptor<T> descriptor, Package pkg) {
        return unpack(descriptor, pkg, PackContext.defaults());
    }

    /**
     * Build a new value of a registered type from a package.
     *
     * @throws PackageException if the package does not match the type's fields
     */
    public <T> T unpack(TypeDescriptor<T> descriptor, Package pkg, PackContext context) {
        FieldCodec<T> codec = context.codecFor(descriptor.type());
        if (codec != null) {
            return codec.decode(pkg);
        }
        if (pkg.kind() != Package.Kind.OBJECT) {
            throw new PackageException("Cannot unpack '" + descriptor.name() + "' from " + pkg.kind().name().toLowerCase());
        }

        FieldsTrait fields = descriptor.fields();
        List<FieldDescriptor> list = fields.fields();
        Object[] values = new Object[list.size()];
        for (int i = 0; i < values.length; i++) {
            FieldDescriptor field = list.get(i);
            try {
                values[i] = unpackField(field, pkg.field(field.name()), context);
            } catch (PackageException e) {
                throw new PackageException("Field '" + field.name() + "' of '" + descriptor.name() + "': " + e.getMessage(), e);
            }
        }

        try {
            if (fields.isConstructorBased()) {
                return descriptor.type().cast(fields.instantiate(values));
            }
            T instance = descriptor.trait().defaultConstruct()
                    .orElseThrow(() -> new PackageException("'" + descriptor.name() + "' is not default-constructible"));
            for (int i = 0; i < values.length; i++) {
                list.get(i).set(instance, values[i]);
            }
            return instance;
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw new PackageException("Cannot instantiate '" + descriptor.name() + "'", e);
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Package packField(FieldDescriptor field, Object value, PackContext context) {
        FieldCodec codec = context.codecFor(field.javaType());
        if (codec != null) {
            return codec.encode(value);
        }
        if (value == null) {
            return Package.none();
        }
        switch (field.type()) {
            case BYTE:
            case SHORT:
            case INT:
            case LONG:
                return Package.of(((Number) value).longValue());
            case FLOAT:
            case DOUBLE:
                return Package.of(((Number) value).doubleValue());
            case BOOLEAN:
                return Package.of((Boolean) value);
            case CHAR:
                return Package.of((long) (Character) value);
            case STRING:
                return Package.of((String) value);
            case ENUM:
                return Package.of(((Enum<?>) value).name());
            case ENTITY:
                Entity entity = (Entity) value;
                return Package.objectBuilder()
                        .put(ENTITY_INDEX, Package.of(entity.index()))
                        .put(ENTITY_GENERATION, Package.of(entity.generation()))
                        .build();
            case COMPOSITE:
                TypeDescriptor nested = types.register(field.javaType());
                return pack(nested, value, context);
            default:
                throw new PackageException("No codec for field '" + field.name() + "' of type " + field.javaType().getName());
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Object unpackField(FieldDescriptor field, Package pkg, PackContext context) {
        Class<?> javaType = field.javaType();
        FieldCodec<?> codec = context.codecFor(javaType);
        if (codec != null) {
            return codec.decode(pkg);
        }
        if (pkg.isNone()) {
            if (javaType.isPrimitive()) {
                throw new PackageException("missing value for primitive " + javaType.getName());
            }
            return null;
        }
        switch (field.type()) {
            case BYTE:
                return (byte) checkedRange(pkg.asLong(), Byte.MIN_VALUE, Byte.MAX_VALUE);
            case SHORT:
                return (short) checkedRange(pkg.asLong(), Short.MIN_VALUE, Short.MAX_VALUE);
            case INT:
                return (int) checkedRange(pkg.asLong(), Integer.MIN_VALUE, Integer.MAX_VALUE);
            case LONG:
                return pkg.asLong();
            case FLOAT:
                return (float) pkg.asDouble();
            case DOUBLE:
                return pkg.asDouble();
            case BOOLEAN:
                return pkg.asBoolean();
            case CHAR:
                return (char) checkedRange(pkg.asLong(), Character.MIN_VALUE, Character.MAX_VALUE);
            case STRING:
                return pkg.asString();
            case ENUM:
                return enumConstant((Class) javaType, pkg.asString());
            case ENTITY:
                Entity entity = new Entity(
                        (int) checkedRange(pkg.field(ENTITY_INDEX).asLong(), -1, Integer.MAX_VALUE),
                        (int) checkedRange(pkg.field(ENTITY_GENERATION).asLong(), 0, Integer.MAX_VALUE));
                return entity.isNull() ? entity : context.mapEntity(entity);
            case COMPOSITE:
                TypeDescriptor nested = types.register(javaType);
                return unpack(nested, pkg, context);
            default:
                throw new PackageException("no codec for type " + javaType.getName());
        }
    }

    private static long checkedRange(long value, long min, long max) {
        if (value < min || value > max) {
            throw new PackageException("value " + value + " out of range [" + min + ", " + max + "]");
        }
        return value;
    }

    private static <E extends Enum<E>> E enumConstant(Class<E> type, String name) {
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(name)) {
                return constant;
            }
        }
        log.debug("Unknown constant '{}' for enum {}", name, type.getName());
        throw new PackageException("'" + name + "' is not a constant of " + type.getSimpleName());
    }
}
