package com.cubyte.ecs.core.reflection;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Describes how instances of a type are constructed and destroyed without compile-time knowledge of it.
 * <p>
 * Size, alignment and the destructor are mandatory. The default, copy and move constructors are optional;
 * the corresponding {@code *Construct} calls return an empty {@link Optional} when one was not provided,
 * letting callers fall back to another way of initializing the value.
 * <p>
 * A trait is configured fluently and becomes immutable once installed in a {@link TypeRegistry}.
 *
 * <pre>{@code
 * ConstructibleTrait<Position> trait = new ConstructibleTrait<>(Position.class, 12, 4, ConstructibleTrait.noDestructor())
 *     .withDefaultConstructor(Position::new)
 *     .withCopyConstructor(p -> new Position(p.x, p.y, p.z));
 * }</pre>
 *
 * @param <T> the described type
 */
public final class ConstructibleTrait<T> {
    private final Class<T> type;
    private final long size;
    private final int alignment;
    private final Consumer<? super T> destructor;

    private Supplier<? extends T> defaultConstructor;
    private UnaryOperator<T> copyConstructor;
    private UnaryOperator<T> moveConstructor;
    private volatile boolean frozen;

    /**
     * @param type       the described type
     * @param size       size in bytes of the type's reflected layout
     * @param alignment  alignment in bytes, must be a positive power of two
     * @param destructor releases an instance, must not be null
     */
    public ConstructibleTrait(Class<T> type, long size, int alignment, Consumer<? super T> destructor) {
        this.type = Objects.requireNonNull(type, "type");
        if (size < 0) {
            throw new IllegalArgumentException("Size must not be negative: " + size + " for " + type.getName());
        }
        if (alignment <= 0) {
            throw new IllegalArgumentException("Alignment must be positive: " + alignment + " for " + type.getName());
        }
        if ((alignment & (alignment - 1)) != 0) {
            throw new IllegalArgumentException("Alignment must be a power of two: " + alignment + " for " + type.getName());
        }
        if (destructor == null) {
            throw new IllegalArgumentException("Destructor must be non-null for " + type.getName());
        }
        this.size = size;
        this.alignment = alignment;
        this.destructor = destructor;
    }

    public ConstructibleTrait<T> withDefaultConstructor(Supplier<? extends T> constructor) {
        ensureMutable();
        if (defaultConstructor != null) {
            throw new IllegalStateException("Default constructor already set for " + type.getName());
        }
        this.defaultConstructor = Objects.requireNonNull(constructor, "constructor");
        return this;
    }

    public ConstructibleTrait<T> withCopyConstructor(UnaryOperator<T> constructor) {
        ensureMutable();
        if (copyConstructor != null) {
            throw new IllegalStateException("Copy constructor already set for " + type.getName());
        }
        this.copyConstructor = Objects.requireNonNull(constructor, "constructor");
        return this;
    }

    public ConstructibleTrait<T> withMoveConstructor(UnaryOperator<T> constructor) {
        ensureMutable();
        if (moveConstructor != null) {
            throw new IllegalStateException("Move constructor already set for " + type.getName());
        }
        this.moveConstructor = Objects.requireNonNull(constructor, "constructor");
        return this;
    }

    public Class<T> type() {
        return type;
    }

    public long size() {
        return size;
    }

    public int alignment() {
        return alignment;
    }

    public boolean hasDefaultConstructor() {
        return defaultConstructor != null;
    }

    public boolean hasCopyConstructor() {
        return copyConstructor != null;
    }

    public boolean hasMoveConstructor() {
        return moveConstructor != null;
    }

    public void destruct(T instance) {
        destructor.accept(instance);
    }

    public Optional<T> defaultConstruct() {
        if (defaultConstructor == null) {
            return Optional.empty();
        }
        return Optional.of(defaultConstructor.get());
    }

    public Optional<T> copyConstruct(T other) {
        if (copyConstructor == null) {
            return Optional.empty();
        }
        return Optional.of(copyConstructor.apply(other));
    }

    /**
     * Transfers the state of {@code other} into a new value. {@code other} must not be used afterwards.
     */
    public Optional<T> moveConstruct(T other) {
        if (moveConstructor == null) {
            return Optional.empty();
        }
        return Optional.of(moveConstructor.apply(other));
    }

    /**
     * Erased variant of {@link #destruct(Object)} for callers holding an {@code Object}.
     */
    public void destructErased(Object instance) {
        destruct(type.cast(instance));
    }

    boolean isFrozen() {
        return frozen;
    }

    void freeze() {
        this.frozen = true;
    }

    private void ensureMutable() {
        if (frozen) {
            throw new IllegalStateException("Trait of " + type.getName() + " is already registered and immutable");
        }
    }

    /**
     * Destructor for types that hold nothing to release.
     */
    public static <T> Consumer<T> noDestructor() {
        return instance -> { };
    }

    /**
     * Destructor closing {@link AutoCloseable} instances. Failures are rethrown unchecked.
     */
    public static <T> Consumer<T> closeDestructor() {
        return instance -> {
            if (instance instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    throw new IllegalStateException("Failed to close " + instance.getClass().getName(), e);
                }
            }
        };
    }

    @Override
    public String toString() {
        return "ConstructibleTrait{" + type.getSimpleName() +
                ", size=" + size +
                ", alignment=" + alignment +
                ", default=" + hasDefaultConstructor() +
                ", copy=" + hasCopyConstructor() +
                ", move=" + hasMoveConstructor() + '}';
    }
}
