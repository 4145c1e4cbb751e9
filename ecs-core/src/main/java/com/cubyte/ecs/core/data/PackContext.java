package com.cubyte.ecs.core.data;

import com.cubyte.ecs.core.entity.Entity;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Optional context for packing and unpacking component data.
 * <p>
 * Holds codecs for field types the packer cannot handle on its own and a mapping applied to
 * entity references while unpacking, used when a package was produced by another world.
 */
public final class PackContext {
    private static final PackContext DEFAULT = builder().build();

    private final Map<Class<?>, FieldCodec<?>> codecs;
    private final UnaryOperator<Entity> entityMapper;

    private PackContext(Map<Class<?>, FieldCodec<?>> codecs, UnaryOperator<Entity> entityMapper) {
        this.codecs = Map.copyOf(codecs);
        this.entityMapper = entityMapper;
    }

    public static PackContext defaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    @SuppressWarnings("unchecked")
    public <T> FieldCodec<T> codecFor(Class<T> type) {
        return (FieldCodec<T>) codecs.get(type);
    }

    public Entity mapEntity(Entity entity) {
        return entityMapper.apply(entity);
    }

    public static final class Builder {
        private final Map<Class<?>, FieldCodec<?>> codecs = new HashMap<>();
        private UnaryOperator<Entity> entityMapper = UnaryOperator.identity();

        private Builder() {
        }

        public <T> Builder withCodec(Class<T> type, FieldCodec<T> codec) {
            codecs.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(codec, "codec"));
            return this;
        }

        public Builder withEntityMapper(UnaryOperator<Entity> mapper) {
            this.entityMapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public PackContext build() {
            return new PackContext(codecs, entityMapper);
        }
    }
}
