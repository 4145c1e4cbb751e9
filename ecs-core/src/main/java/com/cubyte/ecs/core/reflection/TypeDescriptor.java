package com.cubyte.ecs.core.reflection;

/**
 * Everything the store knows about a registered type: its name, how to construct and destroy it,
 * and which fields it packs.
 */
public record TypeDescriptor<T>(Class<T> type, String name, ConstructibleTrait<T> trait, FieldsTrait fields) {

    public long size() {
        return trait.size();
    }

    public int alignment() {
        return trait.alignment();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("TypeDescriptor{").append(name)
                .append(", size=").append(trait.size())
                .append(", alignment=").append(trait.alignment())
                .append('\n');
        for (FieldDescriptor field : fields.fields()) {
            sb.append("  ").append(field).append('\n');
        }
        return sb.append('}').toString();
    }
}
