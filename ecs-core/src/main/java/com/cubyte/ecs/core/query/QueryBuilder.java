package com.cubyte.ecs.core.query;

import com.cubyte.ecs.core.api.IQueryBuilder;
import com.cubyte.ecs.core.component.ComponentManager;
import com.cubyte.ecs.core.component.ComponentMask;
import com.cubyte.ecs.core.entity.EntityManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the with / without / any terms of a {@link Query}.
 * <p>
 * Unregistered types resolve as follows: a required one makes the query match nothing, an excluded one
 * is dropped (no entity can hold it), and inside an any-group it simply never intersects.
 */
public final class QueryBuilder implements IQueryBuilder {
    private static final Logger log = LogManager.getLogger(QueryBuilder.class);

    private final EntityManager entities;
    private final ComponentManager components;
    private final ComponentMask.Builder withMask = ComponentMask.builder();
    private final ComponentMask.Builder withoutMask = ComponentMask.builder();
    private final List<ComponentMask> anyMasks = new ArrayList<>();
    private final Map<Class<?>, Integer> withTypes = new LinkedHashMap<>();
    private boolean matchesNothing;

    public QueryBuilder(EntityManager entities, ComponentManager components) {
        this.entities = entities;
        this.components = components;
    }

    @Override
    public <T> QueryBuilder with(Class<T> componentClass) {
        Integer typeId = components.getTypeId(componentClass);
        if (typeId == null) {
            log.error("Query requires unregistered component {}; it will match nothing", componentClass.getName());
            matchesNothing = true;
            return this;
        }
        withMask.with(typeId);
        withTypes.put(componentClass, typeId);
        return this;
    }

    @Override
    public <T> QueryBuilder without(Class<T> componentClass) {
        Integer typeId = components.getTypeId(componentClass);
        if (typeId != null) {
            withoutMask.with(typeId);
        }
        return this;
    }

    @Override
    public QueryBuilder any(Class<?>... componentClasses) {
        ComponentMask.Builder anyBuilder = ComponentMask.builder();
        for (Class<?> componentClass : componentClasses) {
            Integer typeId = components.getTypeId(componentClass);
            if (typeId != null) {
                anyBuilder.with(typeId);
            }
        }
        anyMasks.add(anyBuilder.build());
        return this;
    }

    @Override
    public Query build() {
        return new Query(entities, components, withMask.build(), withoutMask.build(),
                anyMasks, withTypes, matchesNothing);
    }
}
