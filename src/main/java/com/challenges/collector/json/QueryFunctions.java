package com.challenges.collector.json;

import com.challenges.collector.query.KeyTransform;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Named predicates and key transforms that a JSON query definition refers to.
 */
public final class QueryFunctions {
    private final MutableMap<String, Predicate<Object>> predicates = Maps.mutable.empty();
    private final MutableMap<String, KeyTransform> keyTransforms = Maps.mutable.empty();

    public static QueryFunctions none() {
        return new QueryFunctions();
    }

    public QueryFunctions predicate(String name, Predicate<Object> predicate) {
        predicates.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(predicate, "predicate"));
        return this;
    }

    public QueryFunctions keyTransform(String name, KeyTransform transform) {
        Objects.requireNonNull(transform, "transform");
        keyTransforms.put(Objects.requireNonNull(name, "name"), KeyTransform.named(name, transform));
        return this;
    }

    Predicate<Object> predicate(String name) {
        Predicate<Object> predicate = predicates.get(name);
        if (predicate == null) {
            throw new IllegalArgumentException("Unknown predicate: " + name);
        }
        return predicate;
    }

    KeyTransform keyTransform(String name) {
        KeyTransform transform = keyTransforms.get(name);
        if (transform == null) {
            throw new IllegalArgumentException("Unknown key transform: " + name);
        }
        return transform;
    }
}
