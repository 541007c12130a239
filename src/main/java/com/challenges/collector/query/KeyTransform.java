package com.challenges.collector.query;

import java.util.Objects;

/**
 * Turns a raw group value into a grouping key. The returned key must have
 * value-based {@code equals} and a stable {@code hashCode}: it becomes a map key
 * in the grouped output.
 */
@FunctionalInterface
public interface KeyTransform {

    Object toKey(Object value);

    default String name() {
        return "transform";
    }

    static KeyTransform named(String name, KeyTransform transform) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(transform, "transform");
        return new KeyTransform() {
            @Override
            public Object toKey(Object value) {
                return transform.toKey(value);
            }

            @Override
            public String name() {
                return name;
            }
        };
    }
}
