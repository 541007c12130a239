package com.challenges.collector.query;

import org.eclipse.collections.impl.factory.Sets;
import org.eclipse.collections.api.set.ImmutableSet;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One step of a terminal's filter chain. An {@link Mode#INCLUDE} filter keeps the
 * values its condition matches, an {@link Mode#EXCLUDE} filter drops them.
 */
public record Filter(Mode mode, Condition condition) {
    private static final String UNNAMED = "predicate";

    public enum Mode {
        INCLUDE,
        EXCLUDE
    }

    public sealed interface Condition {
        boolean matches(Object value);

        /** A named predicate over the raw value. */
        record Matches(String name, Predicate<Object> predicate) implements Condition {
            public Matches {
                Objects.requireNonNull(name, "name");
                Objects.requireNonNull(predicate, "predicate");
            }

            @Override
            public boolean matches(Object value) {
                return predicate.test(value);
            }
        }

        /**
         * Membership in a fixed set of values. Membership follows {@code equals},
         * so {@code 1} and {@code 1L} are different values.
         */
        record AnyOf(ImmutableSet<Object> values) implements Condition {
            public AnyOf {
                Objects.requireNonNull(values, "values");
            }

            @Override
            public boolean matches(Object value) {
                return values.contains(value);
            }
        }
    }

    public Filter {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(condition, "condition");
    }

    public boolean accepts(Object value) {
        boolean matched = condition.matches(value);
        return mode == Mode.INCLUDE ? matched : !matched;
    }

    /**
     * An unnamed predicate filter. It is formatted as {@code {"test": "predicate"}},
     * which reads back only if a predicate is registered under that name.
     */
    public static Filter include(Predicate<Object> predicate) {
        return include(UNNAMED, predicate);
    }

    /**
     * A predicate filter formatted under {@code name}, so a definition read with a
     * predicate registered under the same name gets the same filter back.
     */
    public static Filter include(String name, Predicate<Object> predicate) {
        return new Filter(Mode.INCLUDE, new Condition.Matches(name, predicate));
    }

    public static Filter includeAnyOf(Object... values) {
        return new Filter(Mode.INCLUDE, anyOf(values));
    }

    public static Filter exclude(Predicate<Object> predicate) {
        return exclude(UNNAMED, predicate);
    }

    public static Filter exclude(String name, Predicate<Object> predicate) {
        return new Filter(Mode.EXCLUDE, new Condition.Matches(name, predicate));
    }

    public static Filter excludeAnyOf(Object... values) {
        return new Filter(Mode.EXCLUDE, anyOf(values));
    }

    private static Condition.AnyOf anyOf(Object... values) {
        return new Condition.AnyOf(Sets.mutable.<Object>with(values).toImmutable());
    }
}
