package com.challenges.collector.query;

import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Closed set of query tree nodes. Inner nodes move the current value around,
 * terminals contribute to the tuple handed to the inserter.
 */
public sealed interface QueryNode {

    /** Descends into a mapping under {@code key}, or into a list when the key is an integer index. */
    record Select(Object key, QueryNode child) implements QueryNode {
        public Select {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(child, "child");
        }
    }

    /** Applies the child once per element of the current sequence. */
    record Iterate(QueryNode child) implements QueryNode {
        public Iterate {
            Objects.requireNonNull(child, "child");
        }
    }

    /** Applies every child to the same current value, in declared order. */
    record Fanout(ImmutableList<QueryNode> children) implements QueryNode {
        public Fanout {
            Objects.requireNonNull(children, "children");
        }
    }

    /**
     * A node that ends a branch. Filters run in order; the first rejection stops
     * the tuple being assembled.
     */
    sealed interface Terminal extends QueryNode {
        ImmutableList<Filter> filters();

        Terminal withFilter(Filter filter);

        default boolean accepts(Object value) {
            for (Filter filter : filters()) {
                if (!filter.accepts(value)) {
                    return false;
                }
            }
            return true;
        }

        default Terminal include(Predicate<Object> predicate) {
            return withFilter(Filter.include(predicate));
        }

        default Terminal include(String name, Predicate<Object> predicate) {
            return withFilter(Filter.include(name, predicate));
        }

        default Terminal includeAnyOf(Object... values) {
            return withFilter(Filter.includeAnyOf(values));
        }

        default Terminal exclude(Predicate<Object> predicate) {
            return withFilter(Filter.exclude(predicate));
        }

        default Terminal exclude(String name, Predicate<Object> predicate) {
            return withFilter(Filter.exclude(name, predicate));
        }

        default Terminal excludeAnyOf(Object... values) {
            return withFilter(Filter.excludeAnyOf(values));
        }
    }

    /** Records the current value as element #{@code position} of the inserted tuple. */
    record ElementLeaf(int position, ImmutableList<Filter> filters) implements Terminal {
        public ElementLeaf {
            Objects.requireNonNull(filters, "filters");
        }

        public ElementLeaf(int position) {
            this(position, Lists.immutable.empty());
        }

        @Override
        public ElementLeaf withFilter(Filter filter) {
            return new ElementLeaf(position, filters.newWith(filter));
        }
    }

    /**
     * Records the current value as the key of grouping level #{@code position}.
     * {@code keyTransform} may be null, in which case the raw value is the key.
     */
    record GroupLeaf(int position, ImmutableList<Filter> filters, KeyTransform keyTransform) implements Terminal {
        public GroupLeaf {
            Objects.requireNonNull(filters, "filters");
        }

        public GroupLeaf(int position) {
            this(position, Lists.immutable.empty(), null);
        }

        public GroupLeaf(int position, KeyTransform keyTransform) {
            this(position, Lists.immutable.empty(), keyTransform);
        }

        @Override
        public GroupLeaf withFilter(Filter filter) {
            return new GroupLeaf(position, filters.newWith(filter), keyTransform);
        }
    }

    /** Contributes nothing; only its filters matter. */
    record Guard(ImmutableList<Filter> filters) implements Terminal {
        public Guard {
            Objects.requireNonNull(filters, "filters");
        }

        public Guard() {
            this(Lists.immutable.empty());
        }

        @Override
        public Guard withFilter(Filter filter) {
            return new Guard(filters.newWith(filter));
        }
    }
}
