package com.challenges.collector;

import com.challenges.collector.query.CompiledPlan;
import com.challenges.collector.query.QueryCompiler;
import com.challenges.collector.query.QueryNode;

import java.util.function.Supplier;

/**
 * A compiled query bound to a container factory and an inserter. Collectors are
 * immutable: every {@link #collect(Iterable)} call starts from fresh containers and
 * returns a result that depends only on the plan and the records.
 *
 * @param <R> {@code C} for plain plans, a nested {@code MutableMap} for grouped ones
 */
public interface ContainerCollector<R> {

    R collect(Iterable<?> records);

    CompiledPlan plan();

    /**
     * Compiles {@code root} and picks the strategy the plan calls for: a
     * {@link PlainCollector} when it has no group leaves, a {@link GroupCollector}
     * otherwise.
     *
     * @throws com.challenges.collector.query.QueryCompilationException if the tree is invalid
     */
    static <C> ContainerCollector<?> compile(QueryNode root, Supplier<? extends C> innerFactory,
                                             Inserter<? super C> inserter) {
        CompiledPlan plan = new QueryCompiler().compile(root);
        return switch (plan.strategy()) {
            case PLAIN -> PlainCollector.of(plan, innerFactory, inserter);
            case GROUPED -> GroupCollector.of(plan, innerFactory, inserter);
        };
    }
}
