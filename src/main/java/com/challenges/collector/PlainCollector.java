package com.challenges.collector;

import com.challenges.collector.query.CompiledPlan;
import com.challenges.collector.query.QueryCompiler;
import com.challenges.collector.query.QueryExecutor;
import com.challenges.collector.query.QueryNode;
import com.challenges.collector.query.ScratchBuffer;
import org.eclipse.collections.impl.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Collects every accepted tuple into one container.
 *
 * @param <C> the container type
 */
public final class PlainCollector<C> implements ContainerCollector<C> {
    private static final Logger LOGGER = LoggerFactory.getLogger(PlainCollector.class);

    private final CompiledPlan plan;
    private final QueryExecutor executor;
    private final Supplier<? extends C> innerFactory;
    private final Inserter<? super C> inserter;

    private PlainCollector(CompiledPlan plan, Supplier<? extends C> innerFactory, Inserter<? super C> inserter) {
        this.plan = plan;
        this.executor = new QueryExecutor(plan);
        this.innerFactory = Objects.requireNonNull(innerFactory, "innerFactory");
        this.inserter = Objects.requireNonNull(inserter, "inserter");
    }

    public static <C> PlainCollector<C> compile(QueryNode root, Supplier<? extends C> innerFactory,
                                                Inserter<? super C> inserter) {
        return of(new QueryCompiler().compile(root), innerFactory, inserter);
    }

    /**
     * @throws IllegalArgumentException if the plan has group leaves
     */
    public static <C> PlainCollector<C> of(CompiledPlan plan, Supplier<? extends C> innerFactory,
                                           Inserter<? super C> inserter) {
        if (plan.strategy() != CompiledPlan.Strategy.PLAIN) {
            throw new IllegalArgumentException("A plain collector cannot group, the plan has "
                    + plan.groupCount() + " group level(s)");
        }
        return new PlainCollector<>(plan, innerFactory, inserter);
    }

    @Override
    public C collect(Iterable<?> records) {
        C container = Objects.requireNonNull(innerFactory.get(), "Inner factory returned null");
        ScratchBuffer scratch = new ScratchBuffer(plan);
        Counter commits = new Counter();
        int seen = 0;
        for (Object record : records) {
            executor.execute(record, scratch, () -> {
                inserter.insert(container, scratch.elements());
                commits.increment();
            });
            seen++;
        }
        LOGGER.debug("Collected {} record(s) into {} insertion(s)", seen, commits.getCount());
        return container;
    }

    @Override
    public CompiledPlan plan() {
        return plan;
    }
}
