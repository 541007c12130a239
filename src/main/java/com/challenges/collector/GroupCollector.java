package com.challenges.collector;

import com.challenges.collector.query.CompiledPlan;
import com.challenges.collector.query.QueryCompiler;
import com.challenges.collector.query.QueryExecutor;
import com.challenges.collector.query.QueryNode;
import com.challenges.collector.query.ScratchBuffer;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.Counter;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Collects accepted tuples into containers nested under their group keys. For a
 * plan with G group levels the result is G maps deep: the keys of level 1 map to
 * the maps of level 2, and so on, and the keys of level G map to containers made
 * by the inner factory. A container is created the first time its key path is
 * reached and never for paths no tuple reaches.
 *
 * @param <C> the innermost container type
 */
public final class GroupCollector<C> implements ContainerCollector<MutableMap<Object, Object>> {
    private static final Logger LOGGER = LoggerFactory.getLogger(GroupCollector.class);

    private final CompiledPlan plan;
    private final QueryExecutor executor;
    private final Supplier<? extends C> innerFactory;
    private final Inserter<? super C> inserter;

    private GroupCollector(CompiledPlan plan, Supplier<? extends C> innerFactory, Inserter<? super C> inserter) {
        this.plan = plan;
        this.executor = new QueryExecutor(plan);
        this.innerFactory = Objects.requireNonNull(innerFactory, "innerFactory");
        this.inserter = Objects.requireNonNull(inserter, "inserter");
    }

    public static <C> GroupCollector<C> compile(QueryNode root, Supplier<? extends C> innerFactory,
                                                Inserter<? super C> inserter) {
        return of(new QueryCompiler().compile(root), innerFactory, inserter);
    }

    /**
     * @throws IllegalArgumentException if the plan has no group leaves
     */
    public static <C> GroupCollector<C> of(CompiledPlan plan, Supplier<? extends C> innerFactory,
                                           Inserter<? super C> inserter) {
        if (plan.strategy() != CompiledPlan.Strategy.GROUPED) {
            throw new IllegalArgumentException("A group collector needs at least one group leaf");
        }
        return new GroupCollector<>(plan, innerFactory, inserter);
    }

    @Override
    public MutableMap<Object, Object> collect(Iterable<?> records) {
        MutableMap<Object, Object> result = Maps.mutable.empty();
        ScratchBuffer scratch = new ScratchBuffer(plan);
        Counter commits = new Counter();
        Counter containers = new Counter();
        int seen = 0;
        for (Object record : records) {
            executor.execute(record, scratch, () -> {
                C container = locate(result, scratch, containers);
                inserter.insert(container, scratch.elements());
                commits.increment();
            });
            seen++;
        }
        LOGGER.debug("Collected {} record(s) into {} insertion(s) across {} container(s)",
                seen, commits.getCount(), containers.getCount());
        return result;
    }

    @SuppressWarnings("unchecked")
    private C locate(MutableMap<Object, Object> top, ScratchBuffer scratch, Counter containers) {
        MutableMap<Object, Object> level = top;
        int last = scratch.groupCount();
        for (int position = 1; position < last; position++) {
            level = (MutableMap<Object, Object>) level.getIfAbsentPut(scratch.group(position),
                    () -> Maps.mutable.<Object, Object>empty());
        }
        return (C) level.getIfAbsentPut(scratch.group(last), () -> {
            containers.increment();
            return Objects.requireNonNull(innerFactory.get(), "Inner factory returned null");
        });
    }

    @Override
    public CompiledPlan plan() {
        return plan;
    }
}
