package com.challenges.collector.query;

import org.eclipse.collections.api.list.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Walks a {@link CompiledPlan} against input records.
 *
 * <p>Every node hands its results to a continuation: a terminal stores its value
 * and continues, a fan-out chains its branches so branch {@code i} continues into
 * branch {@code i + 1}, an iteration continues once per element. The continuation
 * at the root is the commit, so it runs exactly once for every tuple whose leaves
 * were all reached and accepted. A rejected leaf simply does not continue.
 */
public class QueryExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryExecutor.class);

    private final CompiledPlan plan;

    public QueryExecutor(CompiledPlan plan) {
        this.plan = Objects.requireNonNull(plan, "plan");
    }

    /**
     * Walks one record, running {@code commit} once per accepted tuple. The tuple
     * is readable from {@code scratch} for the duration of the commit.
     *
     * @throws LookupFailureException if a selected key or index is absent
     * @throws TypeMismatchException  if a value cannot be looked into or iterated
     */
    public void execute(Object record, ScratchBuffer scratch, Runnable commit) {
        walk(plan.root(), record, scratch, commit);
    }

    private void walk(QueryNode node, Object value, ScratchBuffer scratch, Runnable next) {
        if (node instanceof QueryNode.Select select) {
            walk(select.child(), lookup(value, select.key()), scratch, next);
        } else if (node instanceof QueryNode.Iterate iterate) {
            for (Object element : elementsOf(value)) {
                walk(iterate.child(), element, scratch, next);
            }
        } else if (node instanceof QueryNode.Fanout fanout) {
            branch(fanout.children(), 0, value, scratch, next);
        } else if (node instanceof QueryNode.ElementLeaf element) {
            if (accepted(element, value)) {
                scratch.setElement(element.position(), value);
                next.run();
            }
        } else if (node instanceof QueryNode.GroupLeaf group) {
            if (accepted(group, value)) {
                scratch.setGroup(group.position(), keyOf(group, value));
                next.run();
            }
        } else if (node instanceof QueryNode.Guard guard) {
            if (accepted(guard, value)) {
                next.run();
            }
        } else {
            throw new IllegalStateException("Unknown query node: " + node);
        }
    }

    private void branch(ImmutableList<QueryNode> children, int index, Object value,
                        ScratchBuffer scratch, Runnable next) {
        if (index == children.size()) {
            next.run();
            return;
        }
        walk(children.get(index), value, scratch, () -> branch(children, index + 1, value, scratch, next));
    }

    private boolean accepted(QueryNode.Terminal terminal, Object value) {
        if (terminal.accepts(value)) {
            return true;
        }
        LOGGER.trace("Rejected {} by {}", value, terminal);
        return false;
    }

    private Object lookup(Object value, Object key) {
        if (value instanceof Map<?, ?> map) {
            Object result = map.get(key);
            if (result == null && !map.containsKey(key)) {
                throw new LookupFailureException(key, "Key not found: " + key);
            }
            return result;
        }
        if (value instanceof List<?> list && key instanceof Number number) {
            if (!isIntegral(number)) {
                throw new TypeMismatchException("List index must be an integer, got " + key + " of type "
                        + TypeMismatchException.typeOf(key));
            }
            long index = number.longValue();
            // Handle negative indices
            if (index < 0) {
                index = list.size() + index;
            }
            if (index < 0 || index >= list.size()) {
                throw new LookupFailureException(key, "Index " + key + " out of bounds for length " + list.size());
            }
            return list.get((int) index);
        }
        throw new TypeMismatchException("Cannot look up " + key + " in a value of type "
                + TypeMismatchException.typeOf(value));
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Integer || number instanceof Long
                || number instanceof Short || number instanceof Byte;
    }

    private Iterable<?> elementsOf(Object value) {
        if (value instanceof Iterable<?> iterable) {
            return iterable;
        }
        if (value instanceof Object[] array) {
            return Arrays.asList(array);
        }
        throw new TypeMismatchException("Cannot iterate over a value of type " + TypeMismatchException.typeOf(value));
    }

    private Object keyOf(QueryNode.GroupLeaf group, Object value) {
        Object key = group.keyTransform() == null ? value : group.keyTransform().toKey(value);
        if (key != null && key.getClass().isArray()) {
            throw new TypeMismatchException("Group key of type " + TypeMismatchException.typeOf(key)
                    + " has no value-based equality, use a key transform");
        }
        return key;
    }
}
