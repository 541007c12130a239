package com.challenges.collector;

import org.eclipse.collections.api.block.procedure.Procedure2;

import java.util.Objects;

/**
 * Puts one committed tuple into a container. What "putting" means, such as
 * appending, counting or summing, is entirely up to the implementation.
 *
 * @param <C> the container type produced by the inner factory
 */
@FunctionalInterface
public interface Inserter<C> {

    /**
     * @param container the container to mutate
     * @param elements  the element values in position order; a fresh array on every call
     */
    void insert(C container, Object... elements);

    /**
     * Adapts a two-argument procedure to a query with a single element.
     */
    @SuppressWarnings("unchecked")
    static <C, E> Inserter<C> unary(Procedure2<? super C, ? super E> procedure) {
        Objects.requireNonNull(procedure, "procedure");
        return (container, elements) -> procedure.value(container, (E) elements[0]);
    }
}
