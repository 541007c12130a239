package com.challenges.collector.query;

import org.eclipse.collections.impl.factory.Lists;

/**
 * Static factories for building query trees literally:
 *
 * <pre>{@code
 * Query.path(".orders[]", Query.fanout(
 *         Query.select("shipmentStore", Query.group(1)),
 *         Query.select("status", Query.group(2)),
 *         Query.path(".items[]", Query.fanout(
 *                 Query.select("quantity", Query.element(3)),
 *                 Query.select("id", Query.element(1)),
 *                 Query.path(".offer.name", Query.element(2))))));
 * }</pre>
 */
public final class Query {
    private static final PathParser PATH_PARSER = new PathParser();

    private Query() {
    }

    public static QueryNode select(Object key, QueryNode child) {
        return new QueryNode.Select(key, child);
    }

    public static QueryNode path(String path, QueryNode child) {
        return PATH_PARSER.parse(path, child);
    }

    public static QueryNode iterate(QueryNode child) {
        return new QueryNode.Iterate(child);
    }

    public static QueryNode fanout(QueryNode... children) {
        return new QueryNode.Fanout(Lists.immutable.with(children));
    }

    public static QueryNode.ElementLeaf element() {
        return element(1);
    }

    public static QueryNode.ElementLeaf element(int position) {
        return new QueryNode.ElementLeaf(position);
    }

    public static QueryNode.GroupLeaf group() {
        return group(1);
    }

    public static QueryNode.GroupLeaf group(int position) {
        return new QueryNode.GroupLeaf(position);
    }

    public static QueryNode.GroupLeaf group(int position, KeyTransform keyTransform) {
        return new QueryNode.GroupLeaf(position, keyTransform);
    }

    public static QueryNode.Guard guard() {
        return new QueryNode.Guard();
    }
}
