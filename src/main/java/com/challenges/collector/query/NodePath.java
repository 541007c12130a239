package com.challenges.collector.query;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Location of a node in a query tree, rendered like
 * {@code $.select(orders).iterate.fanout[1].element(2)}.
 */
public record NodePath(ImmutableList<String> segments) {

    private static final NodePath ROOT = new NodePath(Lists.immutable.empty());

    public static NodePath root() {
        return ROOT;
    }

    public NodePath child(String segment) {
        return new NodePath(segments.newWith(segment));
    }

    public NodePath branch(int index) {
        return child("[" + index + "]");
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("$");
        for (String segment : segments) {
            if (!segment.startsWith("[")) {
                sb.append('.');
            }
            sb.append(segment);
        }
        return sb.toString();
    }
}
