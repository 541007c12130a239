package com.challenges.collector.query;

import com.challenges.collector.json.PlanFormatter;

/**
 * A validated query tree plus its position counts. Only {@link QueryCompiler}
 * creates plans; once created a plan never changes and can be shared between
 * threads and collectors.
 */
public final class CompiledPlan {

    public enum Strategy {
        /** No group leaves: everything goes into one container. */
        PLAIN,
        /** One nesting level per group position. */
        GROUPED
    }

    private final QueryNode root;
    private final int elementCount;
    private final int groupCount;

    CompiledPlan(QueryNode root, int elementCount, int groupCount) {
        this.root = root;
        this.elementCount = elementCount;
        this.groupCount = groupCount;
    }

    public QueryNode root() {
        return root;
    }

    public int elementCount() {
        return elementCount;
    }

    public int groupCount() {
        return groupCount;
    }

    public Strategy strategy() {
        return groupCount == 0 ? Strategy.PLAIN : Strategy.GROUPED;
    }

    /**
     * @return the plan tree as a compact query definition
     */
    public String describe() {
        return new PlanFormatter(false).format(root);
    }

    @Override
    public String toString() {
        return "CompiledPlan[elements=" + elementCount + ", groups=" + groupCount + ", root=" + describe() + "]";
    }
}
