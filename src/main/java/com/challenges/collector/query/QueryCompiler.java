package com.challenges.collector.query;

import org.eclipse.collections.api.bag.primitive.MutableIntBag;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.primitive.IntBags;
import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Validates a query tree and turns it into a {@link CompiledPlan}.
 *
 * <p>Works in two passes. The first flattens the tree into the list of its leaves
 * and fan-outs, tagging every fan-out branch that contains an iteration. The second
 * checks the tags and the position numbering against the whole tree. Nothing is
 * returned unless every check passes.
 */
public class QueryCompiler {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryCompiler.class);

    public CompiledPlan compile(QueryNode root) {
        Objects.requireNonNull(root, "root");

        TreeSummary summary = new TreeSummary();
        flatten(root, NodePath.root(), summary);

        ImmutableList<Violation> violations = check(summary);
        if (violations.notEmpty()) {
            throw new QueryCompilationException(violations);
        }

        CompiledPlan plan = new CompiledPlan(root, summary.count(LeafKind.ELEMENT), summary.count(LeafKind.GROUP));
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Compiled {} plan with {} element(s) and {} group(s): {}",
                    plan.strategy(), plan.elementCount(), plan.groupCount(), plan.describe());
        }
        return plan;
    }

    // Pass 1: flatten and tag. Returns whether the subtree contains an iteration.
    private boolean flatten(QueryNode node, NodePath path, TreeSummary summary) {
        if (node instanceof QueryNode.Select select) {
            return flatten(select.child(), path.child("select(" + select.key() + ")"), summary);
        }
        if (node instanceof QueryNode.Iterate iterate) {
            flatten(iterate.child(), path.child("iterate"), summary);
            return true;
        }
        if (node instanceof QueryNode.Fanout fanout) {
            NodePath fanoutPath = path.child("fanout");
            MutableIntList iterating = IntLists.mutable.empty();
            summary.fanouts.add(new FanoutInfo(fanoutPath, fanout.children().size(), iterating));
            for (int i = 0; i < fanout.children().size(); i++) {
                if (flatten(fanout.children().get(i), fanoutPath.branch(i), summary)) {
                    iterating.add(i);
                }
            }
            return iterating.notEmpty();
        }
        if (node instanceof QueryNode.ElementLeaf element) {
            summary.leaves.add(new LeafInfo(LeafKind.ELEMENT, element.position(),
                    path.child("element(" + element.position() + ")")));
            return false;
        }
        if (node instanceof QueryNode.GroupLeaf group) {
            summary.leaves.add(new LeafInfo(LeafKind.GROUP, group.position(),
                    path.child("group(" + group.position() + ")")));
            return false;
        }
        if (node instanceof QueryNode.Guard) {
            return false;
        }
        throw new IllegalStateException("Unknown query node: " + node);
    }

    // Pass 2: range checks over the flattened tree.
    private ImmutableList<Violation> check(TreeSummary summary) {
        MutableList<Violation> violations = Lists.mutable.empty();

        for (FanoutInfo fanout : summary.fanouts) {
            if (fanout.branches() < 2) {
                violations.add(new Violation(Violation.Kind.INSUFFICIENT_BRANCHES, fanout.path(),
                        "A fan-out needs at least 2 branches, found " + fanout.branches() + "."));
            }
            if (fanout.iterating().size() > 1) {
                violations.add(new Violation(Violation.Kind.MULTIPLE_ITERATION_PATHS, fanout.path(),
                        "Only one branch of a fan-out may iterate, branches "
                                + fanout.iterating().makeString(", ") + " do."));
            }
        }

        if (summary.count(LeafKind.ELEMENT) == 0) {
            violations.add(new Violation(Violation.Kind.NO_ELEMENTS, NodePath.root(),
                    "A query needs at least one element."));
        }
        checkPositions(summary, LeafKind.ELEMENT, violations);
        checkPositions(summary, LeafKind.GROUP, violations);
        return violations.toImmutable();
    }

    private void checkPositions(TreeSummary summary, LeafKind kind, MutableList<Violation> violations) {
        MutableIntBag seen = IntBags.mutable.empty();
        MutableList<LeafInfo> firstAt = Lists.mutable.empty();
        for (LeafInfo leaf : summary.leaves) {
            if (leaf.kind() != kind) {
                continue;
            }
            if (leaf.position() < 1) {
                violations.add(new Violation(Violation.Kind.INVALID_POSITION, leaf.path(),
                        "Positions start at 1, got " + leaf.position() + "."));
                continue;
            }
            if (seen.contains(leaf.position())) {
                LeafInfo first = firstAt.detect(other -> other.position() == leaf.position());
                violations.add(new Violation(Violation.Kind.DUPLICATE_POSITION, leaf.path(),
                        "In the " + kind.plural + ": position " + leaf.position()
                                + " is already used at " + first.path() + "."));
            } else {
                firstAt.add(leaf);
            }
            seen.add(leaf.position());
        }

        if (seen.isEmpty()) {
            return;
        }
        int[] present = seen.toSet().toSortedArray();
        long missing = (long) present[present.length - 1] - present.length;
        if (missing > 0) {
            String counted = missing == 1
                    ? "there is 1 missing position"
                    : "there are " + missing + " missing positions";
            violations.add(new Violation(Violation.Kind.MISSING_POSITION, NodePath.root(),
                    "In the " + kind.plural + ": " + counted + ". Missing: " + missingRanges(present) + "."));
        }
    }

    /**
     * Renders the positions absent below the largest present one. Each gap between
     * neighbours is one run; runs of three or more are folded into {@code a..b}.
     *
     * @param present sorted distinct positions, all at least 1
     */
    static String missingRanges(int[] present) {
        MutableList<String> parts = Lists.mutable.empty();
        int previous = 0;
        for (int position : present) {
            int first = previous + 1;
            int last = position - 1;
            if (last - first >= 2) {
                parts.add(first + ".." + last);
            } else {
                for (int missing = first; missing <= last; missing++) {
                    parts.add(String.valueOf(missing));
                }
            }
            previous = position;
        }
        return parts.makeString(", ");
    }

    private enum LeafKind {
        ELEMENT("elements"),
        GROUP("groups");

        private final String plural;

        LeafKind(String plural) {
            this.plural = plural;
        }
    }

    private record LeafInfo(LeafKind kind, int position, NodePath path) {
    }

    private record FanoutInfo(NodePath path, int branches, MutableIntList iterating) {
    }

    private static final class TreeSummary {
        private final MutableList<LeafInfo> leaves = Lists.mutable.empty();
        private final MutableList<FanoutInfo> fanouts = Lists.mutable.empty();

        int count(LeafKind kind) {
            return leaves.count(leaf -> leaf.kind() == kind);
        }
    }
}
