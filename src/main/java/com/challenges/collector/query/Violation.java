package com.challenges.collector.query;

/**
 * A single reason a query tree cannot be compiled.
 */
public record Violation(Kind kind, NodePath path, String detail) {

    public enum Kind {
        /** A position in 1..N is not used by any leaf. */
        MISSING_POSITION,
        /** Two leaves of the same kind share a position. */
        DUPLICATE_POSITION,
        /** A fan-out with fewer than two branches. */
        INSUFFICIENT_BRANCHES,
        /** More than one branch of a fan-out iterates. */
        MULTIPLE_ITERATION_PATHS,
        /** A position below 1. */
        INVALID_POSITION,
        /** The tree has no element leaf. */
        NO_ELEMENTS
    }

    @Override
    public String toString() {
        return kind + " at " + path + ": " + detail;
    }
}
