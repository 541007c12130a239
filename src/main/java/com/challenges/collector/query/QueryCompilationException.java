package com.challenges.collector.query;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * Thrown by {@link QueryCompiler} when a query tree breaks one of its structural
 * or numbering rules. Carries every violation found, in the order the checks found them.
 */
public class QueryCompilationException extends RuntimeException {
    private final ImmutableList<Violation> violations;

    public QueryCompilationException(ImmutableList<Violation> violations) {
        super(describe(violations));
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("A compilation failure needs at least one violation");
        }
        this.violations = violations;
    }

    public ImmutableList<Violation> violations() {
        return violations;
    }

    /**
     * @return the kind of the first violation
     */
    public Violation.Kind kind() {
        return violations.getFirst().kind();
    }

    private static String describe(ImmutableList<Violation> violations) {
        return "Invalid query:" + violations.collect(v -> "\n - " + v).makeString("");
    }
}
