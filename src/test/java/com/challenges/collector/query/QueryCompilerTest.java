package com.challenges.collector.query;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static com.challenges.collector.query.Query.element;
import static com.challenges.collector.query.Query.fanout;
import static com.challenges.collector.query.Query.group;
import static com.challenges.collector.query.Query.guard;
import static com.challenges.collector.query.Query.iterate;
import static com.challenges.collector.query.Query.path;
import static com.challenges.collector.query.Query.select;
import static org.junit.jupiter.api.Assertions.*;

public class QueryCompilerTest {

    private final QueryCompiler compiler = new QueryCompiler();

    private QueryCompilationException failure(QueryNode root) {
        return assertThrows(QueryCompilationException.class, () -> compiler.compile(root));
    }

    private static QueryNode ordersQuery() {
        return path(".orders[]", fanout(
                select("shipmentStore", group(1)),
                select("status", group(2)),
                path(".items[]", fanout(
                        select("quantity", element(3)),
                        select("id", element(1)),
                        path(".offer.name", element(2))))));
    }

    @Test
    public void testSingleElementIsPlain() {
        CompiledPlan plan = compiler.compile(element());

        assertEquals(1, plan.elementCount());
        assertEquals(0, plan.groupCount());
        assertEquals(CompiledPlan.Strategy.PLAIN, plan.strategy());
    }

    @Test
    public void testGroupedPlanCounts() {
        CompiledPlan plan = compiler.compile(ordersQuery());

        assertEquals(3, plan.elementCount());
        assertEquals(2, plan.groupCount());
        assertEquals(CompiledPlan.Strategy.GROUPED, plan.strategy());
    }

    @Test
    public void testElementAndGroupNumberingAreIndependent() {
        CompiledPlan plan = compiler.compile(fanout(select("a", element(1)), select("b", group(1))));

        assertEquals(1, plan.elementCount());
        assertEquals(1, plan.groupCount());
    }

    @Test
    public void testFanoutWithOneBranch() {
        QueryCompilationException e = failure(select("key", fanout(element())));

        assertEquals(Violation.Kind.INSUFFICIENT_BRANCHES, e.kind());
        assertEquals("$.select(key).fanout", e.violations().getFirst().path().toString());
    }

    @Test
    public void testDuplicateElementPosition() {
        QueryCompilationException e = failure(fanout(
                select("a", element(1)),
                select("b", element(2)),
                select("c", element(2))));

        assertEquals(1, e.violations().size());
        Violation violation = e.violations().getFirst();
        assertEquals(Violation.Kind.DUPLICATE_POSITION, violation.kind());
        assertEquals("$.fanout[2].select(c).element(2)", violation.path().toString());
        assertTrue(violation.detail().contains("$.fanout[1].select(b).element(2)"), violation.detail());
    }

    @Test
    public void testGapInElementPositions() {
        QueryCompilationException e = failure(fanout(select("a", element(1)), select("b", element(3))));

        assertEquals(Violation.Kind.MISSING_POSITION, e.kind());
        assertEquals("In the elements: there is 1 missing position. Missing: 2.",
                e.violations().getFirst().detail());
    }

    @Test
    public void testTwoIteratingSiblings() {
        QueryCompilationException e = failure(iterate(fanout(
                path(".a[]", element(1)),
                path(".b[]", element(2)))));

        Violation violation = e.violations().getFirst();
        assertEquals(Violation.Kind.MULTIPLE_ITERATION_PATHS, violation.kind());
        assertEquals("$.iterate.fanout", violation.path().toString());
        assertTrue(violation.detail().contains("0, 1"), violation.detail());
    }

    @Test
    public void testIterationDeepInsideBothBranches() {
        QueryCompilationException e = failure(fanout(
                select("a", fanout(select("x", element(1)), path(".y[]", element(2)))),
                select("b", path(".z.[]", element(3)))));

        assertEquals(Violation.Kind.MULTIPLE_ITERATION_PATHS, e.kind());
        assertEquals("$.fanout", e.violations().getFirst().path().toString());
    }

    @Test
    public void testNestedIterationAlongOnePath() {
        CompiledPlan plan = compiler.compile(iterate(fanout(
                path(".key[]", fanout(
                        path(".key[]", fanout(
                                select("key", element(2)),
                                select("key", element(3)))),
                        select("key", group(1)))),
                select("key", element(1)),
                select("key", group(2)))));

        assertEquals(3, plan.elementCount());
        assertEquals(2, plan.groupCount());
    }

    static Stream<Arguments> missingPositions() {
        return Stream.of(
                Arguments.of(fanout(select("key", element()), select("key", group(2)), select("key", group(3))),
                        "In the groups: there is 1 missing position. Missing: 1."),
                Arguments.of(fanout(select("key", element(2)), select("key", element(3)), select("key", element(5))),
                        "In the elements: there are 2 missing positions. Missing: 1, 4."),
                Arguments.of(select("key", fanout(
                                select("key", element(1)),
                                select("key", element(2)),
                                select("key", element(4)),
                                select("key", element(100)),
                                select("key", element(102)))),
                        "In the elements: there are 97 missing positions. Missing: 3, 5..99, 101.")
        );
    }

    @ParameterizedTest
    @MethodSource("missingPositions")
    public void testMissingPositionMessages(QueryNode root, String expected) {
        QueryCompilationException e = failure(root);

        assertEquals(Violation.Kind.MISSING_POSITION, e.kind());
        assertEquals(expected, e.violations().getFirst().detail());
        assertEquals("$", e.violations().getFirst().path().toString());
    }

    @Test
    public void testQueryWithoutElements() {
        assertEquals(Violation.Kind.NO_ELEMENTS, failure(select("key", group())).violations().getFirst().kind());
        assertEquals(Violation.Kind.NO_ELEMENTS, failure(select("key", guard().excludeAnyOf(false))).kind());
    }

    @Test
    public void testPositionBelowOne() {
        QueryCompilationException e = failure(fanout(select("a", element(0)), select("b", element(1))));

        assertEquals(Violation.Kind.INVALID_POSITION, e.kind());
        assertEquals("$.fanout[0].select(a).element(0)", e.violations().getFirst().path().toString());
    }

    @Test
    public void testEveryViolationIsReported() {
        QueryCompilationException e = failure(fanout(
                select("a", fanout(element(3))),
                select("b", element(1))));

        assertEquals(2, e.violations().size());
        assertEquals(Violation.Kind.INSUFFICIENT_BRANCHES, e.violations().get(0).kind());
        assertEquals(Violation.Kind.MISSING_POSITION, e.violations().get(1).kind());
        assertTrue(e.getMessage().contains("INSUFFICIENT_BRANCHES at $.fanout[0].select(a).fanout"), e.getMessage());
    }

    @Test
    public void testCompilationIsDeterministic() {
        CompiledPlan first = compiler.compile(ordersQuery());
        CompiledPlan second = new QueryCompiler().compile(ordersQuery());

        assertNotSame(first, second);
        assertEquals(first.root(), second.root());
        assertEquals(first.describe(), second.describe());
        assertEquals(first.elementCount(), second.elementCount());
        assertEquals(first.groupCount(), second.groupCount());
    }

    @Test
    public void testMissingRanges() {
        assertEquals("1, 2, 4..6, 9", QueryCompiler.missingRanges(new int[]{3, 7, 8, 10}));
        assertEquals("7", QueryCompiler.missingRanges(new int[]{1, 2, 3, 4, 5, 6, 8}));
        assertEquals("", QueryCompiler.missingRanges(new int[]{1, 2}));
    }

    @Test
    public void testLargestPossiblePosition() {
        QueryCompilationException e = failure(fanout(
                select("a", element(1)),
                select("b", element(Integer.MAX_VALUE))));

        assertEquals(Violation.Kind.MISSING_POSITION, e.kind());
        assertEquals("In the elements: there are 2147483645 missing positions. Missing: 2..2147483646.",
                e.violations().getFirst().detail());
    }
}
