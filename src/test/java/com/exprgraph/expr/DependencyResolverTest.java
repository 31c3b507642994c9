package com.exprgraph.expr;

import com.exprgraph.api.FailureKind;
import com.exprgraph.node.GraphNode;
import com.exprgraph.node.Position;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.*;

public class DependencyResolverTest {

    private final DependencyResolver resolver = new DependencyResolver();

    private static GraphNode node(int id, String label, String expression) {
        return new GraphNode(id, label, Position.CENTER, 0, expression);
    }

    @Test
    public void testZeroReferenceExpressionEqualsArithmetic() {
        String[] literals = { "1", "2 * (3 + 4)", "10 / 4", "-2.5 + 1e2" };
        for (String lit : literals) {
            GraphNode n = node(1, "N", lit);
            assertEquals(lit, ArithmeticEvaluator.evaluate(lit), resolver.resolve(n, List.of(n)), 0.0);
        }
    }

    @Test
    public void testChainResolvesThroughExpressionsNotCachedValues() {
        // Cached values are deliberately wrong; only expressions count
        GraphNode a = new GraphNode(1, "A", Position.CENTER, 100, "1");
        GraphNode b = new GraphNode(2, "B", Position.CENTER, 200, "\"A\" + 1");
        GraphNode c = new GraphNode(3, "C", Position.CENTER, 300, "\"B\" + 1");
        assertEquals(3.0, resolver.resolve(c, List.of(a, b, c)), 0.0);
    }

    @Test
    public void testPlainValueNodeUsesStoredValue() {
        GraphNode a = new GraphNode(1, "A", Position.CENTER, 4, null);
        GraphNode b = node(2, "B", "\"A\" * \"A\"");
        assertEquals(16.0, resolver.resolve(b, List.of(a, b)), 0.0);
    }

    @Test
    public void testUnresolvedReference() {
        GraphNode b = node(2, "B", "\"A\" + 1");
        try {
            resolver.resolve(b, List.of(b));
            fail("Expected UnresolvedReferenceException");
        } catch (UnresolvedReferenceException e) {
            assertEquals("A", e.label());
            assertEquals(FailureKind.UNRESOLVED_REFERENCE, e.kind());
        }
    }

    @Test
    public void testMutualCycleDetected() {
        GraphNode a = node(1, "A", "\"B\" + 1");
        GraphNode b = node(2, "B", "\"A\" + 1");
        try {
            resolver.resolve(a, List.of(a, b));
            fail("Expected CyclicDependencyException");
        } catch (CyclicDependencyException e) {
            assertEquals(List.of("A", "B", "A"), e.cycle());
            assertEquals(FailureKind.CYCLIC_DEPENDENCY, e.kind());
        }
    }

    @Test
    public void testSelfReferenceDetected() {
        GraphNode a = node(1, "A", "\"A\" * 2");
        try {
            resolver.resolve(a, List.of(a));
            fail("Expected CyclicDependencyException");
        } catch (CyclicDependencyException e) {
            assertEquals(List.of("A", "A"), e.cycle());
        }
    }

    @Test
    public void testCycleBehindAcyclicPrefixReportsOnlyTheLoop() {
        GraphNode top = node(1, "Top", "\"X\"");
        GraphNode x = node(2, "X", "\"Y\"");
        GraphNode y = node(3, "Y", "\"X\"");
        try {
            resolver.resolve(top, List.of(top, x, y));
            fail("Expected CyclicDependencyException");
        } catch (CyclicDependencyException e) {
            assertEquals(List.of("X", "Y", "X"), e.cycle());
        }
    }

    @Test
    public void testDiamondIsNotACycle() {
        GraphNode a = node(1, "A", "2");
        GraphNode b = node(2, "B", "\"A\" * 3");
        GraphNode c = node(3, "C", "\"A\" + 1");
        GraphNode d = node(4, "D", "\"B\" + \"C\"");
        assertEquals(9.0, resolver.resolve(d, List.of(a, b, c, d)), 0.0);
    }

    @Test
    public void testResultIndependentOfNodeOrder() {
        List<GraphNode> nodes = new ArrayList<>(List.of(
                node(1, "A", "2"),
                node(2, "B", "\"A\" * 3"),
                node(3, "C", "\"B\" - \"A\""),
                node(4, "D", "(\"C\" + \"B\") / \"A\"")));
        GraphNode d = nodes.get(3);
        double expected = resolver.resolve(d, nodes);
        assertEquals(5.0, expected, 0.0);

        Random rnd = new Random(42);
        for (int i = 0; i < 20; i++) {
            Collections.shuffle(nodes, rnd);
            assertEquals(expected, resolver.resolve(d, nodes), 0.0);
        }
    }

    @Test
    public void testTryResolveReportsFailureAsData() {
        GraphNode a = node(7, "A", "1 / 0");
        EvaluationResult r = resolver.tryResolve(a, DependencyResolver.indexByLabel(List.of(a)));
        assertFalse(r.isSuccess());
        assertEquals(7, r.failure().nodeId());
        assertEquals("A", r.failure().label());
        assertEquals(FailureKind.MALFORMED_EXPRESSION, r.failure().kind());
    }

    @Test(expected = IllegalStateException.class)
    public void testFailedResultHasNoValue() {
        GraphNode a = node(1, "A", "\"Nope\"");
        resolver.tryResolve(a, DependencyResolver.indexByLabel(List.of(a))).value();
    }

    private static List<GraphNode> chain(int length) {
        List<GraphNode> nodes = new ArrayList<>(length);
        nodes.add(node(1, "N0", "1"));
        for (int k = 1; k < length; k++)
            nodes.add(node(k + 1, "N" + k, "\"N" + (k - 1) + "\" + 1"));
        return nodes;
    }

    @Test
    public void testLongChainWithinLimitResolves() {
        List<GraphNode> nodes = chain(DependencyResolver.MAX_CHAIN_DEPTH);
        GraphNode last = nodes.get(nodes.size() - 1);
        assertEquals(DependencyResolver.MAX_CHAIN_DEPTH, resolver.resolve(last, nodes), 0.0);
    }

    @Test
    public void testOverlongChainFailsAsMalformed() {
        List<GraphNode> nodes = chain(10_000);
        GraphNode last = nodes.get(nodes.size() - 1);
        EvaluationResult r = resolver.tryResolve(last, DependencyResolver.indexByLabel(nodes));
        assertFalse(r.isSuccess());
        assertEquals(FailureKind.MALFORMED_EXPRESSION, r.failure().kind());
    }

    @Test(timeout = 5000)
    public void testSharedAncestorsResolvedOncePerCall() {
        // L_k and R_k both depend on L_(k-1) and R_(k-1): 2^k paths, k+1 distinct values
        int depth = 40;
        List<GraphNode> nodes = new ArrayList<>();
        nodes.add(node(1, "L0", "1"));
        nodes.add(node(2, "R0", "1"));
        for (int k = 1; k <= depth; k++) {
            String expr = "\"L" + (k - 1) + "\" + \"R" + (k - 1) + "\"";
            nodes.add(node(2 * k + 1, "L" + k, expr));
            nodes.add(node(2 * k + 2, "R" + k, expr));
        }
        GraphNode top = nodes.get(nodes.size() - 1);
        assertEquals(Math.pow(2, depth), resolver.resolve(top, nodes), 0.0);
    }
}
