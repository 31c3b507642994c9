package com.exprgraph.engine;

import com.exprgraph.api.FailureKind;
import com.exprgraph.api.GraphListener;
import com.exprgraph.api.GraphLogEvent;
import com.exprgraph.expr.EvaluationFailure;
import com.exprgraph.io.StoreOptions;
import com.exprgraph.node.DerivedEdge;
import com.exprgraph.node.GraphNode;
import com.exprgraph.node.Position;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class GraphStoreTest {

    private GraphStore store;
    private int a;
    private int b;
    private int c;

    @Before
    public void setUp() {
        store = new GraphStore();
        a = store.createNode("1", "A", null).subjectId();
        b = store.createNode("\"A\" + 1", "B", null).subjectId();
        c = store.createNode("\"B\" + 1", "C", null).subjectId();
    }

    @Test
    public void testChainResolves() {
        assertEquals(1.0, store.node(a).value(), 0.0);
        assertEquals(2.0, store.node(b).value(), 0.0);
        assertEquals(3.0, store.node(c).value(), 0.0);
        assertEquals(List.of(new DerivedEdge(a, b), new DerivedEdge(b, c)), store.derivedEdges());
    }

    @Test
    public void testIdsStartAtOneAndAreNeverReused() {
        assertEquals(1, a);
        assertEquals(2, b);
        assertEquals(3, c);
        store.deleteNode(c);
        int d = store.createNode(5, "D", null).subjectId();
        assertEquals(4, d);
    }

    @Test
    public void testDeleteLeavesDependentUnresolved() {
        MutationResult r = store.deleteNode(a);

        assertFalse(store.findByLabel("A").isPresent());
        assertEquals(1, r.failures().size());
        EvaluationFailure f = r.failures().get(0);
        assertEquals(b, f.nodeId());
        assertEquals(FailureKind.UNRESOLVED_REFERENCE, f.kind());

        // B keeps its last good value and records the failure
        GraphNode bNode = store.node(b);
        assertEquals(2.0, bNode.value(), 0.0);
        assertNotNull(bNode.lastFailure());
        assertEquals(List.of(new DerivedEdge(b, c)), store.derivedEdges());
    }

    @Test
    public void testRenameRewritesReferencesAndKeepsTopology() {
        List<DerivedEdge> before = store.derivedEdges();

        MutationResult r = store.renameNode(a, "Alpha");

        assertEquals("\"Alpha\" + 1", store.node(b).valueExpression());
        assertEquals("\"B\" + 1", store.node(c).valueExpression());
        assertEquals(before, store.derivedEdges());
        assertEquals(before, store.deriveEdges());
        assertEquals(GraphLogEvent.Kind.RENAMED, r.events().get(0).kind());
        assertEquals("label: A → Alpha", r.events().get(0).message());
        assertEquals(GraphLogEvent.Kind.EXPRESSION_REWRITTEN, r.events().get(1).kind());
        assertEquals(2, r.events().size());

        // values resolve unchanged under the new label
        store.evaluateAll();
        assertEquals(3.0, store.node(c).value(), 0.0);
    }

    @Test
    public void testRenameRewritesSelfReference() {
        store.editExpression(c, "\"C\" + 1");
        store.renameNode(c, "Z");
        assertEquals("\"Z\" + 1", store.node(c).valueExpression());
    }

    @Test
    public void testRenameToSameLabelIsNoChange() {
        MutationResult r = store.renameNode(a, "A");
        assertFalse(r.changed());
        assertTrue(r.events().isEmpty());
    }

    @Test
    public void testUnknownIdLeavesStateUntouched() {
        long rev = store.revision();
        GraphSnapshot before = store.snapshot();
        try {
            store.renameNode(99, "Z");
            fail("Expected UnknownIdException");
        } catch (UnknownIdException e) {
            assertEquals(99, e.id());
            assertEquals("node", e.entity());
        }
        assertEquals(rev, store.revision());
        assertEquals(before, store.snapshot());
    }

    @Test
    public void testDuplicateLabelRejected() {
        long rev = store.revision();
        try {
            store.createNode("2", "A", null);
            fail("Expected DuplicateLabelException");
        } catch (DuplicateLabelException e) {
            assertEquals("A", e.label());
        }
        try {
            store.renameNode(c, "B");
            fail("Expected DuplicateLabelException");
        } catch (DuplicateLabelException e) {
            assertEquals("B", e.label());
        }
        assertEquals(3, store.nodes().size());
        assertEquals(rev, store.revision());
    }

    @Test(expected = DuplicateLabelException.class)
    public void testLabelWithDelimiterRejected() {
        store.renameNode(a, "say \"hi\"");
    }

    @Test(expected = DuplicateLabelException.class)
    public void testBlankLabelRejected() {
        store.createNode(1, "  ", null);
    }

    @Test
    public void testDefaultNodes() {
        GraphStore fresh = new GraphStore();
        GraphNode first = fresh.createNode().node();
        GraphNode second = fresh.createNode().node();

        assertEquals("New node", first.label());
        assertEquals("New node 2", second.label());
        assertEquals(1.0, first.value(), 0.0);
        assertEquals("1", first.valueExpression());
        assertEquals(Position.CENTER, first.position());
    }

    @Test
    public void testCreateWithBrokenExpressionStartsAtZero() {
        MutationResult r = store.createNode("\"Nope\" * 2", "D", null);
        assertEquals(0.0, r.node().value(), 0.0);
        assertEquals(FailureKind.UNRESOLVED_REFERENCE, r.node().lastFailure().kind());
        assertTrue(r.hasFailures());
    }

    @Test
    public void testEditPropagatesDownstream() {
        MutationResult r = store.editExpression(a, "5");

        assertEquals(5.0, store.node(a).value(), 0.0);
        assertEquals(6.0, store.node(b).value(), 0.0);
        assertEquals(7.0, store.node(c).value(), 0.0);
        assertEquals(3, r.events().size());
        assertEquals("A: 1 → 5", r.events().get(0).message());
        assertEquals("C: 3 → 7", r.events().get(2).message());
    }

    @Test
    public void testEditWithoutPropagationLeavesDependentsStale() {
        StoreOptions options = StoreOptions.defaults();
        options.setPropagateOnEdit(false);
        GraphStore lazy = new GraphStore(options);
        int x = lazy.createNode("1", "X", null).subjectId();
        int y = lazy.createNode("\"X\" * 10", "Y", null).subjectId();

        lazy.editExpression(x, "2");
        assertEquals(10.0, lazy.node(y).value(), 0.0);

        lazy.evaluate(y);
        assertEquals(20.0, lazy.node(y).value(), 0.0);
    }

    @Test
    public void testFailedEditKeepsLastGoodValue() {
        MutationResult r = store.editExpression(a, "1 +");

        assertEquals(3, r.failures().size());
        for (EvaluationFailure f : r.failures())
            assertEquals(FailureKind.MALFORMED_EXPRESSION, f.kind());
        assertEquals(1.0, store.node(a).value(), 0.0);
        assertEquals(3.0, store.node(c).value(), 0.0);
        assertEquals("1 +", store.node(a).valueExpression());

        store.editExpression(a, "2");
        assertNull(store.node(a).lastFailure());
        assertNull(store.node(c).lastFailure());
        assertEquals(4.0, store.node(c).value(), 0.0);
    }

    @Test
    public void testCycleReportedNotLooped() {
        MutationResult r = store.editExpression(a, "\"C\" + 1");

        assertEquals(3, r.failures().size());
        assertEquals(FailureKind.CYCLIC_DEPENDENCY, r.failures().get(0).kind());
        assertEquals("Cyclic dependency: A -> C -> B -> A", r.failures().get(0).message());
        assertEquals(1.0, store.node(a).value(), 0.0);
        assertTrue(store.derivedEdges().contains(new DerivedEdge(c, a)));
    }

    @Test
    public void testMoveClampsAndDoesNotEvaluate() {
        MutationResult r = store.moveNode(b, 1.5, -0.25);

        assertEquals(new Position(1.0, 0.0), store.node(b).position());
        assertTrue(r.events().isEmpty());
        assertFalse(store.moveNode(b, 1.0, 0.0).changed());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMoveRejectsNaN() {
        store.moveNode(b, Double.NaN, 0.5);
    }

    @Test
    public void testSelection() {
        assertTrue(store.selection().isNode(c));

        store.select(a);
        assertTrue(store.selection().isNode(a));

        store.deleteNode(a);
        assertEquals(Selection.NONE, store.selection());

        store.select(b);
        store.deleteNode(c);
        assertTrue(store.selection().isNode(b));
        assertEquals(-1, store.clearSelection().subjectId());
        assertEquals(Selection.NONE, store.selection());
    }

    @Test(expected = IllegalStateException.class)
    public void testTypedEdgeOperationsRejectedInExpressionMode() {
        store.createEdge(a, b, com.exprgraph.api.EdgeKind.INCREMENT);
    }

    @Test
    public void testRevisionAdvancesPerMutation() {
        long rev = store.revision();
        GraphSnapshot snap = store.moveNode(a, 0.1, 0.1).snapshot();
        assertEquals(rev + 1, store.revision());
        assertEquals(store.revision(), snap.revision());
    }

    @Test
    public void testSnapshotIsIsolatedFromLaterMutations() {
        GraphSnapshot snap = store.snapshot();
        store.editExpression(a, "10");
        assertEquals(1.0, snap.nodeByLabel("A").get().value(), 0.0);
        assertEquals(10.0, store.findByLabel("A").get().value(), 0.0);
    }

    @Test
    public void testListenerCallbacks() {
        final List<String> ops = new ArrayList<>();
        final List<Integer> evaluated = new ArrayList<>();
        final List<EvaluationFailure> failed = new ArrayList<>();

        GraphListener listener = new GraphListener() {
            @Override
            public void onMutationApplied(long revision, String operation, MutationResult result) {
                ops.add(operation);
                assertEquals(revision, result.snapshot().revision());
            }

            @Override
            public void onNodeEvaluated(long revision, int nodeId, String label, double previous, double current) {
                evaluated.add(nodeId);
            }

            @Override
            public void onNodeFailed(long revision, EvaluationFailure failure) {
                failed.add(failure);
            }
        };
        store.addListener(listener);

        store.editExpression(a, "2");
        store.deleteNode(a);

        assertEquals(List.of("editExpression", "deleteNode"), ops);
        assertEquals(List.of(a, b, c), evaluated);
        assertEquals(1, failed.size());
        assertEquals(b, failed.get(0).nodeId());

        assertTrue(store.removeListener(listener));
        store.moveNode(b, 0, 0);
        assertEquals(2, ops.size());
    }

    @Test
    public void testRenameResolvesDanglingReference() {
        int d = store.createNode("\"X\" + 1", "D", null).subjectId();
        assertEquals(FailureKind.UNRESOLVED_REFERENCE, store.node(d).lastFailure().kind());

        MutationResult r = store.renameNode(a, "X");

        assertEquals(2.0, store.node(d).value(), 0.0);
        assertNull(store.node(d).lastFailure());
        assertTrue(store.derivedEdges().contains(new DerivedEdge(a, d)));
        assertFalse(r.hasFailures());
        assertEquals("D: 0 → 2", r.events().get(r.events().size() - 1).message());
    }

    @Test
    public void testCreateResolvesDanglingReferenceAndDependents() {
        int e = store.createNode("\"Y\" * 2", "E", null).subjectId();
        int f = store.createNode("\"E\" + 1", "F", null).subjectId();
        assertNotNull(store.node(f).lastFailure());

        MutationResult r = store.createNode("4", "Y", null);

        assertEquals(8.0, store.node(e).value(), 0.0);
        assertEquals(9.0, store.node(f).value(), 0.0);
        assertNull(store.node(e).lastFailure());
        assertNull(store.node(f).lastFailure());
        assertEquals(2, r.events().size());
        assertEquals("E: 0 → 8", r.events().get(0).message());
        // the created node stays the subject and the selection
        assertEquals("Y", r.node().label());
        assertTrue(store.selection().isNode(r.subjectId()));
    }

    @Test
    public void testDeeplyNestedExpressionFailsInsideMutation() {
        String deep = "(".repeat(20_000) + "1" + ")".repeat(20_000);
        long rev = store.revision();

        MutationResult r = store.createNode(deep, "Deep", null);

        assertEquals(FailureKind.MALFORMED_EXPRESSION, r.node().lastFailure().kind());
        assertEquals(rev + 1, store.revision());
        assertTrue(store.selection().isNode(r.subjectId()));
    }

    @Test
    public void testOverlongReferenceChainFailsInsideMutation() {
        GraphStore chainStore = new GraphStore();
        chainStore.createNode("1", "N0", null);
        int length = 600;
        for (int k = 1; k < length; k++)
            chainStore.createNode("\"N" + (k - 1) + "\" + 1", "N" + k, null);

        assertEquals(length, chainStore.nodes().size());
        assertEquals(length, chainStore.revision());
        GraphNode deepest = chainStore.findByLabel("N" + (length - 1)).get();
        assertEquals(FailureKind.MALFORMED_EXPRESSION, deepest.lastFailure().kind());
        GraphNode shallow = chainStore.findByLabel("N100").get();
        assertEquals(101.0, shallow.value(), 0.0);
    }
}
