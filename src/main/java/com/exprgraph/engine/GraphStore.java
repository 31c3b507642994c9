package com.exprgraph.engine;

import java.util.*;

import com.exprgraph.api.EdgeKind;
import com.exprgraph.api.EvaluationMode;
import com.exprgraph.api.GraphListener;
import com.exprgraph.api.GraphLogEvent;
import com.exprgraph.expr.DependencyResolver;
import com.exprgraph.expr.EvaluationFailure;
import com.exprgraph.expr.EvaluationResult;
import com.exprgraph.expr.ExpressionSubstitutor;
import com.exprgraph.expr.LabelReferenceExtractor;
import com.exprgraph.io.StoreOptions;
import com.exprgraph.node.DerivedEdge;
import com.exprgraph.node.GraphNode;
import com.exprgraph.node.Position;
import com.exprgraph.node.TypedEdge;
import com.exprgraph.util.CompositeGraphListener;

import lombok.extern.log4j.Log4j2;

/**
 * The single owner of a graph's nodes and edges.
 *
 * <p>
 * Every mutation follows the same shape:
 * <ol>
 * <li>Validate: unknown ids and invalid labels are rejected before anything
 * changes.</li>
 * <li>Apply the structural change.</li>
 * <li>Re-derive: in {@link EvaluationMode#EXPRESSION} mode the edge set is
 * rebuilt from scratch by the {@link EdgeDeriver}.</li>
 * <li>Re-evaluate whatever the mutation calls for. Failures are caught here,
 * attached to the node, and returned; the node keeps its last good value.</li>
 * <li>Commit: bump the revision, notify listeners, return a
 * {@link MutationResult}.</li>
 * </ol>
 * Callers only ever see immutable snapshots, so the state between steps 2 and
 * 3 is never observable.
 *
 * <p>
 * Not thread-safe. One thread drives a store; use
 * {@link com.exprgraph.wiring.GraphCommandBus} to funnel commands from many
 * threads onto one.
 */
@Log4j2
public final class GraphStore {
    private final StoreOptions options;
    private final EvaluationMode mode;

    private final Map<Integer, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<Integer, TypedEdge> typedEdges = new LinkedHashMap<>();
    private List<DerivedEdge> derivedEdges = List.of();
    private final Set<Integer> impulses = new LinkedHashSet<>();
    private Selection selection = Selection.NONE;

    private final EdgeDeriver edgeDeriver = new EdgeDeriver();
    private final DependencyResolver resolver = new DependencyResolver();
    private final ImpulsePropagator impulsePropagator = new ImpulsePropagator();
    private final GenerationalPropagator generations = new GenerationalPropagator();
    private final CompositeGraphListener listeners = new CompositeGraphListener();

    private int nextNodeId = 1;
    private int nextEdgeId = 1;
    private long revision;

    public GraphStore() {
        this(StoreOptions.defaults());
    }

    public GraphStore(StoreOptions options) {
        this.options = options;
        this.mode = options.getMode();
    }

    /**
     * Rebuilds a store from previously captured state. Node values are taken as
     * given, not re-evaluated; derived edges are recomputed rather than
     * trusted.
     *
     * @throws UnknownIdException      if an edge or impulse names a missing node.
     * @throws DuplicateLabelException if two nodes share a label.
     */
    public static GraphStore restore(StoreOptions options, long revision, List<GraphNode> nodes,
            List<TypedEdge> edges, List<Integer> impulses) {
        GraphStore store = new GraphStore(options);
        for (GraphNode n : nodes) {
            if (store.nodes.containsKey(n.id()))
                throw new IllegalArgumentException("Duplicate node id: " + n.id());
            store.validateLabel(n.label(), n.id());
            store.nodes.put(n.id(), n);
            store.nextNodeId = Math.max(store.nextNodeId, n.id() + 1);
        }
        if (store.mode == EvaluationMode.TYPED_EDGE) {
            for (TypedEdge e : edges) {
                store.requireNode(e.sourceId());
                store.requireNode(e.targetId());
                if (store.typedEdges.putIfAbsent(e.id(), e) != null)
                    throw new IllegalArgumentException("Duplicate edge id: " + e.id());
                store.nextEdgeId = Math.max(store.nextEdgeId, e.id() + 1);
            }
            for (int id : impulses) {
                store.requireNode(id);
                store.impulses.add(id);
            }
        }
        store.rederive();
        store.revision = revision;
        log.info("Restored {} store: {} nodes, {} edges, revision {}", store.mode, store.nodes.size(),
                store.edgeCount(), revision);
        return store;
    }

    public void addListener(GraphListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(GraphListener listener) {
        return listeners.remove(listener);
    }

    // ── Node mutations ──────────────────────────────────────────────

    /** Creates a node with the configured default label, value and a centered position. */
    public MutationResult createNode() {
        return createNode(options.getDefaultValue(), null, Position.CENTER);
    }

    /**
     * Creates a node holding a plain number. In expression mode the number is
     * stored as the node's expression so other nodes can depend on it.
     */
    public MutationResult createNode(double value, String label, Position position) {
        if (!Double.isFinite(value))
            throw new IllegalArgumentException("Invalid value: " + value);
        String expression = mode == EvaluationMode.EXPRESSION ? ExpressionSubstitutor.format(value) : null;
        return addNode(expression, value, label, position);
    }

    /**
     * Creates a node defined by an expression. The value is computed once now;
     * if that fails the node starts at 0 and the failure is reported. With
     * {@code propagateOnEdit}, nodes that already quoted the new label (and
     * their dependents) are re-evaluated, since their reference now resolves.
     *
     * @param expression Value expression, e.g. {@code "A" * 2}.
     * @param label      Label, or null for a generated unique default.
     * @param position   Layout position, or null for the center.
     */
    public MutationResult createNode(String expression, String label, Position position) {
        if (expression == null || expression.isBlank())
            return createNode(options.getDefaultValue(), label, position);
        return addNode(expression, 0, label, position);
    }

    private MutationResult addNode(String expression, double initialValue, String label, Position position) {
        String effectiveLabel = label == null ? uniqueDefaultLabel() : label;
        validateLabel(effectiveLabel, -1);

        Mutation m = new Mutation("createNode");
        int id = nextNodeId++;
        GraphNode node = new GraphNode(id, effectiveLabel, position != null ? position : Position.CENTER,
                initialValue, expression);
        nodes.put(id, node);
        rederive();
        evaluateInto(m, List.of(id), false);
        if (propagatesExpressions()) {
            List<Integer> referrers = new ArrayList<>(referrersAndDependents(effectiveLabel));
            referrers.remove(Integer.valueOf(id));
            evaluateInto(m, referrers, true);
        }
        selection = Selection.node(id);
        log.info("Created node #{} '{}' = {}", id, effectiveLabel, expression);
        return commit(m, id);
    }

    /**
     * Renames a node and rewrites every expression that quoted the old label,
     * so all references keep pointing at the same node. With
     * {@code propagateOnEdit}, every node quoting the new label is then
     * re-evaluated together with its dependents, which picks up references
     * that were dangling until now.
     */
    public MutationResult renameNode(int id, String newLabel) {
        GraphNode node = requireNode(id);
        Mutation m = new Mutation("renameNode");
        String oldLabel = node.label();
        if (oldLabel.equals(newLabel))
            return commit(m.unchanged(), id);
        validateLabel(newLabel, id);

        nodes.put(id, node.withLabel(newLabel));
        m.events.add(GraphLogEvent.renamed(id, oldLabel, newLabel));

        for (GraphNode n : List.copyOf(nodes.values())) {
            String expr = n.valueExpression();
            String rewritten = LabelReferenceExtractor.renameReferences(expr, oldLabel, newLabel);
            // untouched expressions come back as the same instance
            if (rewritten != expr) {
                nodes.put(n.id(), n.withExpression(rewritten));
                m.events.add(GraphLogEvent.expressionRewritten(n.id(), n.label(), expr, rewritten));
            }
        }
        rederive();
        if (propagatesExpressions())
            evaluateInto(m, referrersAndDependents(newLabel), true);
        log.info("Renamed node #{} '{}' -> '{}'", id, oldLabel, newLabel);
        return commit(m, id);
    }

    /**
     * Replaces a node's expression, re-derives edges and re-evaluates the node
     * (and, with {@code propagateOnEdit}, everything downstream of it).
     */
    public MutationResult editExpression(int id, String expression) {
        GraphNode node = requireNode(id);
        Mutation m = new Mutation("editExpression");
        String normalized = expression == null || expression.isBlank() ? null : expression;
        nodes.put(id, node.withExpression(normalized));
        rederive();

        List<Integer> targets = new ArrayList<>();
        targets.add(id);
        if (propagatesExpressions()) {
            for (int d : dependencyOrder().descendants(id))
                if (d != id)
                    targets.add(d);
        }
        evaluateInto(m, targets, true);
        return commit(m, id);
    }

    /** Moves a node. Coordinates are clamped into [0, 1]; nothing is re-evaluated. */
    public MutationResult moveNode(int id, double x, double y) {
        return moveNode(id, Position.clamped(x, y));
    }

    public MutationResult moveNode(int id, Position position) {
        if (position == null)
            throw new IllegalArgumentException("Position is required");
        GraphNode node = requireNode(id);
        Mutation m = new Mutation("moveNode");
        if (node.position().equals(position))
            return commit(m.unchanged(), id);
        nodes.put(id, node.withPosition(position));
        return commit(m, id);
    }

    /**
     * Deletes a node together with every edge touching it, its impulse and any
     * selection pointing at it. Nodes whose expressions referenced it are
     * re-evaluated (with {@code propagateOnEdit}) so the now dangling
     * references show up as failures.
     */
    public MutationResult deleteNode(int id) {
        GraphNode node = requireNode(id);
        Mutation m = new Mutation("deleteNode");

        List<Integer> dependents = new ArrayList<>();
        if (propagatesExpressions()) {
            for (GraphNode n : nodes.values())
                if (n.id() != id && LabelReferenceExtractor.extract(n.valueExpression()).contains(node.label()))
                    dependents.add(n.id());
        }

        nodes.remove(id);
        List<Integer> removedEdges = new ArrayList<>();
        typedEdges.values().removeIf(e -> {
            if (e.touches(id)) {
                removedEdges.add(e.id());
                return true;
            }
            return false;
        });
        impulses.remove(id);
        if (selection.isNode(id) || (selection.kind() == Selection.Kind.EDGE && removedEdges.contains(selection.id())))
            selection = Selection.NONE;
        if (generations.rootId() == id)
            generations.stop();
        rederive();

        List<Integer> targets = new ArrayList<>();
        if (!dependents.isEmpty()) {
            for (int d : dependencyOrder().order())
                if (dependents.contains(d))
                    targets.add(d);
            evaluateInto(m, targets, true);
        }
        log.info("Deleted node #{} '{}' ({} typed edge(s) removed)", id, node.label(), removedEdges.size());
        return commit(m, id);
    }

    /** Re-evaluates one node from its expression. */
    public MutationResult evaluate(int id) {
        requireNode(id);
        Mutation m = new Mutation("evaluate");
        evaluateInto(m, List.of(id), true);
        return commit(m, id);
    }

    /**
     * Re-evaluates every node, dependencies first, bringing all values back in
     * line with their expressions.
     */
    public MutationResult evaluateAll() {
        Mutation m = new Mutation("evaluateAll");
        List<Integer> order = mode == EvaluationMode.EXPRESSION
                ? dependencyOrder().order()
                : List.copyOf(nodes.keySet());
        evaluateInto(m, order, true);
        return commit(m, -1);
    }

    // ── Typed edges ─────────────────────────────────────────────────

    public MutationResult createEdge(int sourceId, int targetId, EdgeKind kind) {
        requireMode(EvaluationMode.TYPED_EDGE, "createEdge");
        requireNode(sourceId);
        requireNode(targetId);
        if (kind == null)
            throw new IllegalArgumentException("Edge kind is required");
        Mutation m = new Mutation("createEdge");
        int id = nextEdgeId++;
        typedEdges.put(id, new TypedEdge(id, sourceId, targetId, kind));
        selection = Selection.edge(id);
        log.info("Created {} edge #{}: #{} -> #{}", kind.wireName(), id, sourceId, targetId);
        return commit(m, id);
    }

    /**
     * Connects the first ordered pair of distinct nodes that has no edge yet,
     * as an increment edge. With fewer than two nodes, or when every pair is
     * connected, nothing is created and a warning event explains why.
     */
    public MutationResult createEdge() {
        requireMode(EvaluationMode.TYPED_EDGE, "createEdge");
        if (nodes.size() < 2) {
            Mutation m = new Mutation("createEdge").unchanged();
            m.events.add(GraphLogEvent.warning("Create at least two nodes before trying to create a connection."));
            return commit(m, -1);
        }
        for (GraphNode from : nodes.values()) {
            for (GraphNode to : nodes.values()) {
                if (from.id() != to.id() && !hasTypedEdge(from.id(), to.id()))
                    return createEdge(from.id(), to.id(), EdgeKind.INCREMENT);
            }
        }
        Mutation m = new Mutation("createEdge").unchanged();
        m.events.add(GraphLogEvent.warning("Fully connected graph. You can't create a new edge."));
        return commit(m, -1);
    }

    public MutationResult updateEdge(int edgeId, int sourceId, int targetId, EdgeKind kind) {
        requireMode(EvaluationMode.TYPED_EDGE, "updateEdge");
        TypedEdge edge = requireEdge(edgeId);
        requireNode(sourceId);
        requireNode(targetId);
        if (kind == null)
            throw new IllegalArgumentException("Edge kind is required");
        Mutation m = new Mutation("updateEdge");
        TypedEdge updated = new TypedEdge(edgeId, sourceId, targetId, kind);
        if (updated.equals(edge))
            return commit(m.unchanged(), edgeId);
        typedEdges.put(edgeId, updated);
        return commit(m, edgeId);
    }

    public MutationResult deleteEdge(int edgeId) {
        requireMode(EvaluationMode.TYPED_EDGE, "deleteEdge");
        requireEdge(edgeId);
        Mutation m = new Mutation("deleteEdge");
        typedEdges.remove(edgeId);
        if (selection.isEdge(edgeId))
            selection = Selection.NONE;
        log.info("Deleted edge #{}", edgeId);
        return commit(m, edgeId);
    }

    // ── Impulses ────────────────────────────────────────────────────

    /** Adds one to a node's value by hand and charges it for the next step. */
    public MutationResult increment(int id) {
        return manualImpulse(id, EdgeKind.INCREMENT, "increment");
    }

    /** Subtracts one from a node's value by hand and charges it for the next step. */
    public MutationResult decrement(int id) {
        return manualImpulse(id, EdgeKind.DECREMENT, "decrement");
    }

    private MutationResult manualImpulse(int id, EdgeKind kind, String operation) {
        requireMode(EvaluationMode.TYPED_EDGE, operation);
        GraphNode node = requireNode(id);
        Mutation m = new Mutation(operation);
        GraphNode updated = node.withValue(node.value() + kind.delta());
        nodes.put(id, updated);
        impulses.add(id);
        m.events.add(GraphLogEvent.manualImpulse(id, updated.label(), kind,
                ExpressionSubstitutor.format(updated.value())));
        return commit(m, id);
    }

    /**
     * Advances impulse propagation by one step. With no impulses the result
     * reports no change; the set stays as it is until {@link #resetImpulses()}.
     */
    public MutationResult propagate() {
        requireMode(EvaluationMode.TYPED_EDGE, "propagate");
        Mutation m = new Mutation("propagate");
        if (impulses.isEmpty())
            return commit(m.unchanged(), -1);

        ImpulsePropagator.StepResult step = impulsePropagator.step(List.copyOf(impulses),
                List.copyOf(typedEdges.values()), nodes);
        impulses.clear();
        impulses.addAll(step.nextImpulses());
        m.events.addAll(step.events());
        return commit(m, -1);
    }

    public MutationResult resetImpulses() {
        requireMode(EvaluationMode.TYPED_EDGE, "resetImpulses");
        Mutation m = new Mutation("resetImpulses");
        if (impulses.isEmpty())
            return commit(m.unchanged(), -1);
        impulses.clear();
        return commit(m, -1);
    }

    // ── Generational propagation ────────────────────────────────────

    /** Starts a depth-stepped walk downstream of {@code rootId}, at depth 0. */
    public MutationResult startGenerations(int rootId) {
        requireMode(EvaluationMode.EXPRESSION, "startGenerations");
        requireNode(rootId);
        Mutation m = new Mutation("startGenerations");
        generations.start(rootId);
        evaluateInto(m, List.of(rootId), true);
        return commit(m, rootId);
    }

    /**
     * Re-evaluates the next generation downstream of the root. Once no deeper
     * generation exists the walk wraps to depth 0 and re-targets the root.
     */
    public MutationResult stepGenerations() {
        requireMode(EvaluationMode.EXPRESSION, "stepGenerations");
        Mutation m = new Mutation("stepGenerations");
        GenerationalPropagator.Step step = generations.advance(dependencyOrder());
        evaluateInto(m, step.generation(), true);
        if (step.wrapped())
            log.debug("Generational walk wrapped to root #{}", generations.rootId());
        return commit(m, generations.rootId());
    }

    public MutationResult stopGenerations() {
        requireMode(EvaluationMode.EXPRESSION, "stopGenerations");
        Mutation m = new Mutation("stopGenerations");
        if (!generations.isActive())
            return commit(m.unchanged(), -1);
        generations.stop();
        return commit(m, -1);
    }

    // ── Selection ───────────────────────────────────────────────────

    public MutationResult select(int nodeId) {
        requireNode(nodeId);
        return changeSelection(Selection.node(nodeId), "select", nodeId);
    }

    public MutationResult selectEdge(int edgeId) {
        requireMode(EvaluationMode.TYPED_EDGE, "selectEdge");
        requireEdge(edgeId);
        return changeSelection(Selection.edge(edgeId), "selectEdge", edgeId);
    }

    public MutationResult clearSelection() {
        return changeSelection(Selection.NONE, "clearSelection", -1);
    }

    private MutationResult changeSelection(Selection next, String operation, int subject) {
        Mutation m = new Mutation(operation);
        if (selection.equals(next))
            return commit(m.unchanged(), subject);
        selection = next;
        return commit(m, subject);
    }

    // ── Queries ─────────────────────────────────────────────────────

    /**
     * @throws UnknownIdException if no such node exists.
     */
    public GraphNode node(int id) {
        return requireNode(id);
    }

    public Optional<GraphNode> findByLabel(String label) {
        for (GraphNode n : nodes.values())
            if (n.label().equals(label))
                return Optional.of(n);
        return Optional.empty();
    }

    public List<GraphNode> nodes() {
        return List.copyOf(nodes.values());
    }

    /** Derived edges as of the last mutation (empty in typed-edge mode). */
    public List<DerivedEdge> derivedEdges() {
        return derivedEdges;
    }

    public List<TypedEdge> typedEdges() {
        return List.copyOf(typedEdges.values());
    }

    /** Runs the edge deriver against the current nodes without mutating anything. */
    public List<DerivedEdge> deriveEdges() {
        return edgeDeriver.derive(nodes());
    }

    public int edgeCount() {
        return mode == EvaluationMode.EXPRESSION ? derivedEdges.size() : typedEdges.size();
    }

    public List<Integer> impulses() {
        return List.copyOf(impulses);
    }

    public Selection selection() {
        return selection;
    }

    public int generationDepth() {
        return generations.depth();
    }

    public List<Integer> activeGeneration() {
        return generations.generation();
    }

    public GraphSnapshot snapshot() {
        return new GraphSnapshot(mode, revision, nodes(), derivedEdges, typedEdges(), impulses(), selection);
    }

    public long revision() {
        return revision;
    }

    public EvaluationMode mode() {
        return mode;
    }

    public StoreOptions options() {
        return options;
    }

    // ── Internals ───────────────────────────────────────────────────

    private void evaluateInto(Mutation m, List<Integer> ids, boolean announce) {
        Map<String, GraphNode> byLabel = DependencyResolver.indexByLabel(nodes.values());
        long pendingRevision = revision + 1;
        for (int id : ids) {
            GraphNode node = nodes.get(id);
            if (node == null || !node.hasExpression())
                continue;
            EvaluationResult result = resolver.tryResolve(node, byLabel);
            if (result.isSuccess()) {
                double previous = node.value();
                double current = result.value();
                nodes.put(id, node.withValue(current));
                if (announce && Double.compare(previous, current) != 0) {
                    m.events.add(GraphLogEvent.valueChanged(id, node.label(), ExpressionSubstitutor.format(previous),
                            ExpressionSubstitutor.format(current)));
                }
                listeners.onNodeEvaluated(pendingRevision, id, node.label(), previous, current);
            } else {
                EvaluationFailure failure = result.failure();
                nodes.put(id, node.withFailure(failure));
                m.failures.add(failure);
                log.debug("Evaluation of '{}' (#{}) failed [{}]: {}", node.label(), id, failure.kind(),
                        failure.message());
                listeners.onNodeFailed(pendingRevision, failure);
            }
        }
    }

    private MutationResult commit(Mutation m, int subjectId) {
        rederive();
        revision++;
        MutationResult result = new MutationResult(snapshot(), subjectId, m.events, m.failures, m.changed);
        log.debug("{} applied at revision {} ({} events, {} failures)", m.operation, revision,
                m.events.size(), m.failures.size());
        listeners.onMutationApplied(revision, m.operation, result);
        return result;
    }

    private void rederive() {
        if (mode == EvaluationMode.EXPRESSION)
            derivedEdges = edgeDeriver.derive(nodes());
    }

    private DependencyOrder dependencyOrder() {
        return DependencyOrder.of(nodes(), derivedEdges);
    }

    private boolean propagatesExpressions() {
        return mode == EvaluationMode.EXPRESSION && options.isPropagateOnEdit();
    }

    /** Nodes quoting {@code label} plus everything downstream of them, in dependency order. */
    private List<Integer> referrersAndDependents(String label) {
        DependencyOrder order = dependencyOrder();
        Set<Integer> affected = new HashSet<>();
        for (GraphNode n : nodes.values()) {
            if (LabelReferenceExtractor.extract(n.valueExpression()).contains(label)) {
                affected.add(n.id());
                affected.addAll(order.descendants(n.id()));
            }
        }
        List<Integer> result = new ArrayList<>(affected.size());
        for (int id : order.order())
            if (affected.contains(id))
                result.add(id);
        return result;
    }

    private boolean hasTypedEdge(int sourceId, int targetId) {
        for (TypedEdge e : typedEdges.values())
            if (e.sourceId() == sourceId && e.targetId() == targetId)
                return true;
        return false;
    }

    private GraphNode requireNode(int id) {
        GraphNode node = nodes.get(id);
        if (node == null)
            throw new UnknownIdException("node", id);
        return node;
    }

    private TypedEdge requireEdge(int id) {
        TypedEdge edge = typedEdges.get(id);
        if (edge == null)
            throw new UnknownIdException("edge", id);
        return edge;
    }

    private void requireMode(EvaluationMode required, String operation) {
        if (mode != required)
            throw new IllegalStateException(operation + " is only available in " + required + " mode, store is "
                    + mode);
    }

    private void validateLabel(String label, int ownerId) {
        if (label == null || label.isBlank())
            throw new DuplicateLabelException(String.valueOf(label), "label must not be blank");
        if (label.indexOf(LabelReferenceExtractor.DELIMITER) >= 0)
            throw new DuplicateLabelException(label, "label must not contain " + LabelReferenceExtractor.DELIMITER);
        for (GraphNode n : nodes.values())
            if (n.id() != ownerId && n.label().equals(label))
                throw new DuplicateLabelException(label, "already used by node #" + n.id());
    }

    private String uniqueDefaultLabel() {
        String base = options.getDefaultLabel();
        if (findByLabel(base).isEmpty())
            return base;
        for (int i = 2;; i++) {
            String candidate = base + " " + i;
            if (findByLabel(candidate).isEmpty())
                return candidate;
        }
    }

    private static final class Mutation {
        final String operation;
        final List<GraphLogEvent> events = new ArrayList<>();
        final List<EvaluationFailure> failures = new ArrayList<>();
        boolean changed = true;

        Mutation(String operation) {
            this.operation = operation;
        }

        Mutation unchanged() {
            changed = false;
            return this;
        }
    }
}
