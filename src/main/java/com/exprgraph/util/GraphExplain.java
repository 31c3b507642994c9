package com.exprgraph.util;

import java.util.ArrayList;
import java.util.List;

import com.exprgraph.api.EvaluationMode;
import com.exprgraph.engine.GraphSnapshot;
import com.exprgraph.expr.ExpressionSubstitutor;
import com.exprgraph.expr.LabelReferenceExtractor;
import com.exprgraph.node.DerivedEdge;
import com.exprgraph.node.GraphNode;
import com.exprgraph.node.TypedEdge;

/**
 * Diagnostic utility for inspecting graph state and topology.
 *
 * <p>
 * Generates human-readable text from a {@link GraphSnapshot}. Intended for
 * debugging sessions and error reports, not for anything called per mutation.
 */
public final class GraphExplain {
    private final GraphSnapshot snapshot;

    public GraphExplain(GraphSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    /**
     * Dumps detailed state of a single node.
     *
     * @throws IllegalArgumentException if the snapshot has no such node.
     */
    public String explainNode(int id) {
        GraphNode node = snapshot.node(id)
                .orElseThrow(() -> new IllegalArgumentException("Unknown node: " + id));
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node.label()).append(" (#").append(id).append(")\n")
                .append("  Expression: ").append(node.valueExpression() == null ? "-" : node.valueExpression())
                .append('\n')
                .append("  Value: ").append(ExpressionSubstitutor.format(node.value())).append('\n')
                .append("  Position: (").append(node.position().x()).append(", ").append(node.position().y())
                .append(")\n");
        List<String> refs = LabelReferenceExtractor.extract(node.valueExpression());
        if (!refs.isEmpty())
            sb.append("  References: ").append(String.join(", ", refs)).append('\n');
        if (node.lastFailure() != null)
            sb.append("  Last failure: [").append(node.lastFailure().kind()).append("] ")
                    .append(node.lastFailure().message()).append('\n');
        if (snapshot.impulses().contains(id))
            sb.append("  Impulsed\n");
        List<String> children = childLabels(id);
        sb.append("  Dependents (").append(children.size()).append("): ").append(String.join(", ", children));
        return sb.append('\n').toString();
    }

    /**
     * Dumps the whole graph in a dot-like text format.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(snapshot.mode()).append(", ").append(snapshot.nodes().size())
                .append(" nodes, revision ").append(snapshot.revision()).append("):\n");
        for (GraphNode node : snapshot.nodes()) {
            sb.append("  [").append(node.id()).append("] ").append(node.label())
                    .append(" = ").append(ExpressionSubstitutor.format(node.value()));
            if (node.lastFailure() != null)
                sb.append(" (!)");
            List<String> children = childLabels(node.id());
            if (!children.isEmpty())
                sb.append(" → ").append(String.join(", ", children));
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram. Typed edges are labelled
     * {@code +} or {@code -}.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph TD;\n");
        for (GraphNode node : snapshot.nodes()) {
            sb.append("  n").append(node.id()).append("[\"").append(escape(node.label())).append(": ")
                    .append(ExpressionSubstitutor.format(node.value())).append("\"];\n");
        }
        if (snapshot.mode() == EvaluationMode.EXPRESSION) {
            for (DerivedEdge e : snapshot.derivedEdges())
                sb.append("  n").append(e.sourceId()).append(" --> n").append(e.targetId()).append(";\n");
        } else {
            for (TypedEdge e : snapshot.typedEdges()) {
                sb.append("  n").append(e.sourceId()).append(" -- \"")
                        .append(e.kind().delta() > 0 ? '+' : '-')
                        .append("\" --> n").append(e.targetId()).append(";\n");
            }
        }
        return sb.toString();
    }

    private List<String> childLabels(int id) {
        List<String> labels = new ArrayList<>();
        if (snapshot.mode() == EvaluationMode.EXPRESSION) {
            for (DerivedEdge e : snapshot.derivedEdges())
                if (e.sourceId() == id)
                    snapshot.node(e.targetId()).ifPresent(n -> labels.add(n.label()));
        } else {
            for (TypedEdge e : snapshot.typedEdges())
                if (e.sourceId() == id)
                    snapshot.node(e.targetId())
                            .ifPresent(n -> labels.add(n.label() + (e.kind().delta() > 0 ? " (+)" : " (-)")));
        }
        return labels;
    }

    private static String escape(String label) {
        return label.replace("\"", "#quot;");
    }
}
