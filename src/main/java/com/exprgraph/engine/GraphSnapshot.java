package com.exprgraph.engine;

import java.util.List;
import java.util.Optional;

import com.exprgraph.api.EvaluationMode;
import com.exprgraph.node.DerivedEdge;
import com.exprgraph.node.GraphNode;
import com.exprgraph.node.TypedEdge;

/**
 * Immutable view of a store at one revision. Exactly one of
 * {@code derivedEdges} and {@code typedEdges} is populated, depending on the
 * mode.
 */
public record GraphSnapshot(EvaluationMode mode, long revision, List<GraphNode> nodes,
        List<DerivedEdge> derivedEdges, List<TypedEdge> typedEdges, List<Integer> impulses,
        Selection selection) {

    public GraphSnapshot {
        nodes = List.copyOf(nodes);
        derivedEdges = List.copyOf(derivedEdges);
        typedEdges = List.copyOf(typedEdges);
        impulses = List.copyOf(impulses);
    }

    public Optional<GraphNode> node(int id) {
        for (GraphNode n : nodes)
            if (n.id() == id)
                return Optional.of(n);
        return Optional.empty();
    }

    public Optional<GraphNode> nodeByLabel(String label) {
        for (GraphNode n : nodes)
            if (n.label().equals(label))
                return Optional.of(n);
        return Optional.empty();
    }

    public int edgeCount() {
        return mode == EvaluationMode.EXPRESSION ? derivedEdges.size() : typedEdges.size();
    }
}
