package com.exprgraph.engine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.exprgraph.expr.DependencyResolver;
import com.exprgraph.expr.LabelReferenceExtractor;
import com.exprgraph.node.DerivedEdge;
import com.exprgraph.node.GraphNode;

/**
 * Rebuilds the complete edge set of an expression-mode graph from scratch.
 *
 * <p>
 * For every node, in node order, every quoted reference that names a live
 * node yields an edge {@code referenced -> scanned}. References to unknown
 * labels are skipped: a user half way through typing a label is a normal
 * state, not an error. Repeated references to one label collapse into a single
 * edge since edges are identified by their endpoints.
 *
 * <p>
 * The result depends only on the node list, so deriving twice without a
 * mutation in between gives an equal list.
 */
public final class EdgeDeriver {

    public List<DerivedEdge> derive(List<GraphNode> nodes) {
        Map<String, GraphNode> byLabel = DependencyResolver.indexByLabel(nodes);
        Set<DerivedEdge> edges = new LinkedHashSet<>();
        for (GraphNode target : nodes) {
            for (String ref : LabelReferenceExtractor.extract(target.valueExpression())) {
                GraphNode source = byLabel.get(ref);
                if (source != null)
                    edges.add(new DerivedEdge(source.id(), target.id()));
            }
        }
        return List.copyOf(new ArrayList<>(edges));
    }
}
