package com.exprgraph.engine;

import java.util.List;

import com.exprgraph.api.GraphLogEvent;
import com.exprgraph.expr.EvaluationFailure;
import com.exprgraph.node.GraphNode;
import com.exprgraph.node.TypedEdge;

/**
 * What a mutation hands back: the new consistent state, the log events it
 * produced, and every evaluation that failed along the way.
 *
 * @param snapshot  State after the mutation.
 * @param subjectId Id of the node or edge the mutation created or targeted,
 *                  or -1 for graph-wide mutations.
 * @param events    Log events in the order they happened.
 * @param failures  Failed evaluations; each affected node kept its old value.
 * @param changed   False when the mutation was accepted but had nothing to
 *                  do, e.g. a propagation step with an empty impulse set.
 */
public record MutationResult(GraphSnapshot snapshot, int subjectId, List<GraphLogEvent> events,
        List<EvaluationFailure> failures, boolean changed) {

    public MutationResult {
        events = List.copyOf(events);
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /** The subject as a node, e.g. the node a create-node mutation made. */
    public GraphNode node() {
        return snapshot.node(subjectId)
                .orElseThrow(() -> new IllegalStateException("No node " + subjectId + " in snapshot"));
    }

    /** The subject as a typed edge, e.g. the edge a create-edge mutation made. */
    public TypedEdge edge() {
        for (TypedEdge e : snapshot.typedEdges())
            if (e.id() == subjectId)
                return e;
        throw new IllegalStateException("No edge " + subjectId + " in snapshot");
    }
}
