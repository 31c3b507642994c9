package com.exprgraph.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.exprgraph.api.GraphLogEvent;
import com.exprgraph.expr.ExpressionSubstitutor;
import com.exprgraph.node.GraphNode;
import com.exprgraph.node.TypedEdge;

/**
 * One step of typed-edge impulse propagation.
 *
 * <p>
 * For every impulsed node (in impulse order) and every edge leaving it (in
 * edge order), the edge's delta is applied to the target and the target
 * becomes part of the next impulse set. Converging edges each apply their
 * delta, but the target appears only once in the next set, at its first-seen
 * position.
 *
 * <p>
 * An impulsed node without outgoing edges just drops out. Reaching an empty
 * set does not reset anything; clearing is the caller's explicit decision.
 */
public final class ImpulsePropagator {

    /**
     * @param impulses Currently impulsed node ids.
     * @param edges    All typed edges.
     * @param nodes    Live nodes by id; targets are replaced in place with
     *                 their updated values.
     */
    public StepResult step(Collection<Integer> impulses, List<TypedEdge> edges, Map<Integer, GraphNode> nodes) {
        Set<Integer> next = new LinkedHashSet<>();
        List<GraphLogEvent> events = new ArrayList<>();
        for (int sourceId : impulses) {
            for (TypedEdge edge : edges) {
                if (edge.sourceId() != sourceId)
                    continue;
                GraphNode target = nodes.get(edge.targetId());
                if (target == null)
                    continue;
                GraphNode updated = target.withValue(target.value() + edge.kind().delta());
                nodes.put(updated.id(), updated);
                next.add(updated.id());
                events.add(GraphLogEvent.propagated(updated.id(), updated.label(), edge.kind(),
                        ExpressionSubstitutor.format(updated.value())));
            }
        }
        return new StepResult(List.copyOf(next), List.copyOf(events));
    }

    /**
     * @param nextImpulses De-duplicated targets, first-seen order.
     * @param events       One event per applied edge.
     */
    public record StepResult(List<Integer> nextImpulses, List<GraphLogEvent> events) {
        public boolean changed() {
            return !events.isEmpty();
        }
    }
}
