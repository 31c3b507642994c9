package com.exprgraph.api;

import com.exprgraph.engine.MutationResult;
import com.exprgraph.expr.EvaluationFailure;

/**
 * Observability hook for a {@link com.exprgraph.engine.GraphStore}.
 *
 * Callbacks run synchronously on the thread applying the mutation, after the
 * store has brought its derived state back into agreement. Implementations
 * must not mutate the store from inside a callback.
 */
public interface GraphListener {

    /**
     * Called once per applied mutation.
     *
     * @param revision  Store revision after the mutation.
     * @param operation Name of the mutation, e.g. {@code renameNode}.
     * @param result    The new snapshot together with events and failures.
     */
    void onMutationApplied(long revision, String operation, MutationResult result);

    /**
     * Called for every node whose value was successfully re-evaluated.
     *
     * @param revision Store revision the evaluation belongs to.
     * @param nodeId   Node id.
     * @param label    Node label at evaluation time.
     * @param previous Value before evaluation.
     * @param current  Value after evaluation.
     */
    void onNodeEvaluated(long revision, int nodeId, String label, double previous, double current);

    /**
     * Called when evaluating a node failed. The node keeps its previous value.
     *
     * @param revision Store revision the evaluation belongs to.
     * @param failure  What went wrong, and where.
     */
    void onNodeFailed(long revision, EvaluationFailure failure);
}
