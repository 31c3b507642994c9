package com.exprgraph.util;

import java.util.Arrays;

import com.exprgraph.api.GraphListener;
import com.exprgraph.engine.MutationResult;
import com.exprgraph.expr.EvaluationFailure;

/**
 * Fans callbacks out to any number of {@link GraphListener}s, in registration
 * order.
 */
public class CompositeGraphListener implements GraphListener {
    private GraphListener[] listeners = new GraphListener[0];

    public void add(GraphListener listener) {
        GraphListener[] old = listeners;
        GraphListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public boolean remove(GraphListener listener) {
        GraphListener[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                GraphListener[] next = new GraphListener[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return true;
            }
        }
        return false;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onMutationApplied(long revision, String operation, MutationResult result) {
        for (GraphListener l : listeners)
            l.onMutationApplied(revision, operation, result);
    }

    @Override
    public void onNodeEvaluated(long revision, int nodeId, String label, double previous, double current) {
        for (GraphListener l : listeners)
            l.onNodeEvaluated(revision, nodeId, label, previous, current);
    }

    @Override
    public void onNodeFailed(long revision, EvaluationFailure failure) {
        for (GraphListener l : listeners)
            l.onNodeFailed(revision, failure);
    }
}
