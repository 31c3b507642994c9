package com.exprgraph.expr;

import com.exprgraph.api.FailureKind;

/**
 * Structured form of an evaluation failure, attached to the node it happened
 * on.
 */
public record EvaluationFailure(int nodeId, String label, FailureKind kind, String message) {

    public static EvaluationFailure of(int nodeId, String label, EvaluationException e) {
        return new EvaluationFailure(nodeId, label, e.kind(), e.getMessage());
    }
}
