package com.exprgraph.expr;

import com.exprgraph.api.FailureKind;

/**
 * Base type for everything that can go wrong while computing a node's value.
 */
public abstract class EvaluationException extends RuntimeException {
    private final FailureKind kind;

    protected EvaluationException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected EvaluationException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
