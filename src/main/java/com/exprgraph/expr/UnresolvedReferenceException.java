package com.exprgraph.expr;

import com.exprgraph.api.FailureKind;

/**
 * A quoted label names no live node.
 */
public class UnresolvedReferenceException extends EvaluationException {
    private final String label;

    public UnresolvedReferenceException(String label) {
        super(FailureKind.UNRESOLVED_REFERENCE, "Unresolved reference: \"" + label + "\"");
        this.label = label;
    }

    public String label() {
        return label;
    }
}
