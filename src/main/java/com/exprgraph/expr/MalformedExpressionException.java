package com.exprgraph.expr;

import com.exprgraph.api.FailureKind;

/**
 * Syntax error, division by zero, or a result that is not a finite number.
 */
public class MalformedExpressionException extends EvaluationException {
    private final int position;

    public MalformedExpressionException(String message, int position) {
        super(FailureKind.MALFORMED_EXPRESSION, position >= 0 ? message + " at pos " + position : message);
        this.position = position;
    }

    public MalformedExpressionException(String message) {
        this(message, -1);
    }

    /** Offset into the evaluated text, or -1 when the error has no location. */
    public int position() {
        return position;
    }
}
