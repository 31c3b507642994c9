package com.exprgraph.node;

import com.exprgraph.expr.EvaluationFailure;

/**
 * A node in the graph.
 *
 * Instances are immutable; the store replaces a node wholesale when one of
 * its attributes changes, so snapshots handed to callers never move under
 * them.
 *
 * {@code value} and {@code valueExpression} may disagree for a while:
 * re-evaluation is an explicit step, which lets stepwise changes be
 * inspected before the expression is applied again.
 *
 * @param id              Store-assigned id, never reused within a session.
 * @param label           Display name, also the token other expressions quote.
 * @param position        Normalized layout position.
 * @param value           Current numeric state, always finite.
 * @param valueExpression Defining expression, or null for a plain value node.
 * @param lastFailure     Failure of the most recent evaluation, or null if it
 *                        succeeded.
 */
public record GraphNode(int id, String label, Position position, double value, String valueExpression,
        EvaluationFailure lastFailure) {

    public GraphNode {
        if (label == null)
            throw new IllegalArgumentException("Node " + id + " has no label");
        if (position == null)
            throw new IllegalArgumentException("Node " + id + " has no position");
        if (!Double.isFinite(value))
            throw new IllegalArgumentException("Invalid value: " + value + " for node: " + label);
    }

    public GraphNode(int id, String label, Position position, double value, String valueExpression) {
        this(id, label, position, value, valueExpression, null);
    }

    public boolean hasExpression() {
        return valueExpression != null && !valueExpression.isBlank();
    }

    public GraphNode withLabel(String newLabel) {
        return new GraphNode(id, newLabel, position, value, valueExpression, lastFailure);
    }

    public GraphNode withPosition(Position newPosition) {
        return new GraphNode(id, label, newPosition, value, valueExpression, lastFailure);
    }

    public GraphNode withExpression(String newExpression) {
        return new GraphNode(id, label, position, value, newExpression, lastFailure);
    }

    /** A successful evaluation: new value, failure cleared. */
    public GraphNode withValue(double newValue) {
        return new GraphNode(id, label, position, newValue, valueExpression, null);
    }

    /** A failed evaluation: the last-known-good value stays. */
    public GraphNode withFailure(EvaluationFailure failure) {
        return new GraphNode(id, label, position, value, valueExpression, failure);
    }
}
