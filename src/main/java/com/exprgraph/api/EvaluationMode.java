package com.exprgraph.api;

/**
 * How a store turns structure into values.
 *
 * <ul>
 * <li>{@link #EXPRESSION}: every node carries a value expression, edges are
 * derived from the quoted label references inside those expressions.</li>
 * <li>{@link #TYPED_EDGE}: edges are created directly with a kind, and values
 * move by stepwise impulse propagation.</li>
 * </ul>
 */
public enum EvaluationMode {
    EXPRESSION,
    TYPED_EDGE
}
