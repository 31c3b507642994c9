package com.exprgraph.api;

/**
 * Why evaluating a node failed.
 */
public enum FailureKind {
    /** Arithmetic syntax error, division by zero or a non-finite result. */
    MALFORMED_EXPRESSION,
    /** A quoted label does not match any live node. */
    UNRESOLVED_REFERENCE,
    /** A reference chain came back to a node already being resolved. */
    CYCLIC_DEPENDENCY
}
