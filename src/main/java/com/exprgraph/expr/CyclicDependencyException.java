package com.exprgraph.expr;

import java.util.List;

import com.exprgraph.api.FailureKind;

/**
 * A reference chain revisited a label that was still being resolved.
 */
public class CyclicDependencyException extends EvaluationException {
    private final List<String> cycle;

    public CyclicDependencyException(List<String> cycle) {
        super(FailureKind.CYCLIC_DEPENDENCY, "Cyclic dependency: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /** Labels along the cycle; the first and last entries are the same label. */
    public List<String> cycle() {
        return cycle;
    }
}
