package com.exprgraph.expr;

/**
 * Outcome of resolving one node: either a value or a failure, never both.
 */
public final class EvaluationResult {
    private final double value;
    private final EvaluationFailure failure;

    private EvaluationResult(double value, EvaluationFailure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static EvaluationResult success(double value) {
        return new EvaluationResult(value, null);
    }

    public static EvaluationResult failure(EvaluationFailure failure) {
        return new EvaluationResult(Double.NaN, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * @throws IllegalStateException if the evaluation failed.
     */
    public double value() {
        if (failure != null)
            throw new IllegalStateException("No value: " + failure.message());
        return value;
    }

    public EvaluationFailure failure() {
        return failure;
    }

    @Override
    public String toString() {
        return failure == null ? "EvaluationResult[" + value + "]" : "EvaluationResult[" + failure + "]";
    }
}
