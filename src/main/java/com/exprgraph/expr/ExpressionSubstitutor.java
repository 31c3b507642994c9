package com.exprgraph.expr;

import java.util.Map;

/**
 * Replaces quoted references with the numeric text of their resolved values.
 *
 * <p>
 * The scan is a single left-to-right pass over the original text, so numbers
 * written into the output are never looked at again. A dangling delimiter is
 * copied as-is; the arithmetic stage then rejects it.
 */
public final class ExpressionSubstitutor {
    private static final double PLAIN_LIMIT = 1e15;

    private ExpressionSubstitutor() {
        // Utility class
    }

    /**
     * @param expression Expression containing quoted references.
     * @param values     Resolved value for every referenced label.
     * @return Text containing only numbers, operators and parentheses (if the
     *         input was well formed).
     * @throws UnresolvedReferenceException if a referenced label has no value.
     */
    public static String substitute(String expression, Map<String, Double> values) {
        char q = LabelReferenceExtractor.DELIMITER;
        StringBuilder sb = new StringBuilder(expression.length() + 16);
        int pos = 0;
        while (pos < expression.length()) {
            int open = expression.indexOf(q, pos);
            int close = open < 0 ? -1 : expression.indexOf(q, open + 1);
            if (close < 0) {
                sb.append(expression, pos, expression.length());
                break;
            }
            sb.append(expression, pos, open);
            String label = expression.substring(open + 1, close);
            Double v = values.get(label);
            if (v == null)
                throw new UnresolvedReferenceException(label);
            sb.append(format(v));
            pos = close + 1;
        }
        return sb.toString();
    }

    /**
     * Numeric text for a value: integral values print without a fraction
     * ({@code 3}, not {@code 3.0}), everything else uses
     * {@link Double#toString(double)}, which round-trips exactly.
     */
    public static String format(double v) {
        if (v == Math.rint(v) && Math.abs(v) < PLAIN_LIMIT) {
            if (v == 0)
                return "0"; // folds -0.0
            return Long.toString((long) v);
        }
        return Double.toString(v);
    }
}
