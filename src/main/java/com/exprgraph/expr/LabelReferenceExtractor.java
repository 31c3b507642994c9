package com.exprgraph.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pulls quoted label references out of an expression.
 *
 * <p>
 * A reference is the text between a pair of {@code "} delimiters. References
 * come back in the order and multiplicity they appear: {@code "A" + "A" * "B"}
 * yields {@code [A, A, B]}. A trailing delimiter with no partner does not
 * close anything and contributes no reference, so half-typed input degrades
 * to fewer references instead of an error.
 */
public final class LabelReferenceExtractor {
    public static final char DELIMITER = '"';

    private LabelReferenceExtractor() {
        // Utility class
    }

    /**
     * @param expression Raw expression text, may be null.
     * @return Referenced labels, in order. Never null.
     */
    public static List<String> extract(String expression) {
        if (expression == null || expression.indexOf(DELIMITER) < 0)
            return Collections.emptyList();
        List<String> refs = new ArrayList<>();
        int pos = 0;
        while (true) {
            int open = expression.indexOf(DELIMITER, pos);
            if (open < 0)
                break;
            int close = expression.indexOf(DELIMITER, open + 1);
            if (close < 0)
                break; // dangling
            refs.add(expression.substring(open + 1, close));
            pos = close + 1;
        }
        return refs;
    }

    /**
     * Rewrites every reference to {@code oldLabel} so it quotes
     * {@code newLabel}. Unquoted text and other references are left alone, so
     * renaming {@code A} does not touch {@code "AB"} or a literal {@code A}.
     *
     * @return The rewritten expression, or the input itself when nothing
     *         matched.
     */
    public static String renameReferences(String expression, String oldLabel, String newLabel) {
        if (expression == null || expression.indexOf(DELIMITER) < 0)
            return expression;
        StringBuilder sb = new StringBuilder(expression.length() + 8);
        boolean touched = false;
        int pos = 0;
        while (true) {
            int open = expression.indexOf(DELIMITER, pos);
            int close = open < 0 ? -1 : expression.indexOf(DELIMITER, open + 1);
            if (close < 0) {
                sb.append(expression, pos, expression.length());
                break;
            }
            sb.append(expression, pos, open + 1);
            String ref = expression.substring(open + 1, close);
            if (ref.equals(oldLabel)) {
                sb.append(newLabel);
                touched = true;
            } else {
                sb.append(ref);
            }
            sb.append(DELIMITER);
            pos = close + 1;
        }
        return touched ? sb.toString() : expression;
    }
}
