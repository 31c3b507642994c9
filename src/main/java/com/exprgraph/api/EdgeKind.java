package com.exprgraph.api;

import java.util.Locale;

/**
 * Kind of a typed edge. The delta is what one impulse applies to the target.
 */
public enum EdgeKind {
    INCREMENT(1, "incremented"),
    DECREMENT(-1, "decremented");

    private final int delta;
    private final String pastTense;

    EdgeKind(int delta, String pastTense) {
        this.delta = delta;
        this.pastTense = pastTense;
    }

    public int delta() {
        return delta;
    }

    public String pastTense() {
        return pastTense;
    }

    /** Lower-case wire name, as used in exported documents. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EdgeKind fromString(String s) {
        if (s == null)
            throw new IllegalArgumentException("Edge kind is required");
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown edge kind: " + s, e);
        }
    }
}
