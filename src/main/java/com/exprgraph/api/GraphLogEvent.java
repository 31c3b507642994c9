package com.exprgraph.api;

/**
 * A human-readable record of something a mutation did, in the order it
 * happened. These are what a UI appends to its activity log.
 *
 * @param kind    What happened.
 * @param nodeId  Node the event is about, or {@code -1} for graph-wide events.
 * @param message Display text, e.g. {@code A: 1 → 2}.
 */
public record GraphLogEvent(Kind kind, int nodeId, String message) {

    public enum Kind {
        VALUE_CHANGED,
        RENAMED,
        EXPRESSION_REWRITTEN,
        PROPAGATED,
        MANUAL_IMPULSE,
        WARNING
    }

    public static GraphLogEvent valueChanged(int nodeId, String label, String previous, String current) {
        return new GraphLogEvent(Kind.VALUE_CHANGED, nodeId, label + ": " + previous + " → " + current);
    }

    public static GraphLogEvent renamed(int nodeId, String previous, String current) {
        return new GraphLogEvent(Kind.RENAMED, nodeId, "label: " + previous + " → " + current);
    }

    public static GraphLogEvent expressionRewritten(int nodeId, String label, String previous, String current) {
        return new GraphLogEvent(Kind.EXPRESSION_REWRITTEN, nodeId,
                label + ": " + previous + " → " + current);
    }

    public static GraphLogEvent propagated(int nodeId, String label, EdgeKind kind, String value) {
        return new GraphLogEvent(Kind.PROPAGATED, nodeId, "'" + label + "' " + kind.pastTense() + " to " + value);
    }

    public static GraphLogEvent manualImpulse(int nodeId, String label, EdgeKind kind, String value) {
        return new GraphLogEvent(Kind.MANUAL_IMPULSE, nodeId,
                "'" + label + "' manually " + kind.pastTense() + " to " + value);
    }

    public static GraphLogEvent warning(String message) {
        return new GraphLogEvent(Kind.WARNING, -1, message);
    }
}
