package com.exprgraph.engine;

/**
 * What the user currently has selected: nothing, one node, or one typed edge.
 */
public record Selection(Kind kind, int id) {
    public static final Selection NONE = new Selection(Kind.NONE, -1);

    public enum Kind {
        NONE,
        NODE,
        EDGE
    }

    public static Selection node(int id) {
        return new Selection(Kind.NODE, id);
    }

    public static Selection edge(int id) {
        return new Selection(Kind.EDGE, id);
    }

    public boolean isNode(int nodeId) {
        return kind == Kind.NODE && id == nodeId;
    }

    public boolean isEdge(int edgeId) {
        return kind == Kind.EDGE && id == edgeId;
    }
}
