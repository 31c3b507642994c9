package com.exprgraph.node;

import com.exprgraph.api.EdgeKind;

/**
 * A first-class edge in typed-edge mode: created, edited and deleted directly,
 * independent of any expression content.
 */
public record TypedEdge(int id, int sourceId, int targetId, EdgeKind kind) {

    public TypedEdge {
        if (kind == null)
            throw new IllegalArgumentException("Edge " + id + " has no kind");
    }

    public boolean touches(int nodeId) {
        return sourceId == nodeId || targetId == nodeId;
    }
}
