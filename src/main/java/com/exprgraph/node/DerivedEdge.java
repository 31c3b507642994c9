package com.exprgraph.node;

/**
 * An edge that exists only because {@code target}'s expression quotes
 * {@code source}'s label. Identity is the (source, target) pair.
 */
public record DerivedEdge(int sourceId, int targetId) {
}
