package com.exprgraph.engine;

/**
 * A mutation named a node or edge id the graph does not contain. Thrown before
 * any state changes.
 */
public class UnknownIdException extends IllegalArgumentException {
    private final String entity;
    private final int id;

    public UnknownIdException(String entity, int id) {
        super("Unknown " + entity + " id: " + id);
        this.entity = entity;
        this.id = id;
    }

    public String entity() {
        return entity;
    }

    public int id() {
        return id;
    }
}
