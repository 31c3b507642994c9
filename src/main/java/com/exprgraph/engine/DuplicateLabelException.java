package com.exprgraph.engine;

/**
 * A label that would make references ambiguous or unparseable: already used
 * by another live node, blank, or containing the quote delimiter.
 */
public class DuplicateLabelException extends IllegalArgumentException {
    private final String label;

    public DuplicateLabelException(String label, String reason) {
        super("Invalid label '" + label + "': " + reason);
        this.label = label;
    }

    public String label() {
        return label;
    }
}
