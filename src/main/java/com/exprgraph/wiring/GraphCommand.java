package com.exprgraph.wiring;

import com.exprgraph.engine.GraphStore;
import com.exprgraph.engine.MutationResult;

/**
 * One unit of work against a store, e.g. {@code s -> s.renameNode(3, "B")}.
 */
@FunctionalInterface
public interface GraphCommand {
    MutationResult apply(GraphStore store);
}
