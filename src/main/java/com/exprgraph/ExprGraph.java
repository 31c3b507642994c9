package com.exprgraph;

import com.exprgraph.api.EvaluationMode;
import com.exprgraph.engine.GraphStore;
import com.exprgraph.io.StoreOptions;
import com.exprgraph.util.LoggingGraphListener;

/**
 * ExprGraph: value graphs whose edges come from formulas.
 *
 * <h2>Model</h2>
 * <ul>
 * <li><b>Nodes</b> carry a label and a value expression such as
 * {@code "Price" * "Qty"}. Quoted text names another node.</li>
 * <li><b>Edges</b> are derived: {@code A -> B} exists exactly when B's
 * expression quotes A's label. They are rebuilt after every mutation.</li>
 * <li><b>Evaluation</b> resolves references recursively through their
 * expressions, substitutes the numbers and evaluates the arithmetic.</li>
 * </ul>
 *
 * <p>
 * A second, {@link EvaluationMode#TYPED_EDGE typed-edge} mode keeps explicit
 * increment/decrement edges instead and moves values by stepwise impulse
 * propagation.
 */
public final class ExprGraph {

    private ExprGraph() {
        // Prevent instantiation of utility class
    }

    /** A store configured from {@value StoreOptions#DEFAULT_RESOURCE}, if present. */
    public static GraphStore open() {
        return open(StoreOptions.load());
    }

    /** A store with activity logged through Log4j. */
    public static GraphStore open(StoreOptions options) {
        GraphStore store = new GraphStore(options);
        store.addListener(new LoggingGraphListener());
        return store;
    }

    public static GraphStore expressionGraph() {
        return open(StoreOptions.forMode(EvaluationMode.EXPRESSION));
    }

    public static GraphStore typedGraph() {
        return open(StoreOptions.forMode(EvaluationMode.TYPED_EDGE));
    }
}
