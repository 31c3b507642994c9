package com.exprgraph.expr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.exprgraph.node.GraphNode;

import lombok.extern.log4j.Log4j2;

/**
 * Computes a node's value from its expression.
 *
 * <p>
 * For each quoted reference the resolver finds the node carrying that label
 * and resolves it through its own expression, recursively. Cached
 * {@link GraphNode#value()} fields are only used for nodes that have no
 * expression at all, since an expression node's cached value may be stale.
 * Once every reference has a number, the text is substituted and handed to
 * {@link ArithmeticEvaluator}.
 *
 * <p>
 * Labels currently being resolved sit on a stack; meeting one of them again
 * raises {@link CyclicDependencyException} instead of recursing forever. A
 * reference chain longer than {@value #MAX_CHAIN_DEPTH} nodes is rejected as
 * malformed. Within one call each label is resolved at most once, so shared
 * ancestors in a diamond are not recomputed.
 */
@Log4j2
public final class DependencyResolver {
    public static final int MAX_CHAIN_DEPTH = 512;

    /**
     * Resolves {@code target} against the given live nodes.
     *
     * @throws EvaluationException on malformed arithmetic, an unresolved
     *                             reference or a cycle.
     */
    public double resolve(GraphNode target, Collection<GraphNode> nodes) {
        return resolve(target, indexByLabel(nodes));
    }

    /**
     * Resolves {@code target} using a prebuilt label index.
     */
    public double resolve(GraphNode target, Map<String, GraphNode> byLabel) {
        return resolveNode(target, byLabel, new ArrayDeque<>(), new HashMap<>());
    }

    /**
     * Like {@link #resolve(GraphNode, Map)}, but reports failure as data.
     */
    public EvaluationResult tryResolve(GraphNode target, Map<String, GraphNode> byLabel) {
        try {
            return EvaluationResult.success(resolve(target, byLabel));
        } catch (EvaluationException e) {
            log.debug("Evaluation of '{}' failed: {}", target.label(), e.getMessage());
            return EvaluationResult.failure(EvaluationFailure.of(target.id(), target.label(), e));
        }
    }

    public static Map<String, GraphNode> indexByLabel(Collection<GraphNode> nodes) {
        Map<String, GraphNode> byLabel = new HashMap<>(nodes.size() * 2);
        for (GraphNode n : nodes)
            byLabel.putIfAbsent(n.label(), n);
        return byLabel;
    }

    private double resolveNode(GraphNode node, Map<String, GraphNode> byLabel, Deque<String> resolving,
            Map<String, Double> resolved) {
        if (!node.hasExpression())
            return node.value();
        Double known = resolved.get(node.label());
        if (known != null)
            return known;

        if (resolving.contains(node.label()))
            throw new CyclicDependencyException(cyclePath(resolving, node.label()));
        if (resolving.size() >= MAX_CHAIN_DEPTH)
            throw new MalformedExpressionException("Reference chain deeper than " + MAX_CHAIN_DEPTH
                    + " nodes at \"" + node.label() + "\"");

        resolving.push(node.label());
        try {
            List<String> refs = LabelReferenceExtractor.extract(node.valueExpression());
            Map<String, Double> values = new HashMap<>(refs.size() * 2);
            for (String ref : refs) {
                if (values.containsKey(ref))
                    continue;
                GraphNode dep = byLabel.get(ref);
                if (dep == null)
                    throw new UnresolvedReferenceException(ref);
                values.put(ref, resolveNode(dep, byLabel, resolving, resolved));
            }
            String substituted = ExpressionSubstitutor.substitute(node.valueExpression(), values);
            double v = ArithmeticEvaluator.evaluate(substituted);
            resolved.put(node.label(), v);
            return v;
        } finally {
            resolving.pop();
        }
    }

    // The stack holds the innermost label first; the path reads outermost first.
    private static List<String> cyclePath(Deque<String> resolving, String repeated) {
        List<String> path = new ArrayList<>();
        Iterator<String> it = resolving.descendingIterator();
        boolean inCycle = false;
        while (it.hasNext()) {
            String label = it.next();
            if (label.equals(repeated))
                inCycle = true;
            if (inCycle)
                path.add(label);
        }
        path.add(repeated);
        return path;
    }
}
