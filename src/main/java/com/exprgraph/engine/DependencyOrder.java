package com.exprgraph.engine;

import java.util.*;

import com.exprgraph.node.DerivedEdge;
import com.exprgraph.node.GraphNode;

/**
 * Dependency order over a derived edge set.
 *
 * <p>
 * Built once per use from the current nodes and edges. {@link #order()} lists
 * node ids so that every node comes after the nodes it references (Kahn's
 * algorithm, ties broken by store order). Nodes caught in or behind a cycle
 * cannot be ordered; they are appended at the end in store order and flagged
 * by {@link #hasCycle()}, and evaluating them reports the cycle.
 */
public final class DependencyOrder {
    private final List<Integer> order;
    private final Map<Integer, List<Integer>> children;
    private final boolean cyclic;

    private DependencyOrder(List<Integer> order, Map<Integer, List<Integer>> children, boolean cyclic) {
        this.order = order;
        this.children = children;
        this.cyclic = cyclic;
    }

    public static DependencyOrder of(List<GraphNode> nodes, List<DerivedEdge> edges) {
        Builder b = builder();
        for (GraphNode n : nodes)
            b.addNode(n.id());
        for (DerivedEdge e : edges)
            b.addEdge(e.sourceId(), e.targetId());
        return b.build();
    }

    public List<Integer> order() {
        return order;
    }

    public boolean hasCycle() {
        return cyclic;
    }

    /** Direct dependents of {@code id}, in edge order. */
    public List<Integer> children(int id) {
        return children.getOrDefault(id, Collections.emptyList());
    }

    /**
     * Every node reachable from {@code id}, excluding {@code id} itself unless
     * it sits on a cycle, listed in dependency order.
     */
    public List<Integer> descendants(int id) {
        Set<Integer> seen = new HashSet<>();
        Deque<Integer> stack = new ArrayDeque<>(children(id));
        while (!stack.isEmpty()) {
            int cur = stack.pop();
            if (seen.add(cur))
                stack.addAll(children(cur));
        }
        List<Integer> result = new ArrayList<>(seen.size());
        for (int ti : order)
            if (seen.contains(ti))
                result.add(ti);
        return result;
    }

    /**
     * Nodes grouped by shortest hop distance from {@code rootId}. Entry 0 is
     * the root alone; entry k holds the nodes first reached after k hops.
     */
    public List<List<Integer>> generations(int rootId) {
        List<List<Integer>> gens = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        List<Integer> current = List.of(rootId);
        seen.add(rootId);
        while (!current.isEmpty()) {
            gens.add(current);
            List<Integer> next = new ArrayList<>();
            for (int id : current)
                for (int child : children(id))
                    if (seen.add(child))
                        next.add(child);
            current = next;
        }
        return gens;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Integer> nodes = new ArrayList<>();
        private final Map<Integer, List<Integer>> forwardEdges = new LinkedHashMap<>();

        public Builder addNode(int id) {
            if (forwardEdges.containsKey(id))
                throw new IllegalArgumentException("Duplicate node id: " + id);
            nodes.add(id);
            forwardEdges.put(id, new ArrayList<>());
            return this;
        }

        public Builder addEdge(int from, int to) {
            List<Integer> out = forwardEdges.get(from);
            if (out == null || !forwardEdges.containsKey(to))
                throw new IllegalArgumentException("Unknown node in edge: " + from + " -> " + to);
            out.add(to);
            return this;
        }

        public DependencyOrder build() {
            Map<Integer, Integer> inDegree = new HashMap<>(nodes.size() * 2);
            for (int id : nodes)
                inDegree.put(id, 0);
            for (List<Integer> out : forwardEdges.values())
                for (int child : out)
                    inDegree.merge(child, 1, Integer::sum);

            // Kahn's algorithm, seeded in store order
            Deque<Integer> queue = new ArrayDeque<>();
            for (int id : nodes)
                if (inDegree.get(id) == 0)
                    queue.add(id);

            List<Integer> sorted = new ArrayList<>(nodes.size());
            while (!queue.isEmpty()) {
                int cur = queue.poll();
                sorted.add(cur);
                for (int child : forwardEdges.get(cur))
                    if (inDegree.merge(child, -1, Integer::sum) == 0)
                        queue.add(child);
            }

            boolean cyclic = sorted.size() != nodes.size();
            if (cyclic) {
                Set<Integer> placed = new HashSet<>(sorted);
                for (int id : nodes)
                    if (!placed.contains(id))
                        sorted.add(id);
            }

            Map<Integer, List<Integer>> frozen = new HashMap<>(forwardEdges.size() * 2);
            forwardEdges.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
            return new DependencyOrder(List.copyOf(sorted), frozen, cyclic);
        }
    }
}
