package com.exprgraph.engine;

import java.util.List;

/**
 * Depth-stepped propagation over derived edges.
 *
 * <p>
 * Starting from a root, each {@link #advance} moves one generation further
 * downstream: direct dependents, then their dependents, and so on, where a
 * node belongs to the generation of its shortest hop distance from the root.
 * When the next generation would be empty the walk wraps around: depth drops
 * back to 0 and the active generation is the root again, ready to replay.
 */
public final class GenerationalPropagator {
    private int rootId = -1;
    private int depth;
    private List<Integer> generation = List.of();

    public void start(int rootId) {
        this.rootId = rootId;
        this.depth = 0;
        this.generation = List.of(rootId);
    }

    public void stop() {
        this.rootId = -1;
        this.depth = 0;
        this.generation = List.of();
    }

    public boolean isActive() {
        return rootId >= 0;
    }

    public int rootId() {
        return rootId;
    }

    public int depth() {
        return depth;
    }

    public List<Integer> generation() {
        return generation;
    }

    /**
     * Moves to the next generation, or wraps to the root.
     *
     * @throws IllegalStateException if no walk has been started.
     */
    public Step advance(DependencyOrder order) {
        if (!isActive())
            throw new IllegalStateException("No generational walk in progress; start one from a root node first");
        List<List<Integer>> gens = order.generations(rootId);
        int nextDepth = depth + 1;
        if (nextDepth < gens.size()) {
            depth = nextDepth;
            generation = gens.get(nextDepth);
            return new Step(depth, generation, false);
        }
        depth = 0;
        generation = List.of(rootId);
        return new Step(depth, generation, true);
    }

    /**
     * @param depth      Depth after the step.
     * @param generation Node ids active after the step.
     * @param wrapped    True when the step went back to the root.
     */
    public record Step(int depth, List<Integer> generation, boolean wrapped) {
    }
}
