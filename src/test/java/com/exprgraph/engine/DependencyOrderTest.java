package com.exprgraph.engine;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class DependencyOrderTest {

    @Test
    public void testEmptyGraph() {
        DependencyOrder order = DependencyOrder.builder().build();
        assertTrue(order.order().isEmpty());
        assertFalse(order.hasCycle());
    }

    @Test
    public void testLinearGraph() {
        // 3 -> 2 -> 1, inserted in reverse
        DependencyOrder order = DependencyOrder.builder()
                .addNode(1).addNode(2).addNode(3)
                .addEdge(3, 2)
                .addEdge(2, 1)
                .build();

        assertEquals(List.of(3, 2, 1), order.order());
        assertFalse(order.hasCycle());
        assertEquals(List.of(2), order.children(3));
        assertTrue(order.children(1).isEmpty());
    }

    @Test
    public void testDiamondGraph() {
        // 1 -> 2, 1 -> 3, 2 -> 4, 3 -> 4
        DependencyOrder order = DependencyOrder.builder()
                .addNode(1).addNode(2).addNode(3).addNode(4)
                .addEdge(1, 2).addEdge(1, 3)
                .addEdge(2, 4).addEdge(3, 4)
                .build();

        assertEquals(List.of(1, 2, 3, 4), order.order());
        assertEquals(List.of(2, 3, 4), order.descendants(1));
        assertEquals(List.of(4), order.descendants(2));
        assertTrue(order.descendants(4).isEmpty());
    }

    @Test
    public void testCycleIsFlaggedAndAppended() {
        // 1 -> 2 -> 3 -> 2, 4 isolated
        DependencyOrder order = DependencyOrder.builder()
                .addNode(1).addNode(2).addNode(3).addNode(4)
                .addEdge(1, 2).addEdge(2, 3).addEdge(3, 2)
                .build();

        assertTrue(order.hasCycle());
        assertEquals(List.of(1, 4, 2, 3), order.order());
        // a node on a cycle reaches itself
        assertEquals(List.of(2, 3), order.descendants(2));
    }

    @Test
    public void testGenerationsUseShortestDistance() {
        // 1 -> 2 -> 3, 1 -> 3, 3 -> 4
        DependencyOrder order = DependencyOrder.builder()
                .addNode(1).addNode(2).addNode(3).addNode(4)
                .addEdge(1, 2).addEdge(2, 3).addEdge(1, 3).addEdge(3, 4)
                .build();

        assertEquals(List.of(List.of(1), List.of(2, 3), List.of(4)), order.generations(1));
        assertEquals(List.of(List.of(4)), order.generations(4));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNodeRejected() {
        DependencyOrder.builder().addNode(1).addNode(1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEdgeToUnknownNodeRejected() {
        DependencyOrder.builder().addNode(1).addEdge(1, 2);
    }
}
