package com.spreadsheet.formula.dependency;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private DependencyGraph graph;

    @BeforeEach
    void setUp() {
        graph = new DependencyGraph();
    }

    @Test
    void testReverseIsTransposeOfForward() {
        graph.setDependencies("C1", Arrays.asList("A1", "B1"));
        graph.setDependencies("D1", Collections.singletonList("A1"));

        assertEquals(Set.of("A1", "B1"), graph.getDependencies("C1"));
        assertEquals(Set.of("C1", "D1"), graph.getDependents("A1"));
        assertEquals(Set.of("C1"), graph.getDependents("B1"));
    }

    @Test
    void testSetDependenciesReplacesOldEdges() {
        graph.setDependencies("B1", Collections.singletonList("A1"));
        graph.setDependencies("B1", Collections.singletonList("C1"));

        assertTrue(graph.getDependents("A1").isEmpty());
        assertEquals(Set.of("B1"), graph.getDependents("C1"));
        assertFalse(graph.reverseSnapshot().containsKey("A1"));
    }

    @Test
    void testTransitiveDependentsNearestFirst() {
        graph.setDependencies("B1", Collections.singletonList("A1"));
        graph.setDependencies("C1", Collections.singletonList("B1"));
        graph.setDependencies("D1", Collections.singletonList("C1"));

        List<String> order = List.copyOf(graph.getTransitiveDependents("A1"));
        assertEquals(List.of("B1", "C1", "D1"), order);
        assertTrue(graph.getTransitiveDependents("D1").isEmpty());
    }

    @Test
    void testCycleDetection() {
        graph.setDependencies("A1", Collections.singletonList("B1"));
        graph.setDependencies("B1", Collections.singletonList("C1"));
        assertFalse(graph.hasCycleFrom("A1"));

        graph.setDependencies("C1", Collections.singletonList("A1"));
        assertTrue(graph.hasCycleFrom("A1"));
        assertTrue(graph.hasCycleFrom("B1"));
    }

    @Test
    void testSelfLoopIsACycle() {
        graph.addDependency("A1", "A1");
        assertTrue(graph.hasCycleFrom("A1"));
    }

    @Test
    void testDiamondIsNotACycle() {
        graph.setDependencies("D1", Arrays.asList("B1", "C1"));
        graph.setDependencies("B1", Collections.singletonList("A1"));
        graph.setDependencies("C1", Collections.singletonList("A1"));
        assertFalse(graph.hasCycleFrom("D1"));
    }

    @Test
    void testRemoveDropsBothDirections() {
        graph.setDependencies("B1", Collections.singletonList("A1"));
        graph.setDependencies("C1", Collections.singletonList("B1"));

        graph.remove("B1");

        assertTrue(graph.getDependents("A1").isEmpty());
        assertTrue(graph.getDependencies("C1").isEmpty());
        assertTrue(graph.isEmpty());
    }

    @Test
    void testSnapshotsAreSortedCopies() {
        graph.setDependencies("B1", Arrays.asList("A2", "A1"));
        Map<String, Set<String>> forward = graph.forwardSnapshot();
        assertEquals(List.of("A1", "A2"), List.copyOf(forward.get("B1")));

        forward.clear();
        assertEquals(1, graph.size());
    }
}
