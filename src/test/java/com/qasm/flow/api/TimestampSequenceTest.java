package com.qasm.flow.api;

import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

import static org.junit.Assert.*;

public class TimestampSequenceTest {

    private final List<GraphNode> nodes = new ArrayList<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    private TimestampSequence seq;

    @Before
    public void setUp() {
        nodes.add(new GraphNode("q0", NodeType.QUBIT, "q0", null));
        TreeMap<Integer, GraphSnapshot> map = new TreeMap<>();
        map.put(0, new GraphSnapshot(0, nodes, 1, edges, 0));

        nodes.add(GraphNode.gate("g_0", NodeType.SINGLE_QUBIT_GATE, "h", null));
        edges.add(new GraphEdge("q0", "g_0"));
        map.put(3, new GraphSnapshot(3, nodes, 2, edges, 1));
        seq = new TimestampSequence(map);
    }

    @Test
    public void testSnapshotIgnoresLaterGrowth() {
        GraphSnapshot first = seq.initial();
        nodes.add(GraphNode.gate("g_1", NodeType.SINGLE_QUBIT_GATE, "x", null));
        edges.add(new GraphEdge("g_0", "g_1"));

        assertEquals(1, first.nodes().size());
        assertTrue(first.edges().isEmpty());
        assertFalse(seq.latest().containsNode("g_1"));
        assertEquals(List.of("q0"), seq.latest().sourcesOf("g_0"));
        assertTrue(seq.latest().targetsOf("g_0").isEmpty());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testNodesAreReadOnly() {
        seq.latest().nodes().clear();
    }

    @Test
    public void testFloorLookup() {
        assertSame(seq.initial(), seq.at(2));
        assertSame(seq.latest(), seq.at(99));
        assertFalse(seq.contains(2));
        assertEquals(1, seq.latest().gateCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testGetMissingKey() {
        seq.get(2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRequiresInitialKey() {
        TreeMap<Integer, GraphSnapshot> map = new TreeMap<>();
        map.put(1, new GraphSnapshot(1, nodes, 1, edges, 0));
        new TimestampSequence(map);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCountBeyondStore() {
        new GraphSnapshot(0, nodes, nodes.size() + 1, edges, 0);
    }
}
