package com.qasm.flow.engine;

import com.qasm.flow.api.GraphEdge;
import com.qasm.flow.api.GraphNode;
import com.qasm.flow.api.GraphSnapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only storage for the live graph of one build.
 *
 * <p>
 * Snapshots taken from the arena share its lists and remember only the
 * current lengths. Nothing is ever removed or replaced, so every snapshot
 * keeps seeing exactly the prefix it was taken over.
 */
final class GraphArena {
    private final List<GraphNode> nodes = new ArrayList<>();
    private final List<GraphEdge> edges = new ArrayList<>();

    void addNode(GraphNode node) {
        nodes.add(node);
    }

    void addEdge(String source, String target) {
        edges.add(new GraphEdge(source, target));
    }

    int nodeCount() {
        return nodes.size();
    }

    int edgeCount() {
        return edges.size();
    }

    GraphSnapshot snapshot(int timeKey) {
        return new GraphSnapshot(timeKey, nodes, nodes.size(), edges, edges.size());
    }
}
