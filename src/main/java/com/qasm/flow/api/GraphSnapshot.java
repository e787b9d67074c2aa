package com.qasm.flow.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Immutable view of the flow graph as it stood at one time-key.
 *
 * <p>
 * A snapshot does not duplicate the graph. It records how many nodes and
 * edges existed when it was taken and reads that prefix out of the
 * append-only storage it was created over. Because the storage only ever
 * grows, the prefix never changes, so later growth of the graph cannot alter
 * a snapshot that has already been handed out.
 */
@JsonPropertyOrder({ "nodes", "edges" })
public final class GraphSnapshot {
    private final int timeKey;
    private final List<GraphNode> nodeStore;
    private final List<GraphEdge> edgeStore;
    private final int nodeCount;
    private final int edgeCount;

    /**
     * The stores are shared, not copied. Callers may append to them after
     * construction but must never remove, replace or reorder elements, or
     * the snapshot stops being immutable.
     *
     * @param timeKey   time-key this snapshot is stored under
     * @param nodeStore append-only node storage
     * @param nodeCount number of leading nodes that belong to this snapshot
     * @param edgeStore append-only edge storage
     * @param edgeCount number of leading edges that belong to this snapshot
     */
    public GraphSnapshot(int timeKey, List<GraphNode> nodeStore, int nodeCount,
            List<GraphEdge> edgeStore, int edgeCount) {
        if (nodeCount < 0 || nodeCount > nodeStore.size())
            throw new IllegalArgumentException("nodeCount " + nodeCount + " outside store of " + nodeStore.size());
        if (edgeCount < 0 || edgeCount > edgeStore.size())
            throw new IllegalArgumentException("edgeCount " + edgeCount + " outside store of " + edgeStore.size());
        this.timeKey = timeKey;
        this.nodeStore = nodeStore;
        this.edgeStore = edgeStore;
        this.nodeCount = nodeCount;
        this.edgeCount = edgeCount;
    }

    public int timeKey() {
        return timeKey;
    }

    /** Bits in declaration order followed by gates in creation order. */
    @JsonProperty("nodes")
    public List<GraphNode> nodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodeStore.subList(0, nodeCount)));
    }

    /** Edges in creation order. */
    @JsonProperty("edges")
    public List<GraphEdge> edges() {
        return Collections.unmodifiableList(new ArrayList<>(edgeStore.subList(0, edgeCount)));
    }

    public int nodeCount() {
        return nodeCount;
    }

    public int edgeCount() {
        return edgeCount;
    }

    public Optional<GraphNode> node(String id) {
        for (int i = 0; i < nodeCount; i++) {
            GraphNode n = nodeStore.get(i);
            if (n.id().equals(id))
                return Optional.of(n);
        }
        return Optional.empty();
    }

    public boolean containsNode(String id) {
        return node(id).isPresent();
    }

    public boolean containsEdge(String source, String target) {
        for (int i = 0; i < edgeCount; i++) {
            GraphEdge e = edgeStore.get(i);
            if (e.source().equals(source) && e.target().equals(target))
                return true;
        }
        return false;
    }

    /** Sources feeding {@code target}, in operand order. */
    public List<String> sourcesOf(String target) {
        List<String> sources = new ArrayList<>(2);
        for (int i = 0; i < edgeCount; i++) {
            GraphEdge e = edgeStore.get(i);
            if (e.target().equals(target))
                sources.add(e.source());
        }
        return sources;
    }

    /** Targets fed by {@code source}, in creation order. */
    public List<String> targetsOf(String source) {
        List<String> targets = new ArrayList<>(2);
        for (int i = 0; i < edgeCount; i++) {
            GraphEdge e = edgeStore.get(i);
            if (e.source().equals(source))
                targets.add(e.target());
        }
        return targets;
    }

    public int gateCount() {
        int gates = 0;
        for (int i = 0; i < nodeCount; i++)
            if (nodeStore.get(i).isGate())
                gates++;
        return gates;
    }

    @Override
    public String toString() {
        return "GraphSnapshot[t=" + timeKey + ", nodes=" + nodeCount + ", edges=" + edgeCount + "]";
    }
}
