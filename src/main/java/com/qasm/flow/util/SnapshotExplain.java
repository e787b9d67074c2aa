package com.qasm.flow.util;

import com.qasm.flow.api.GraphEdge;
import com.qasm.flow.api.GraphNode;
import com.qasm.flow.api.GraphSnapshot;

import java.util.List;

/**
 * Diagnostic utility for inspecting one snapshot.
 *
 * <p>
 * Generates a plain-text dump for logs and a Mermaid diagram for embedding
 * in Markdown. Not meant for large circuits in a tight loop (allocates
 * strings, scans the edge list per node).
 */
public final class SnapshotExplain {
    private final GraphSnapshot snapshot;

    public SnapshotExplain(GraphSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(String nodeId) {
        GraphNode node = snapshot.node(nodeId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown node: " + nodeId));
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node.id()).append('\n')
                .append("  Type: ").append(node.type().wireName()).append('\n')
                .append("  Name: ").append(node.name()).append('\n');
        if (node.gateInfo() != null)
            sb.append("  Params: ").append(node.gateInfo()).append('\n');
        sb.append("  Inputs: ").append(String.join(", ", snapshot.sourcesOf(nodeId))).append('\n');
        sb.append("  Outputs: ").append(String.join(", ", snapshot.targetsOf(nodeId)));
        return sb.append('\n').toString();
    }

    /**
     * Dumps the snapshot in a dot-like text format.
     */
    public String dumpSnapshot() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph @").append(snapshot.timeKey())
                .append(" (").append(snapshot.nodeCount()).append(" nodes, ")
                .append(snapshot.edgeCount()).append(" edges):\n");
        List<GraphNode> nodes = snapshot.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            GraphNode node = nodes.get(i);
            sb.append("  [").append(i).append("] ").append(node.id())
                    .append(" ").append(node.type().wireName());
            if (node.isGate()) {
                sb.append(" ").append(node.name());
                if (node.gateInfo() != null)
                    sb.append("(").append(node.gateInfo()).append(")");
            }
            List<String> targets = snapshot.targetsOf(node.id());
            if (!targets.isEmpty())
                sb.append(" -> ").append(String.join(", ", targets));
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram, nodes first in snapshot order,
     * then edges.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph LR;\n");

        for (GraphNode node : snapshot.nodes()) {
            String label = node.isGate() && node.gateInfo() != null
                    ? node.name() + "(" + node.gateInfo() + ")"
                    : node.name();
            sb.append("  ").append(sanitize(node.id()));
            if (node.isGate()) {
                sb.append("[\"").append(escape(label)).append("\"];\n");
            } else {
                sb.append("((\"").append(escape(label)).append("\"));\n");
            }
        }

        for (GraphEdge edge : snapshot.edges()) {
            sb.append("  ").append(sanitize(edge.source())).append(" --> ")
                    .append(sanitize(edge.target())).append(";\n");
        }
        return sb.toString();
    }

    private static String sanitize(String id) {
        return id.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    private static String escape(String label) {
        return label.replace("\"", "#quot;");
    }
}
