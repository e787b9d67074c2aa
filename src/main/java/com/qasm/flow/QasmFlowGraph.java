package com.qasm.flow;

import com.qasm.flow.api.GraphBuildListener;
import com.qasm.flow.api.GraphSnapshot;
import com.qasm.flow.api.TimestampSequence;
import com.qasm.flow.engine.GraphConstructionEngine;
import com.qasm.flow.io.QasmFlowOptions;
import com.qasm.flow.io.QasmSource;
import com.qasm.flow.io.SnapshotJsonWriter;
import com.qasm.flow.lex.LineFilter;
import com.qasm.flow.util.SnapshotExplain;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * A high-level wrapper that turns circuit text into its snapshot sequence.
 * <p>
 * This class handles:
 * <ul>
 * <li>Filtering raw text into statements with {@link LineFilter}</li>
 * <li>Building snapshots with {@link GraphConstructionEngine}</li>
 * <li>Exporting the result as JSON and as a Mermaid diagram</li>
 * </ul>
 */
public final class QasmFlowGraph {
    private static final Logger log = LogManager.getLogger(QasmFlowGraph.class);

    private final String sourceName;
    private final List<String> statements;
    private final TimestampSequence sequence;

    private QasmFlowGraph(String sourceName, List<String> statements, TimestampSequence sequence) {
        this.sourceName = sourceName;
        this.statements = statements;
        this.sequence = sequence;
    }

    /**
     * Parses circuit text.
     *
     * @throws com.qasm.flow.api.UnknownBitException            on an undeclared operand
     * @throws com.qasm.flow.api.MalformedBitReferenceException on an operand that is not {@code name[index]}
     */
    public static QasmFlowGraph parse(String source) {
        return parse("<inline>", source, GraphBuildListener.NONE);
    }

    public static QasmFlowGraph parse(String sourceName, String source, GraphBuildListener listener) {
        List<String> statements = LineFilter.filter(source);
        TimestampSequence sequence = new GraphConstructionEngine(listener).build(statements);
        QasmFlowGraph graph = new QasmFlowGraph(sourceName, statements, sequence);
        log.info("Parsed {}: {} statements, {} snapshots, {} bits, {} gates",
                sourceName, statements.size(), sequence.size(),
                sequence.initial().nodeCount(), sequence.latest().gateCount());
        return graph;
    }

    /** Reads and parses a circuit file. */
    public static QasmFlowGraph parseFile(Path path) {
        return parse(path.toString(), QasmSource.read(path), GraphBuildListener.NONE);
    }

    public TimestampSequence getSequence() {
        return sequence;
    }

    public List<String> getStatements() {
        return statements;
    }

    public String getSourceName() {
        return sourceName;
    }

    public GraphSnapshot snapshot(int timeKey) {
        return sequence.get(timeKey);
    }

    public String toJson() {
        return new SnapshotJsonWriter().toJson(sequence);
    }

    /** Mermaid diagram of the snapshot at {@code timeKey}, or of the latest one if null. */
    public String toMermaid(Integer timeKey) {
        GraphSnapshot s = timeKey != null ? sequence.get(timeKey) : sequence.latest();
        return new SnapshotExplain(s).toMermaid();
    }

    /** Writes the outputs {@code options} asks for. */
    public void export(QasmFlowOptions options) {
        if (options.getJsonOutput() != null) {
            Path out = Path.of(options.getJsonOutput());
            new SnapshotJsonWriter().write(sequence, out);
            log.info("Snapshots saved to {}", out);
        }
        if (options.getMermaidOutput() != null) {
            Path out = Path.of(options.getMermaidOutput());
            String mermaid = "```mermaid\n" + toMermaid(options.getMermaidTimeKey()) + "```\n";
            try {
                Path parent = out.toAbsolutePath().getParent();
                if (parent != null)
                    Files.createDirectories(parent);
                Files.writeString(out, mermaid, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write diagram to " + out, e);
            }
            log.info("Graph visualization saved to {}", out);
        }
        if (options.isLogSummary()) {
            log.info("\n{}", new SnapshotExplain(sequence.latest()).dumpSnapshot());
        }
    }
}
