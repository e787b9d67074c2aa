package com.qasm.flow;

import com.qasm.flow.api.GraphSnapshot;
import com.qasm.flow.api.NodeType;
import com.qasm.flow.api.UnknownBitException;
import com.qasm.flow.io.QasmFlowOptions;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class QasmFlowGraphTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    static Path circuit(String name) throws Exception {
        return Path.of(QasmFlowGraphTest.class.getResource("/circuits/" + name).toURI());
    }

    @Test
    public void testParseBellFile() throws Exception {
        QasmFlowGraph graph = QasmFlowGraph.parseFile(circuit("bell.qasm"));

        // barrier on line 4 names three operands, so it is skipped
        assertEquals(List.of(0, 1, 2, 3, 5, 6), new ArrayList<>(graph.getSequence().timeKeys()));

        GraphSnapshot last = graph.getSequence().latest();
        assertEquals(9, last.nodeCount());
        assertEquals(NodeType.ONE_QUIT_GATE, last.node("g_2").orElseThrow().type());
        assertEquals("pi/4", last.node("g_2").orElseThrow().gateInfo());
        assertEquals(List.of("g_1", "c0"), last.sourcesOf("g_3"));
        assertEquals(List.of("g_2", "c1"), last.sourcesOf("g_4"));
        assertEquals(10, graph.getStatements().size());
    }

    @Test
    public void testUndeclaredRegisterFile() throws Exception {
        try {
            QasmFlowGraph.parseFile(circuit("undeclared.qasm"));
            fail("Expected UnknownBitException");
        } catch (UnknownBitException e) {
            assertEquals("x0", e.getBitId());
        }
    }

    @Test
    public void testExportWritesJsonAndMermaid() throws Exception {
        QasmFlowGraph graph = QasmFlowGraph.parse("qreg q[2];\nh q[0];\ncx q[0],q[1];");
        Path json = tmp.getRoot().toPath().resolve("out/graph.json");
        Path md = tmp.getRoot().toPath().resolve("out/graph.md");

        QasmFlowOptions options = new QasmFlowOptions();
        options.setJsonOutput(json.toString());
        options.setMermaidOutput(md.toString());
        options.setMermaidTimeKey(1);
        graph.export(options);

        assertTrue(Files.readString(json).contains("\"two_qubit_gate\""));
        String diagram = Files.readString(md);
        assertTrue(diagram.startsWith("```mermaid\ngraph LR;"));
        assertTrue(diagram.contains("q0 --> g_0"));
        assertFalse("time-key 1 predates cx", diagram.contains("g_1"));
    }

    @Test
    public void testExportWithoutOutputsWritesNothing() {
        QasmFlowGraph graph = QasmFlowGraph.parse("qreg q[1];\nh q[0];");
        graph.export(new QasmFlowOptions());
        assertEquals(0, tmp.getRoot().list().length);
    }

    @Test
    public void testMermaidDefaultsToLatest() {
        QasmFlowGraph graph = QasmFlowGraph.parse("qreg q[1];\nh q[0];\nx q[0];");
        assertTrue(graph.toMermaid(null).contains("g_0 --> g_1"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSnapshotAtMissingKey() {
        QasmFlowGraph.parse("qreg q[1];\nfoo;\nh q[0];").snapshot(1);
    }
}
