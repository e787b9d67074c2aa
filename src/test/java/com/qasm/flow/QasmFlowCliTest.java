package com.qasm.flow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class QasmFlowCliTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private QasmFlowCli cli;

    @Before
    public void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        cli = new QasmFlowCli(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testPrintsSnapshotsToStdout() throws Exception {
        String bell = QasmFlowGraphTest.circuit("bell.qasm").toString();
        assertEquals(QasmFlowCli.EXIT_OK, cli.run(new String[] { bell }));
        JsonNode root = new ObjectMapper().readTree(stdout());
        assertTrue(root.has("0"));
        assertTrue(root.has("6"));
        assertFalse(root.has("4"));
    }

    @Test
    public void testWritesJsonFile() throws Exception {
        String bell = QasmFlowGraphTest.circuit("bell.qasm").toString();
        Path json = tmp.getRoot().toPath().resolve("graph.json");
        assertEquals(QasmFlowCli.EXIT_OK, cli.run(new String[] { bell, "--out", json.toString() }));
        assertTrue(Files.exists(json));
        assertEquals("", stdout());
    }

    @Test
    public void testTokensAsNdjson() throws Exception {
        Path src = tmp.newFile("t.qasm").toPath();
        Files.writeString(src, "qreg q[1];\n");
        assertEquals(QasmFlowCli.EXIT_OK,
                cli.run(new String[] { src.toString(), "--tokens", "--include", "identifier", "number", "--ndjson" }));
        String[] lines = stdout().trim().split("\\R");
        assertEquals(2, lines.length);
        assertEquals("{\"typ\":\"identifier\",\"val\":\"q\"}", lines[0]);
        assertEquals("{\"typ\":\"number\",\"val\":\"1\"}", lines[1]);
    }

    @Test
    public void testIdentsOf() throws Exception {
        Path src = tmp.newFile("i.qasm").toPath();
        Files.writeString(src, "qreg q[1];\ncreg c[1];\nqreg anc[2];\n");
        assertEquals(QasmFlowCli.EXIT_OK, cli.run(new String[] { src.toString(), "--idents-of", "qreg" }));
        JsonNode arr = new ObjectMapper().readTree(stdout());
        assertEquals(2, arr.size());
        assertEquals("qreg", arr.get(0).get("typ").asText());
        assertEquals("anc", arr.get(1).get("val").asText());
    }

    @Test
    public void testParseFailureExitCode() throws Exception {
        String bad = QasmFlowGraphTest.circuit("undeclared.qasm").toString();
        assertEquals(QasmFlowCli.EXIT_PARSE_ERROR, cli.run(new String[] { bad }));
        assertTrue(stderr().contains("x0"));
        assertEquals("", stdout());
    }

    @Test
    public void testTokenizerFailureExitCode() throws Exception {
        Path src = tmp.newFile("bad.qasm").toPath();
        Files.writeString(src, "h q[0] $;\n");
        assertEquals(QasmFlowCli.EXIT_PARSE_ERROR, cli.run(new String[] { src.toString(), "--tokens" }));
        assertTrue(stderr().contains("'$'"));
    }

    @Test
    public void testUsageErrors() {
        assertEquals(QasmFlowCli.EXIT_USAGE, cli.run(new String[] { "a.qasm", "--bogus" }));
        assertEquals(QasmFlowCli.EXIT_USAGE, cli.run(new String[] { "a.qasm", "--out" }));
        assertEquals(QasmFlowCli.EXIT_USAGE, cli.run(new String[] { "a.qasm", "--time-key", "x" }));
        assertEquals(QasmFlowCli.EXIT_USAGE, cli.run(new String[] { "a.qasm", "--idents-of", "nope" }));
        assertEquals(QasmFlowCli.EXIT_USAGE, cli.run(new String[] { "a.qasm", "b.qasm" }));
        assertTrue(stderr().contains("Usage:"));
    }

    @Test
    public void testTimeKeyWithoutSnapshot() throws Exception {
        Path src = tmp.newFile("k.qasm").toPath();
        Files.writeString(src, "qreg q[1];\nh q[0];\n");
        Path md = tmp.getRoot().toPath().resolve("graph.md");

        assertEquals(QasmFlowCli.EXIT_USAGE,
                cli.run(new String[] { src.toString(), "--mermaid", md.toString(), "--time-key", "5" }));
        assertTrue(stderr().contains("time-key 5"));
        assertTrue(stderr().contains("[0, 1]"));
        assertFalse(Files.exists(md));
        assertEquals("", stdout());
    }

    @Test
    public void testTimeKeyFromOptionsFileWithoutSnapshot() throws Exception {
        Path src = tmp.newFile("o.qasm").toPath();
        Files.writeString(src, "qreg q[1];\nh q[0];\n");
        Path options = tmp.newFile("options.json").toPath();
        Files.writeString(options, "{\"mermaidTimeKey\":3}");

        assertEquals(QasmFlowCli.EXIT_USAGE,
                cli.run(new String[] { src.toString(), "--options", options.toString() }));
        assertTrue(stderr().contains("time-key 3"));
    }

    @Test
    public void testTimeKeyWithSnapshot() throws Exception {
        Path src = tmp.newFile("ok.qasm").toPath();
        Files.writeString(src, "qreg q[1];\nh q[0];\n");
        Path md = tmp.getRoot().toPath().resolve("graph.md");

        assertEquals(QasmFlowCli.EXIT_OK,
                cli.run(new String[] { src.toString(), "--mermaid", md.toString(), "--time-key", "0" }));
        assertFalse(Files.readString(md).contains("g_0"));
    }

    @Test
    public void testMissingFile() {
        Path missing = tmp.getRoot().toPath().resolve("missing.qasm");
        assertEquals(QasmFlowCli.EXIT_PARSE_ERROR, cli.run(new String[] { missing.toString() }));
        assertTrue(stderr().contains("missing.qasm"));
    }
}
