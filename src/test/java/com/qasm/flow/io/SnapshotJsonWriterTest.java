package com.qasm.flow.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qasm.flow.api.TimestampSequence;
import com.qasm.flow.engine.GraphConstructionEngine;
import com.qasm.flow.lex.LineFilter;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.Assert.*;

public class SnapshotJsonWriterTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final ObjectMapper mapper = new ObjectMapper();

    private static TimestampSequence sample() {
        return new GraphConstructionEngine().build(LineFilter.filter(
                "qreg q[2];\ncreg c[1];\nh q[0];\ncrx(pi/3) q[0];\ncx q[0],q[1];\nmeasure q[1] -> c[0];"));
    }

    @Test
    public void testTopLevelKeysAreTimeKeys() throws Exception {
        JsonNode root = mapper.readTree(new SnapshotJsonWriter().toJson(sample()));
        List<String> keys = new ArrayList<>();
        Iterator<String> it = root.fieldNames();
        while (it.hasNext())
            keys.add(it.next());
        assertEquals(List.of("0", "1", "2", "3", "4"), keys);
        assertEquals(0, root.get("0").get("edges").size());
        assertEquals(3, root.get("0").get("nodes").size());
    }

    @Test
    public void testNodeAndEdgeFields() throws Exception {
        JsonNode root = mapper.readTree(new SnapshotJsonWriter().toJson(sample()));
        JsonNode last = root.get("4");

        JsonNode q0 = last.get("nodes").get(0);
        assertEquals("q0", q0.get("id").asText());
        assertEquals("qubit", q0.get("type").asText());
        assertEquals("q0", q0.get("name").asText());
        assertFalse(q0.has("gate_info"));

        JsonNode c0 = last.get("nodes").get(2);
        assertEquals("classical_bit", c0.get("type").asText());

        JsonNode rot = last.get("nodes").get(4);
        assertEquals("g_1", rot.get("id").asText());
        assertEquals("one_quit_gate", rot.get("type").asText());
        assertEquals("crx", rot.get("name").asText());
        assertEquals("pi/3", rot.get("gate_info").asText());

        JsonNode meas = last.get("nodes").get(6);
        assertEquals("measurement", meas.get("type").asText());

        JsonNode edge = last.get("edges").get(0);
        assertEquals("q0", edge.get("source").asText());
        assertEquals("g_0", edge.get("target").asText());
        assertEquals(2, edge.size());
    }

    @Test
    public void testSingleSnapshot() throws Exception {
        JsonNode s = mapper.readTree(new SnapshotJsonWriter().toJson(sample().get(1)));
        assertEquals(2, s.size());
        assertEquals(4, s.get("nodes").size());
        assertEquals(1, s.get("edges").size());
    }

    @Test
    public void testWriteToFile() throws Exception {
        Path out = tmp.getRoot().toPath().resolve("nested/graph.json");
        new SnapshotJsonWriter().write(sample(), out);
        assertTrue(Files.exists(out));
        JsonNode root = mapper.readTree(Files.readString(out));
        assertTrue(root.has("4"));
    }
}
