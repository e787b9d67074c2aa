package com.qasm.flow.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.qasm.flow.api.GraphSnapshot;
import com.qasm.flow.api.TimestampSequence;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes snapshots to the JSON layout the graph viewer reads:
 *
 * <pre>
 * {
 *   "0": { "nodes": [ {"id": "q0", "type": "qubit", "name": "q0"} ], "edges": [] },
 *   "1": { "nodes": [ ..., {"id": "g_0", "type": "single_qubit_gate", "name": "h"} ],
 *          "edges": [ {"source": "q0", "target": "g_0"} ] }
 * }
 * </pre>
 *
 * {@code gate_info} appears only on parameterized gates.
 */
public final class SnapshotJsonWriter {
    private final ObjectWriter writer;

    public SnapshotJsonWriter() {
        this(new ObjectMapper());
    }

    public SnapshotJsonWriter(ObjectMapper mapper) {
        this.writer = mapper.writerWithDefaultPrettyPrinter();
    }

    public String toJson(TimestampSequence sequence) {
        return write(sequence);
    }

    public String toJson(GraphSnapshot snapshot) {
        return write(snapshot);
    }

    /** Writes the whole sequence to {@code path} as UTF-8, creating parent directories. */
    public void write(TimestampSequence sequence, Path path) {
        String json = toJson(sequence);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null)
                Files.createDirectories(parent);
            Files.writeString(path, json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write snapshots to " + path, e);
        }
    }

    private String write(Object value) {
        try {
            return writer.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
