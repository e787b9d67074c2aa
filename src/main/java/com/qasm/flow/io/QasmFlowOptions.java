package com.qasm.flow.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;

/**
 * Export settings, bound from a JSON file such as:
 *
 * <pre>
 * { "jsonOutput": "out/graph.json", "mermaidOutput": "out/graph.md", "mermaidTimeKey": 3 }
 * </pre>
 *
 * Unset outputs are not written. Without {@code mermaidTimeKey} the latest
 * snapshot is rendered.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class QasmFlowOptions {
    private String jsonOutput;
    private String mermaidOutput;
    private Integer mermaidTimeKey;
    private boolean logSummary;

    public static QasmFlowOptions load(Path path) {
        try {
            return new ObjectMapper().readValue(path.toFile(), QasmFlowOptions.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load options from " + path, e);
        }
    }

    public static QasmFlowOptions parse(String json) {
        try {
            return new ObjectMapper().readValue(json, QasmFlowOptions.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid options JSON: " + e.getMessage(), e);
        }
    }
}
