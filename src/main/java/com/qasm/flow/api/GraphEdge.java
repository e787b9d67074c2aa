package com.qasm.flow.api;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** The value held at {@code source} flows into gate {@code target}. */
@JsonPropertyOrder({ "source", "target" })
public record GraphEdge(String source, String target) {
}
