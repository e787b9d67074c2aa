package com.qasm.flow.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One node of a flow graph: either a declared bit or a gate instruction.
 *
 * @param id       unique id ({@code q0}, {@code c1}, {@code g_3})
 * @param type     node kind
 * @param name     display name; the bit id for bits, the mnemonic for gates
 * @param gateInfo parameter text of a parameterized gate, otherwise null
 */
@JsonPropertyOrder({ "id", "type", "name", "gate_info" })
public record GraphNode(
        String id,
        NodeType type,
        String name,
        @JsonProperty("gate_info") @JsonInclude(JsonInclude.Include.NON_NULL) String gateInfo) {

    public static GraphNode bit(Bit bit) {
        return new GraphNode(bit.getId(), bit.getKind(), bit.getName(), null);
    }

    public static GraphNode gate(String id, NodeType type, String name, String gateInfo) {
        if (type.isBit())
            throw new IllegalArgumentException("Not a gate type: " + type);
        return new GraphNode(id, type, name, gateInfo);
    }

    @JsonIgnore
    public boolean isGate() {
        return !type.isBit();
    }
}
