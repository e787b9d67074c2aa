package com.qasm.flow.api;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of node that appear in a circuit flow graph.
 *
 * <p>
 * The wire names are the ones consumers of the exported JSON already key on,
 * including the historical {@code one_quit_gate} spelling for parameterized
 * single-operand gates.
 */
public enum NodeType {
    QUBIT("qubit", 0),
    CLASSICAL_BIT("classical_bit", 0),
    SINGLE_QUBIT_GATE("single_qubit_gate", 1),
    ONE_QUIT_GATE("one_quit_gate", 1),
    TWO_QUBIT_GATE("two_qubit_gate", 2),
    MEASUREMENT("measurement", 2);

    private final String wireName;
    private final int operandCount;

    NodeType(String wireName, int operandCount) {
        this.wireName = wireName;
        this.operandCount = operandCount;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Number of incoming edges a node of this type receives; 0 for bits. */
    public int operandCount() {
        return operandCount;
    }

    public boolean isBit() {
        return this == QUBIT || this == CLASSICAL_BIT;
    }
}
