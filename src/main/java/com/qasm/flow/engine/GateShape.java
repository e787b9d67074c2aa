package com.qasm.flow.engine;

import com.qasm.flow.api.NodeType;

/** The five instruction forms the engine turns into gate nodes. */
public enum GateShape {
    /** {@code h q[0];} */
    SINGLE(NodeType.SINGLE_QUBIT_GATE, 1),
    /** {@code cx q[0],q[1];} */
    TWO(NodeType.TWO_QUBIT_GATE, 2),
    /** {@code rz(pi/2) q[0];} */
    PARAM_SINGLE(NodeType.ONE_QUIT_GATE, 1),
    /** Parenthesized line that splits into four segments. */
    PARAM_TWO(NodeType.TWO_QUBIT_GATE, 2),
    /** {@code measure q[0] -> c[0];} */
    MEASURE(NodeType.MEASUREMENT, 2);

    private final NodeType nodeType;
    private final int operandCount;

    GateShape(NodeType nodeType, int operandCount) {
        this.nodeType = nodeType;
        this.operandCount = operandCount;
    }

    public NodeType nodeType() {
        return nodeType;
    }

    public int operandCount() {
        return operandCount;
    }
}
