package com.qasm.flow.engine;

import java.util.List;

/**
 * A statement recognized as one of the {@link GateShape}s.
 *
 * @param shape    recognized form
 * @param name     instruction mnemonic
 * @param gateInfo parameter text for parameterized shapes, otherwise null
 * @param operands operand bits in source order
 * @param line     the statement as filtered
 */
public record ParsedInstruction(GateShape shape, String name, String gateInfo,
        List<BitReference> operands, String line) {

    public ParsedInstruction {
        if (operands.size() != shape.operandCount())
            throw new IllegalArgumentException(
                    shape + " takes " + shape.operandCount() + " operands, got " + operands.size());
        operands = List.copyOf(operands);
    }
}
