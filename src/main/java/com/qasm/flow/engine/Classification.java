package com.qasm.flow.engine;

/**
 * Outcome of classifying one instruction statement: either it matches a
 * gate shape, or it is skipped without touching the graph.
 */
public interface Classification {

    boolean isRecognized();

    static Classification recognized(ParsedInstruction instruction) {
        return new Recognized(instruction);
    }

    static Classification ignored(String line, String reason) {
        return new Ignored(line, reason);
    }

    /** The statement becomes exactly one gate node. */
    record Recognized(ParsedInstruction instruction) implements Classification {
        @Override
        public boolean isRecognized() {
            return true;
        }
    }

    /** The statement matches no gate shape. Not an error. */
    record Ignored(String line, String reason) implements Classification {
        @Override
        public boolean isRecognized() {
            return false;
        }
    }
}
