package com.qasm.flow.engine;

/** Phases of one build. The only transition is DECLARING to INSTRUCTING. */
public enum EngineState {
    /** Collecting {@code qreg}/{@code creg} declarations into the bit universe. */
    DECLARING,
    /** Turning instruction lines into gate nodes. Terminal once input runs out. */
    INSTRUCTING;

    EngineState next() {
        if (this != DECLARING)
            throw new IllegalStateException("No transition out of " + this);
        return INSTRUCTING;
    }
}
