package com.qasm.flow.api;

/** An operand names a bit that no {@code qreg}/{@code creg} declared. */
public class UnknownBitException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final String bitId;

    public UnknownBitException(String bitId) {
        super("Unknown bit referenced in gate: '" + bitId + "'");
        this.bitId = bitId;
    }

    public UnknownBitException(String bitId, String line) {
        super("Unknown bit referenced in gate: '" + bitId + "' in line: '" + line + "'");
        this.bitId = bitId;
    }

    public String getBitId() {
        return bitId;
    }
}
