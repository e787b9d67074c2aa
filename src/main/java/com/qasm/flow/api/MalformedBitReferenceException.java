package com.qasm.flow.api;

/** An operand token is not of the form {@code letters[digits]}. */
public class MalformedBitReferenceException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final String token;
    private final String line;

    public MalformedBitReferenceException(String token, String line) {
        super("Unrecognized bit format: '" + token + "' in line: '" + line + "'");
        this.token = token;
        this.line = line;
    }

    public String getToken() {
        return token;
    }

    public String getLine() {
        return line;
    }
}
