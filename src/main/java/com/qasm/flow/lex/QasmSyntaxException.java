package com.qasm.flow.lex;

/** The token scanner met a character that starts no known token. */
public class QasmSyntaxException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    public QasmSyntaxException(char ch, int line, int column, String snippet) {
        super("Unexpected character '" + ch + "' at " + line + ":" + column + " near '" + snippet + "'");
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
