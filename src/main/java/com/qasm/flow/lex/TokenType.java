package com.qasm.flow.lex;

import com.fasterxml.jackson.annotation.JsonValue;

/** Lexical categories produced by {@link QasmTokenizer}. */
public enum TokenType {
    IDENTIFIER("identifier"),
    KEYWORD("keyword"),
    NUMBER("number"),
    STRING("string"),
    ARROW("arrow"),
    OPERATOR("operator"),
    SYMBOL("symbol");

    private final String wireName;

    TokenType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static TokenType fromString(String text) {
        for (TokenType t : TokenType.values()) {
            if (t.wireName.equalsIgnoreCase(text) || t.name().equalsIgnoreCase(text)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown TokenType: " + text);
    }
}
