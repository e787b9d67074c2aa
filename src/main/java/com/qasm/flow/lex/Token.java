package com.qasm.flow.lex;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One lexical token. Serializes as {@code {"typ": ..., "val": ...}}.
 *
 * @param type   lexical category
 * @param value  matched text
 * @param line   1-based line in the comment-stripped source
 * @param column 1-based column in the comment-stripped source
 */
@JsonPropertyOrder({ "typ", "val" })
public record Token(
        @JsonProperty("typ") TokenType type,
        @JsonProperty("val") String value,
        @JsonIgnore int line,
        @JsonIgnore int column) {

    public boolean is(TokenType t) {
        return type == t;
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && value.equals(keyword);
    }
}
