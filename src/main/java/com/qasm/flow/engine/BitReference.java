package com.qasm.flow.engine;

import com.qasm.flow.api.MalformedBitReferenceException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An operand such as {@code q[0]}, split into register and index.
 *
 * @param register register letters
 * @param index    index digits as written
 */
public record BitReference(String register, String index) {
    private static final Pattern SHAPE = Pattern.compile("([a-zA-Z]+)\\[(\\d+)\\]");

    /** Bit id: register followed by index, {@code q[0]} gives {@code q0}. */
    public String bitId() {
        return register + index;
    }

    /**
     * Extracts the first {@code letters[digits]} occurrence in {@code token}.
     *
     * @param token operand text, already stripped of trailing separators
     * @param line  full statement, for the error message
     * @throws MalformedBitReferenceException if the token holds no such shape
     */
    public static BitReference parse(String token, String line) {
        Matcher m = SHAPE.matcher(token);
        if (!m.find())
            throw new MalformedBitReferenceException(token, line);
        return new BitReference(m.group(1), m.group(2));
    }
}
