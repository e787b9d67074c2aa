package com.qasm.flow.engine;

import com.qasm.flow.api.MalformedBitReferenceException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides which {@link GateShape}, if any, an instruction statement has.
 *
 * <p>
 * Lines holding both {@code (} and {@code )} are split on parentheses: three
 * segments are a parameterized single-operand gate, four a parameterized
 * two-operand gate. Other lines are split on commas and whitespace: two
 * tokens are a single-operand gate, three a two-operand gate, four starting
 * with {@code measure} a measurement whose third token is a separator.
 * Anything else is {@link Classification.Ignored}.
 *
 * <p>
 * Once a shape matches, every operand must parse as a bit reference.
 */
public final class InstructionClassifier {
    private static final Pattern PARENS = Pattern.compile("[()]");
    private static final Pattern SEPARATORS = Pattern.compile("[,\\s]+");
    private static final Pattern TRAILING_PUNCT = Pattern.compile("[;,]+$");
    private static final String MEASURE = "measure";

    private InstructionClassifier() {
        // Utility class
    }

    /**
     * @throws MalformedBitReferenceException if a shape matches but an operand
     *                                        is not {@code letters[digits]}
     */
    public static Classification classify(String line) {
        if (line.indexOf('(') >= 0 && line.indexOf(')') >= 0)
            return classifyParameterized(line);
        return classifyPlain(line);
    }

    private static Classification classifyParameterized(String line) {
        String[] parts = PARENS.split(line, -1);
        return switch (parts.length) {
            case 3 -> Classification.recognized(new ParsedInstruction(GateShape.PARAM_SINGLE,
                    parts[0].trim(), parts[1].trim(),
                    List.of(operand(parts[2], line)), line));
            case 4 -> Classification.recognized(new ParsedInstruction(GateShape.PARAM_TWO,
                    parts[0].trim(), parts[1].trim(),
                    List.of(operand(parts[2], line), operand(parts[3], line)), line));
            default -> Classification.ignored(line, parts.length + " parenthesis segments");
        };
    }

    private static Classification classifyPlain(String line) {
        List<String> parts = new ArrayList<>();
        for (String p : SEPARATORS.split(line.trim())) {
            if (!p.isEmpty())
                parts.add(p);
        }

        switch (parts.size()) {
            case 2:
                return Classification.recognized(new ParsedInstruction(GateShape.SINGLE,
                        parts.get(0), null, List.of(operand(parts.get(1), line)), line));
            case 3:
                return Classification.recognized(new ParsedInstruction(GateShape.TWO,
                        parts.get(0), null,
                        List.of(operand(parts.get(1), line), operand(parts.get(2), line)), line));
            case 4:
                if (MEASURE.equals(parts.get(0))) {
                    return Classification.recognized(new ParsedInstruction(GateShape.MEASURE,
                            parts.get(0), null,
                            List.of(operand(parts.get(1), line), operand(parts.get(3), line)), line));
                }
                return Classification.ignored(line, "4 tokens but not a measurement");
            default:
                return Classification.ignored(line, parts.size() + " tokens");
        }
    }

    static String stripOperand(String raw) {
        return TRAILING_PUNCT.matcher(raw.trim()).replaceAll("");
    }

    private static BitReference operand(String raw, String line) {
        return BitReference.parse(stripOperand(raw), line);
    }
}
