package com.qasm.flow.lex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Table of names introduced by declarations in a token stream.
 *
 * <p>
 * Recognized forms, keyed by the declaring keyword:
 * <ul>
 * <li>{@code qreg ID [ NUMBER ] ;}</li>
 * <li>{@code creg ID [ NUMBER ] ;}</li>
 * <li>{@code qubit ID ...}</li>
 * <li>{@code bit ID ...}</li>
 * <li>{@code gate ID ...} and {@code opaque ID ...}, both under {@code gate}</li>
 * </ul>
 * Names are de-duplicated per kind, first occurrence wins the position.
 */
public final class DeclaredIdentifiers {
    /** Kinds in reporting order. */
    public static final List<String> KINDS = List.of("qreg", "creg", "qubit", "bit", "gate");

    private final Map<String, List<String>> byKind;

    private DeclaredIdentifiers(Map<String, List<String>> byKind) {
        this.byKind = byKind;
    }

    public static DeclaredIdentifiers collect(List<Token> tokens) {
        Map<String, Set<String>> acc = new LinkedHashMap<>();
        for (String kind : KINDS)
            acc.put(kind, new LinkedHashSet<>());

        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.type() != TokenType.KEYWORD)
                continue;
            String kind = switch (t.value()) {
                case "qreg", "creg", "qubit", "bit" -> t.value();
                case "gate", "opaque" -> "gate";
                default -> null;
            };
            if (kind == null)
                continue;
            String name = nextIdentifier(tokens, i);
            if (name != null)
                acc.get(kind).add(name);
        }

        Map<String, List<String>> out = new LinkedHashMap<>();
        for (var e : acc.entrySet())
            out.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
        return new DeclaredIdentifiers(Collections.unmodifiableMap(out));
    }

    private static String nextIdentifier(List<Token> tokens, int idx) {
        if (idx + 1 < tokens.size() && tokens.get(idx + 1).type() == TokenType.IDENTIFIER)
            return tokens.get(idx + 1).value();
        return null;
    }

    /** Names declared with {@code kind}; empty for unknown kinds. */
    public List<String> of(String kind) {
        return byKind.getOrDefault(kind, Collections.emptyList());
    }

    public Map<String, List<String>> asMap() {
        return byKind;
    }

    /**
     * Flattens the requested kinds, in the order given, into
     * {@code {"typ": kind, "val": name}} entries.
     */
    public List<Map<String, String>> flatten(List<String> kinds) {
        List<Map<String, String>> out = new ArrayList<>();
        for (String kind : kinds) {
            for (String name : of(kind)) {
                Map<String, String> entry = new LinkedHashMap<>();
                entry.put("typ", kind);
                entry.put("val", name);
                out.add(entry);
            }
        }
        return out;
    }
}
