package com.qasm.flow.lex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token scanner for OpenQASM source.
 *
 * <p>
 * Independent of the graph engine, which works on whole statements. The
 * scanner serves tooling that wants the raw token stream or the table of
 * declared identifiers (see {@link DeclaredIdentifiers}).
 *
 * <p>
 * Alternatives are tried in a fixed order: identifier, number, string,
 * arrow, multi-character operator, single-character symbol. Identifiers from
 * {@link #KEYWORDS} are reported as {@link TokenType#KEYWORD}.
 */
public final class QasmTokenizer {
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern LINE_COMMENT = Pattern.compile("//.*?$", Pattern.MULTILINE);

    private static final Pattern TOKEN = Pattern.compile(
            "(?<ID>[A-Za-z_][A-Za-z0-9_]*)"
                    + "|(?<NUMBER>(?:\\d+\\.\\d*|\\d*\\.\\d+|\\d+)(?:[eE][+-]?\\d+)?)"
                    + "|(?<STRING>\"(?:[^\"\\\\]|\\\\.)*\")"
                    + "|(?<ARROW>->)"
                    + "|(?<OP>==|!=|<=|>=|\\+=|-=|\\*=|/=|&&|\\|\\||::)"
                    + "|(?<SYMBOL>[{}\\[\\]();,.:<>+\\-*/%&|^~?=])");

    private static final String[] GROUPS = { "ID", "NUMBER", "STRING", "ARROW", "OP", "SYMBOL" };
    private static final TokenType[] GROUP_TYPES = {
            TokenType.IDENTIFIER, TokenType.NUMBER, TokenType.STRING,
            TokenType.ARROW, TokenType.OPERATOR, TokenType.SYMBOL };

    /** Identifiers reported as keywords. */
    public static final Set<String> KEYWORDS = Set.of(
            "OPENQASM", "qreg", "creg", "gate", "opaque", "barrier",
            "measure", "reset", "if", "include", "U", "CX",
            "qubit", "bit", "uint", "int", "let", "const", "def");

    private static final int SNIPPET_LENGTH = 20;

    private QasmTokenizer() {
        // Utility class
    }

    /**
     * Removes block comments, then line comments. A block comment is blanked
     * rather than cut: its line breaks stay and every other character becomes
     * a space, so token positions still refer to the original source.
     */
    public static String stripComments(String source) {
        String s = BLOCK_COMMENT.matcher(source).replaceAll(r -> blank(r.group()));
        return LINE_COMMENT.matcher(s).replaceAll("");
    }

    private static String blank(String comment) {
        StringBuilder sb = new StringBuilder(comment.length());
        for (int i = 0; i < comment.length(); i++) {
            char c = comment.charAt(i);
            sb.append(c == '\n' || c == '\r' ? c : ' ');
        }
        return sb.toString();
    }

    /** Strips comments from {@code source} and scans the remainder. */
    public static List<Token> tokenizeSource(String source) {
        return tokenize(stripComments(source));
    }

    /**
     * Scans comment-free text into tokens.
     *
     * @throws QasmSyntaxException on a character that starts no token
     */
    public static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(text);
        int pos = 0;
        int line = 1;
        int lineStart = 0;
        int n = text.length();

        while (pos < n) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                if (c == '\n') {
                    line++;
                    lineStart = pos + 1;
                }
                pos++;
                continue;
            }

            m.region(pos, n);
            if (!m.lookingAt()) {
                String snippet = text.substring(pos, Math.min(n, pos + SNIPPET_LENGTH)).replace("\n", "\\n");
                throw new QasmSyntaxException(c, line, pos - lineStart + 1, snippet);
            }

            for (int g = 0; g < GROUPS.length; g++) {
                String val = m.group(GROUPS[g]);
                if (val != null) {
                    TokenType type = GROUP_TYPES[g];
                    if (type == TokenType.IDENTIFIER && KEYWORDS.contains(val))
                        type = TokenType.KEYWORD;
                    tokens.add(new Token(type, val, line, pos - lineStart + 1));
                    break;
                }
            }
            pos = m.end();
        }
        return Collections.unmodifiableList(tokens);
    }

    /** Keeps only tokens of the given types, preserving order. */
    public static List<Token> filter(List<Token> tokens, Set<TokenType> include) {
        if (include == null || include.isEmpty())
            return tokens;
        List<Token> out = new ArrayList<>();
        for (Token t : tokens)
            if (include.contains(t.type()))
                out.add(t);
        return out;
    }
}
