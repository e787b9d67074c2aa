package com.qasm.flow.lex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns raw circuit text into the ordered list of statements the graph
 * engine consumes.
 *
 * <p>
 * Each line is cut at its first {@code //}, trimmed, and dropped if nothing
 * is left. Order is preserved. There are no error conditions.
 */
public final class LineFilter {
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
    private static final String LINE_COMMENT = "//";

    private LineFilter() {
        // Utility class
    }

    public static List<String> filter(String source) {
        if (source == null || source.isEmpty())
            return Collections.emptyList();

        List<String> statements = new ArrayList<>();
        for (String raw : LINE_BREAK.split(source, -1)) {
            String line = stripComment(raw).trim();
            if (!line.isEmpty())
                statements.add(line);
        }
        return Collections.unmodifiableList(statements);
    }

    static String stripComment(String line) {
        int idx = line.indexOf(LINE_COMMENT);
        return idx >= 0 ? line.substring(0, idx) : line;
    }
}
