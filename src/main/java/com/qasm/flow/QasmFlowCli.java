package com.qasm.flow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qasm.flow.api.MalformedBitReferenceException;
import com.qasm.flow.api.UnknownBitException;
import com.qasm.flow.io.QasmFlowOptions;
import com.qasm.flow.io.QasmSource;
import com.qasm.flow.lex.DeclaredIdentifiers;
import com.qasm.flow.lex.QasmSyntaxException;
import com.qasm.flow.lex.QasmTokenizer;
import com.qasm.flow.lex.Token;
import com.qasm.flow.lex.TokenType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Command-line entry point.
 *
 * <pre>
 * qasm-flow &lt;file.qasm|-&gt; [--out graph.json] [--mermaid graph.md] [--time-key N]
 *           [--options options.json] [--summary]
 *           [--tokens [--include TYPE...]] [--idents-of KIND...] [--ndjson]
 * </pre>
 *
 * Without {@code --out} the snapshot mapping is printed to stdout. Exit code
 * 0 on success, 1 when the circuit fails to parse, 2 on a usage error.
 */
public final class QasmFlowCli {
    private static final Logger log = LogManager.getLogger(QasmFlowCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_PARSE_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: qasm-flow <file.qasm|-> [--out graph.json] [--mermaid graph.md]"
            + " [--time-key N] [--options options.json] [--summary]"
            + " [--tokens [--include TYPE...]] [--idents-of KIND...] [--ndjson]";

    private final PrintStream out;
    private final PrintStream err;
    private final ObjectMapper mapper = new ObjectMapper();

    QasmFlowCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new QasmFlowCli(System.out, System.err).run(args));
    }

    int run(String[] args) {
        Arguments a;
        try {
            a = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            String source = "-".equals(a.path) ? QasmSource.read(System.in) : QasmSource.read(Path.of(a.path));

            if (a.tokens || !a.identsOf.isEmpty())
                return runTokens(source, a);

            QasmFlowGraph graph = QasmFlowGraph.parse(a.path, source, null);
            QasmFlowOptions options = a.optionsPath != null ? QasmFlowOptions.load(Path.of(a.optionsPath))
                    : new QasmFlowOptions();
            if (a.jsonOutput != null)
                options.setJsonOutput(a.jsonOutput);
            if (a.mermaidOutput != null)
                options.setMermaidOutput(a.mermaidOutput);
            if (a.timeKey != null)
                options.setMermaidTimeKey(a.timeKey);
            if (a.summary)
                options.setLogSummary(true);

            Integer key = options.getMermaidTimeKey();
            if (key != null && !graph.getSequence().contains(key)) {
                err.println("error: no snapshot at time-key " + key + "; keys: " + graph.getSequence().timeKeys());
                err.println(USAGE);
                return EXIT_USAGE;
            }

            graph.export(options);
            if (options.getJsonOutput() == null)
                out.println(graph.toJson());
            return EXIT_OK;
        } catch (UnknownBitException | MalformedBitReferenceException | QasmSyntaxException e) {
            err.println("error: " + e.getMessage());
            return EXIT_PARSE_ERROR;
        } catch (UncheckedIOException e) {
            log.error("I/O failure", e);
            err.println("error: " + e.getMessage());
            return EXIT_PARSE_ERROR;
        }
    }

    private int runTokens(String source, Arguments a) {
        List<Token> tokens = QasmTokenizer.tokenizeSource(source);
        List<?> items;
        if (!a.identsOf.isEmpty()) {
            items = DeclaredIdentifiers.collect(tokens).flatten(a.identsOf);
        } else {
            items = QasmTokenizer.filter(tokens, a.include);
        }
        try {
            if (a.ndjson) {
                for (Object item : items)
                    out.println(mapper.writeValueAsString(item));
            } else {
                out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(items));
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tokens", e);
        }
        return EXIT_OK;
    }

    /** Parsed command line. */
    static final class Arguments {
        String path;
        String jsonOutput;
        String mermaidOutput;
        String optionsPath;
        Integer timeKey;
        boolean summary;
        boolean tokens;
        boolean ndjson;
        Set<TokenType> include = EnumSet.noneOf(TokenType.class);
        List<String> identsOf = new ArrayList<>();

        static Arguments parse(String[] args) {
            Arguments a = new Arguments();
            int i = 0;
            while (i < args.length) {
                String arg = args[i++];
                switch (arg) {
                    case "--out" -> a.jsonOutput = value(args, i++, arg);
                    case "--mermaid" -> a.mermaidOutput = value(args, i++, arg);
                    case "--options" -> a.optionsPath = value(args, i++, arg);
                    case "--time-key" -> {
                        String v = value(args, i++, arg);
                        try {
                            a.timeKey = Integer.parseInt(v);
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("--time-key expects an integer, got '" + v + "'");
                        }
                    }
                    case "--summary" -> a.summary = true;
                    case "--tokens" -> a.tokens = true;
                    case "--ndjson" -> a.ndjson = true;
                    case "--include" -> {
                        while (i < args.length && !args[i].startsWith("--"))
                            a.include.add(TokenType.fromString(args[i++]));
                    }
                    case "--idents-of" -> {
                        while (i < args.length && !args[i].startsWith("--")) {
                            String kind = args[i++];
                            if (!DeclaredIdentifiers.KINDS.contains(kind))
                                throw new IllegalArgumentException("Unknown identifier kind: " + kind);
                            a.identsOf.add(kind);
                        }
                    }
                    default -> {
                        if (arg.startsWith("--"))
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        if (a.path != null)
                            throw new IllegalArgumentException("Unexpected argument: " + arg);
                        a.path = arg;
                    }
                }
            }
            if (a.path == null)
                a.path = "-";
            return a;
        }

        private static String value(String[] args, int i, String option) {
            if (i >= args.length)
                throw new IllegalArgumentException(option + " expects a value");
            return args[i];
        }
    }
}
