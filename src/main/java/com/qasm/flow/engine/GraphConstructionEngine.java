package com.qasm.flow.engine;

import com.qasm.flow.api.Bit;
import com.qasm.flow.api.GraphBuildListener;
import com.qasm.flow.api.GraphNode;
import com.qasm.flow.api.GraphSnapshot;
import com.qasm.flow.api.MalformedBitReferenceException;
import com.qasm.flow.api.NodeType;
import com.qasm.flow.api.TimestampSequence;
import com.qasm.flow.api.UnknownBitException;

import java.util.List;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.extern.log4j.Log4j2;

/**
 * Builds the time-keyed sequence of flow-graph snapshots for a circuit.
 *
 * <p>
 * A build runs in two phases over the filtered statements:
 * <ol>
 * <li><b>Declarations:</b> every {@code qreg name[n]} / {@code creg name[n]}
 * statement declares its bits, wherever it appears. The bits alone form the
 * snapshot at time-key 0.</li>
 * <li><b>Instructions:</b> statements starting with {@code OPENQASM},
 * {@code include}, {@code qreg} or {@code creg} are skipped; every other
 * statement advances the line counter and is classified by
 * {@link InstructionClassifier}. A recognized statement becomes gate
 * {@code g_<n>} with one in-edge per operand, sourced from that operand's
 * last writer, and the graph is snapshotted under the line counter.</li>
 * </ol>
 *
 * <p>
 * The engine itself holds no mutable state. Registry, gate counter and
 * graph storage belong to a single {@link #build} call, so one engine can
 * serve concurrent builds over independent inputs.
 *
 * <p>
 * Failure is all-or-nothing: an {@link UnknownBitException} or
 * {@link MalformedBitReferenceException} propagates out of {@code build} and
 * no sequence is returned.
 */
@Log4j2
public final class GraphConstructionEngine {
    private static final Pattern DECLARATION = Pattern.compile("^(qreg|creg)\\s+([a-zA-Z_]\\w*)\\[(\\d+)\\]");
    private static final List<String> SKIPPED_PREFIXES = List.of("OPENQASM", "include", "qreg", "creg");
    private static final String GATE_ID_PREFIX = "g_";

    private final GraphBuildListener listener;

    public GraphConstructionEngine() {
        this(GraphBuildListener.NONE);
    }

    public GraphConstructionEngine(GraphBuildListener listener) {
        this.listener = listener != null ? listener : GraphBuildListener.NONE;
    }

    /** Builds over a fresh {@link BitRegistry}. */
    public TimestampSequence build(List<String> statements) {
        return build(statements, new BitRegistry());
    }

    /**
     * Builds over {@code registry}, which must not be shared with any other
     * build. Bits it already holds are part of the bit universe.
     */
    public TimestampSequence build(List<String> statements, BitRegistry registry) {
        return new Run(registry).execute(statements);
    }

    /** State of one build. */
    private final class Run {
        private final BitRegistry registry;
        private final GraphArena arena = new GraphArena();
        private final TreeMap<Integer, GraphSnapshot> snapshots = new TreeMap<>();
        private EngineState state = EngineState.DECLARING;
        private int gateCounter;
        private int lineCounter;

        Run(BitRegistry registry) {
            this.registry = registry;
        }

        TimestampSequence execute(List<String> statements) {
            for (String line : statements)
                declare(line);

            for (Bit bit : registry.bits())
                arena.addNode(GraphNode.bit(bit));
            snapshots.put(0, arena.snapshot(0));
            listener.onDeclarationsComplete(registry.size());
            state = state.next();

            for (String line : statements) {
                if (isSkipped(line))
                    continue;
                lineCounter++;
                try {
                    instruct(line);
                } catch (UnknownBitException | MalformedBitReferenceException e) {
                    listener.onBuildFailed(lineCounter, line, e);
                    throw e;
                }
            }

            TimestampSequence sequence = new TimestampSequence(snapshots);
            log.debug("Built {} snapshots from {} instruction lines ({} gates, {} edges)",
                    sequence.size(), lineCounter, gateCounter, arena.edgeCount());
            listener.onBuildEnd(sequence);
            return sequence;
        }

        private void declare(String line) {
            Matcher m = DECLARATION.matcher(line);
            if (!m.find())
                return;
            int count;
            try {
                count = Integer.parseInt(m.group(3));
            } catch (NumberFormatException e) {
                log.warn("Register size out of range, declaration skipped: {}", line);
                return;
            }
            NodeType kind = "qreg".equals(m.group(1)) ? NodeType.QUBIT : NodeType.CLASSICAL_BIT;
            registry.declare(kind, m.group(2), count);
        }

        private void instruct(String line) {
            Classification c = InstructionClassifier.classify(line);
            if (c instanceof Classification.Recognized r) {
                GraphNode gate = addGate(r.instruction());
                snapshots.put(lineCounter, arena.snapshot(lineCounter));
                listener.onGateAdded(lineCounter, gate);
            } else if (c instanceof Classification.Ignored i) {
                log.debug("Line {} ignored ({}): {}", lineCounter, i.reason(), line);
                listener.onLineIgnored(lineCounter, line, i.reason());
            }
        }

        private GraphNode addGate(ParsedInstruction instruction) {
            if (state != EngineState.INSTRUCTING)
                throw new IllegalStateException("Gate outside instruction phase: " + instruction.line());

            String gateId = GATE_ID_PREFIX + gateCounter++;
            for (BitReference operand : instruction.operands()) {
                String source;
                try {
                    source = registry.resolveAndAdvance(operand.bitId(), gateId);
                } catch (UnknownBitException e) {
                    UnknownBitException withLine = new UnknownBitException(operand.bitId(), instruction.line());
                    withLine.initCause(e);
                    throw withLine;
                }
                arena.addEdge(source, gateId);
            }
            GraphNode gate = GraphNode.gate(gateId, instruction.shape().nodeType(), instruction.name(),
                    instruction.gateInfo());
            arena.addNode(gate);
            return gate;
        }
    }

    static boolean isSkipped(String line) {
        for (String prefix : SKIPPED_PREFIXES)
            if (line.startsWith(prefix))
                return true;
        return false;
    }
}
