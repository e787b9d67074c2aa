package com.qasm.flow.engine;

import com.qasm.flow.api.Bit;
import com.qasm.flow.api.NodeType;
import com.qasm.flow.api.UnknownBitException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * Declared bits and, for each, the most recent gate that wrote it.
 *
 * <p>
 * The last-writer relation is a lookup keyed by bit id; the registry never
 * owns gate nodes. One registry serves exactly one build.
 *
 * <p>
 * Bit ids are the register name as declared followed by the index, so
 * {@code qreg anc[2]} yields {@code anc0} and {@code anc1}.
 */
@Log4j2
public final class BitRegistry {
    private final Map<String, Bit> bits = new LinkedHashMap<>();

    /**
     * Creates {@code count} bits named {@code registerName0..registerName(count-1)}.
     * Re-declaring an id replaces the bit in place; the first declaration keeps
     * its position in declaration order.
     */
    public List<Bit> declare(NodeType kind, String registerName, int count) {
        if (!kind.isBit())
            throw new IllegalArgumentException("Cannot declare a register of " + kind);
        if (count < 0)
            throw new IllegalArgumentException("Negative register size " + count + " for " + registerName);

        List<Bit> created = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String id = registerName + i;
            Bit bit = new Bit(id, kind);
            if (bits.put(id, bit) != null)
                log.debug("Bit {} redeclared as {}", id, kind.wireName());
            created.add(bit);
        }
        return created;
    }

    /**
     * Returns the id feeding {@code bitId} right now (its last writer, or the
     * bit itself if nothing has written it yet) and records
     * {@code newWriterId} as its new last writer.
     *
     * @throws UnknownBitException if {@code bitId} was never declared
     */
    public String resolveAndAdvance(String bitId, String newWriterId) {
        Bit bit = bits.get(bitId);
        if (bit == null)
            throw new UnknownBitException(bitId);
        String source = bit.currentSource();
        bit.setLastWriter(newWriterId);
        return source;
    }

    public boolean contains(String bitId) {
        return bits.containsKey(bitId);
    }

    public Optional<Bit> find(String bitId) {
        return Optional.ofNullable(bits.get(bitId));
    }

    /** All bits in declaration order. */
    public List<Bit> bits() {
        return Collections.unmodifiableList(new ArrayList<>(bits.values()));
    }

    public int size() {
        return bits.size();
    }
}
