package com.qasm.flow.api;

import lombok.Getter;
import lombok.Setter;

/**
 * A declared qubit or classical bit.
 *
 * <p>
 * Only {@link #getLastWriter()} changes after declaration. A null last writer
 * means the bit itself is still the source of its current value.
 */
@Getter
public final class Bit {
    private final String id;
    private final NodeType kind;
    private final String name;

    @Setter
    private String lastWriter;

    public Bit(String id, NodeType kind) {
        this(id, kind, id);
    }

    public Bit(String id, NodeType kind, String name) {
        if (!kind.isBit())
            throw new IllegalArgumentException("Not a bit kind: " + kind);
        this.id = id;
        this.kind = kind;
        this.name = name;
    }

    /** Id of the node whose output currently feeds this bit. */
    public String currentSource() {
        return lastWriter != null ? lastWriter : id;
    }

    @Override
    public String toString() {
        return id + "(" + kind.wireName() + (lastWriter != null ? " <- " + lastWriter : "") + ")";
    }
}
