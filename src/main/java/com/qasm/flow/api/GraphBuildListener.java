package com.qasm.flow.api;

/**
 * Observability hook for a graph build.
 *
 * <p>
 * Callbacks run synchronously on the building thread, in source order. A
 * build that fails calls {@link #onBuildFailed} and never
 * {@link #onBuildEnd}.
 */
public interface GraphBuildListener {

    GraphBuildListener NONE = new GraphBuildListener() {
    };

    /**
     * Called once the declaration pass is complete.
     *
     * @param bitCount number of distinct bits declared
     */
    default void onDeclarationsComplete(int bitCount) {
    }

    /**
     * Called after a gate node and its in-edges have been added.
     *
     * @param timeKey line counter the resulting snapshot is stored under
     * @param gate    the new node
     */
    default void onGateAdded(int timeKey, GraphNode gate) {
    }

    /**
     * Called for an instruction line that matched no gate shape.
     *
     * @param lineCounter line counter of the skipped line
     * @param line        the statement
     * @param reason      short description of why it did not match
     */
    default void onLineIgnored(int lineCounter, String line, String reason) {
    }

    /** Called when the build aborts. The exception is rethrown afterwards. */
    default void onBuildFailed(int lineCounter, String line, RuntimeException error) {
    }

    /** Called with the finished sequence. */
    default void onBuildEnd(TimestampSequence sequence) {
    }
}
