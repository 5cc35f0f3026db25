package com.raditha.fortrace.tracing;

/**
 * Structural violations that stop a trace.
 */
public enum TraceError {
    /** A called routine is not known to the routine source. */
    UNRESOLVED_CALL,

    /** A {@code goto} label does not exist in the current routine. */
    UNRESOLVED_LABEL,

    /**
     * An {@code end} with nothing to close, {@code cycle}/{@code exit} outside
     * a loop, or a branch marker outside an {@code if}/{@code select} block.
     */
    UNBALANCED_BLOCK,

    /** The start routine is not known to the routine source. */
    ROUTINE_NOT_FOUND
}
