package com.raditha.fortrace.model;

/**
 * One statement visited by the tracer.
 *
 * @param routine   routine executing the statement
 * @param source    file holding the routine
 * @param line      first file line of the statement (0-indexed)
 * @param statement statement text
 * @param depth     call depth, 0 for the start routine
 * @param entry     true for the first statement emitted after entering a routine
 */
public record TraceStep(
        String routine,
        String source,
        int line,
        String statement,
        int depth,
        boolean entry) {

    /**
     * Format as "file:46" using a 1-indexed line for display.
     */
    public String toLocationString() {
        return source + ":" + (line + 1);
    }
}
