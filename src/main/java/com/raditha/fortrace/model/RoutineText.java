package com.raditha.fortrace.model;

import java.util.List;

/**
 * Raw source lines of one routine, as handed to the tracer.
 *
 * @param name      routine name, lowercase
 * @param source    file the routine was read from, for display only
 * @param firstLine file line index of {@code lines.get(0)}
 * @param lines     raw lines of the routine, header to closing {@code end}
 */
public record RoutineText(
        String name,
        String source,
        int firstLine,
        List<String> lines) {

    public int lastLine() {
        return firstLine + lines.size() - 1;
    }
}
