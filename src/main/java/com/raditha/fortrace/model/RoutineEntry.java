package com.raditha.fortrace.model;

import java.util.Locale;

/**
 * A subroutine, function or main program located in one source file.
 *
 * @param name      routine name, canonical lowercase
 * @param startLine line index of the header (0-indexed)
 * @param endLine   line index of the closing {@code end} (0-indexed, inclusive)
 */
public record RoutineEntry(
        String name,
        int startLine,
        int endLine) {

    public RoutineEntry {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("routine name cannot be empty");
        }
        if (startLine < 0 || endLine < startLine) {
            throw new IllegalArgumentException(
                    "invalid line range " + startLine + "-" + endLine + " for routine " + name);
        }
        name = name.toLowerCase(Locale.ROOT);
    }

    /**
     * Get total number of lines in this routine.
     */
    public int getLineCount() {
        return endLine - startLine + 1;
    }

    /**
     * Check whether a 0-indexed file line lies inside the routine.
     */
    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }

    /**
     * Format as "name [L46-53]" using 1-indexed lines for display.
     */
    public String toDisplayString() {
        if (startLine == endLine) {
            return name + " [L" + (startLine + 1) + "]";
        }
        return name + " [L" + (startLine + 1) + "-" + (endLine + 1) + "]";
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
