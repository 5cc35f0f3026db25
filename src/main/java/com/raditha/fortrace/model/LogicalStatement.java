package com.raditha.fortrace.model;

/**
 * A statement together with the source lines it was joined from.
 *
 * @param text      statement text, comments and continuation markers removed
 * @param firstLine first source line (0-indexed)
 * @param lastLine  last source line (0-indexed, inclusive)
 */
public record LogicalStatement(
        String text,
        int firstLine,
        int lastLine) {

    public boolean isEmpty() {
        return text.isEmpty();
    }

    public boolean spans(int line) {
        return line >= firstLine && line <= lastLine;
    }
}
