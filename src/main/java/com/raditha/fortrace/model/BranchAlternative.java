package com.raditha.fortrace.model;

/**
 * Opens a further branch of a finite block: {@code else}, {@code else if},
 * a {@code case} or {@code rank} selector, or a {@code type is} /
 * {@code class is} / {@code class default} guard.
 *
 * @param statement original statement text
 */
public record BranchAlternative(String statement) implements Event {
}
