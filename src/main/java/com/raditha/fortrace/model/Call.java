package com.raditha.fortrace.model;

/**
 * Invocation of a subroutine or function, either through the {@code call}
 * keyword or as a function reference inside an expression.
 *
 * @param targetName lowercase routine name
 */
public record Call(String targetName) implements JumpTarget {
}
