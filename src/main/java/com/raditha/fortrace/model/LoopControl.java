package com.raditha.fortrace.model;

/**
 * {@code cycle} or {@code exit} of the innermost loop.
 *
 * @param leavesLoop true for {@code exit}, false for {@code cycle}
 */
public record LoopControl(boolean leavesLoop) implements JumpTarget {
}
