package com.raditha.fortrace.model;

/**
 * Leaves the current routine: {@code return}, or {@code contains} reached in
 * a routine body.
 */
public record Return() implements JumpTarget {
}
