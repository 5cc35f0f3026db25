package com.raditha.fortrace.model;

/**
 * Terminates the whole program: {@code stop} or {@code error stop}.
 */
public record Stop() implements JumpTarget {
}
