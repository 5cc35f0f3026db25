package com.raditha.fortrace.model;

/**
 * @param labelName numeric statement label, as written
 */
public record Goto(String labelName) implements JumpTarget {
}
