package com.raditha.fortrace.model;

/**
 * Transfers control somewhere other than the next statement.
 *
 * @param statement original statement text
 * @param target    where control goes
 */
public record Jump(String statement, JumpTarget target) implements Event {
}
