package com.raditha.fortrace.model;

/**
 * Fallback event produced for every statement.
 *
 * @param statement the full statement text
 */
public record PlainStatement(String statement) implements Event {
}
