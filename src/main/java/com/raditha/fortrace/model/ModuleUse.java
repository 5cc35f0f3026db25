package com.raditha.fortrace.model;

/**
 * A {@code use <module>} statement.
 *
 * @param statement  original statement text
 * @param moduleName lowercase module name
 */
public record ModuleUse(String statement, String moduleName) implements Event {
}
