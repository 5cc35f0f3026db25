package com.raditha.fortrace.model;

/**
 * Opens a nested structure.
 *
 * @param statement    original statement text
 * @param finite       true for block {@code if} and the {@code select} constructs, false for {@code do} loops
 * @param awaitsBranch true when no branch is open yet and the first selector or guard opens it
 */
public record BlockStart(String statement, boolean finite, boolean awaitsBranch) implements Event {

    public BlockStart(String statement, boolean finite) {
        this(statement, finite, false);
    }
}
