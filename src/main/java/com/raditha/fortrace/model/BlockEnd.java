package com.raditha.fortrace.model;

/**
 * Closes the innermost open structure: {@code end if}, {@code end do},
 * {@code end select} or the end of a routine.
 *
 * @param statement original statement text
 */
public record BlockEnd(String statement) implements Event {
}
