package com.raditha.fortrace.catalog;

import com.raditha.fortrace.model.RoutineText;

import java.util.Optional;
import java.util.Set;

/**
 * Routine lookup used by the tracer: name to the routine's raw lines.
 */
public interface RoutineSource {

    /**
     * Raw lines of a routine.
     *
     * @param routineName routine name, any case
     * @return the routine's lines, or empty when no such routine is known
     */
    Optional<RoutineText> lines(String routineName);

    /**
     * Lowercase names of every callable routine. Statements are classified
     * against this set to detect function references.
     */
    Set<String> routineNames();
}
