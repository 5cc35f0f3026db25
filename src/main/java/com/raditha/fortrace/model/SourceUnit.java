package com.raditha.fortrace.model;

import java.util.List;
import java.util.Optional;

/**
 * Routine catalog of one parsed source file.
 *
 * @param kind        top-level shape of the file
 * @param name        program or module name, empty for flat files
 * @param routines    subroutines and functions in file order
 * @param mainProgram line range of the main program body, when the file has one
 */
public record SourceUnit(
        UnitKind kind,
        Optional<String> name,
        List<RoutineEntry> routines,
        Optional<RoutineEntry> mainProgram) {

    public SourceUnit {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        name = name == null ? Optional.empty() : name;
        routines = routines == null ? List.of() : List.copyOf(routines);
        mainProgram = mainProgram == null ? Optional.empty() : mainProgram;
    }

    public SourceUnit(UnitKind kind, Optional<String> name, List<RoutineEntry> routines) {
        this(kind, name, routines, Optional.empty());
    }

    /**
     * Find a subroutine or function by name (case-insensitive). When a name
     * occurs twice the later definition wins, like the catalog scan itself.
     */
    public Optional<RoutineEntry> findRoutine(String routineName) {
        Optional<RoutineEntry> found = Optional.empty();
        for (RoutineEntry entry : routines) {
            if (entry.name().equalsIgnoreCase(routineName)) {
                found = Optional.of(entry);
            }
        }
        return found;
    }
}
