package com.raditha.fortrace.catalog;

import com.raditha.fortrace.extraction.StatementReconstructor;
import com.raditha.fortrace.model.RoutineEntry;
import com.raditha.fortrace.model.SourceUnit;
import com.raditha.fortrace.model.UnitKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans a source file once to find its top-level shape and the line range of
 * every subroutine and function.
 * <p>
 * Routine tracking is a single "open routine" slot: a header opens a routine,
 * replacing any unterminated one, and the next {@code end},
 * {@code end subroutine} or {@code end function} closes it. Nested routine
 * definitions are therefore not supported. Interface blocks are skipped.
 */
public class RoutineCatalogBuilder {
    private static final Logger logger = LoggerFactory.getLogger(RoutineCatalogBuilder.class);

    private static final Pattern PROGRAM_HEADER = Pattern.compile("^program\\s+([a-z0-9_]+)");
    private static final Pattern MODULE_HEADER =
            Pattern.compile("^module\\s+(?!(?:procedure|subroutine|function)\\b)([a-z0-9_]+)");
    private static final Pattern SUBROUTINE_HEADER = Pattern.compile(
            "^(?:(?:recursive|non_recursive|pure|impure|elemental|module)\\s+)*subroutine\\s+([a-z0-9_]+)");
    private static final Pattern FUNCTION_HEADER =
            Pattern.compile("^(?:[a-z0-9_(),=*\\s]+?\\s+)?function\\s+([a-z0-9_]+)");
    private static final Pattern ROUTINE_END =
            Pattern.compile("^end(?:\\s*(?:subroutine|function)(?:\\s+[a-z0-9_]+)?)?$");
    private static final Pattern PROGRAM_END = Pattern.compile("^end\\s*program\\b");
    private static final Pattern INTERFACE_START = Pattern.compile("^(?:abstract\\s+)?interface\\b");
    private static final Pattern INTERFACE_END = Pattern.compile("^end\\s*interface\\b");

    /**
     * Build the catalog of one file. Never fails: a file without headers is a
     * flat collection, possibly empty.
     *
     * @param lines raw file lines
     * @return the file's routine catalog
     */
    public SourceUnit build(List<String> lines) {
        Scan scan = new Scan();
        for (int i = 0; i < lines.size(); i++) {
            String line = StatementReconstructor.stripComment(lines.get(i)).toLowerCase(Locale.ROOT);
            if (!line.isEmpty()) {
                scan.accept(line, i);
            }
        }
        scan.finish();
        logger.debug("Catalog: {} {} with {} routines", scan.kind, scan.name.orElse("(unnamed)"),
                scan.routines.size());
        return new SourceUnit(scan.kind, scan.name, scan.routines, scan.mainProgram);
    }

    /**
     * Build the catalog and insist that it offers something to trace.
     *
     * @throws IllegalArgumentException when the file holds neither a routine nor a main program
     */
    public SourceUnit buildRequiringRoutines(List<String> lines) {
        SourceUnit unit = build(lines);
        if (unit.routines().isEmpty() && unit.mainProgram().isEmpty()) {
            throw new IllegalArgumentException("No subroutine, function or program found");
        }
        return unit;
    }

    /**
     * Mutable state of one pass over a file.
     */
    private static final class Scan {
        private UnitKind kind = UnitKind.FLAT_ROUTINES;
        private Optional<String> name = Optional.empty();
        private boolean kindDecided;
        private final List<RoutineEntry> routines = new ArrayList<>();
        private Optional<RoutineEntry> mainProgram = Optional.empty();

        private String programName;
        private int programStart = -1;
        private String openRoutine;
        private int openStart = -1;
        private boolean inInterface;

        void accept(String line, int index) {
            if (!kindDecided) {
                decideKind(line);
            }
            if (programStart < 0) {
                Matcher program = PROGRAM_HEADER.matcher(line);
                if (program.find()) {
                    programName = program.group(1);
                    programStart = index;
                    return;
                }
            }

            if (INTERFACE_END.matcher(line).find()) {
                inInterface = false;
                return;
            }
            if (INTERFACE_START.matcher(line).find()) {
                inInterface = true;
                return;
            }
            if (inInterface) {
                return;
            }

            if (ROUTINE_END.matcher(line).matches()) {
                closeRoutine(line, index);
                return;
            }
            if (PROGRAM_END.matcher(line).find()) {
                closeProgram(index);
                return;
            }

            Matcher subroutine = SUBROUTINE_HEADER.matcher(line);
            if (subroutine.find()) {
                openRoutine(subroutine.group(1), index);
                return;
            }
            Matcher function = FUNCTION_HEADER.matcher(line);
            if (function.find()) {
                openRoutine(function.group(1), index);
            }
        }

        private void decideKind(String line) {
            Matcher program = PROGRAM_HEADER.matcher(line);
            if (program.find()) {
                kind = UnitKind.PROGRAM;
                name = Optional.of(program.group(1));
                kindDecided = true;
                return;
            }
            Matcher module = MODULE_HEADER.matcher(line);
            if (module.find()) {
                kind = UnitKind.MODULE;
                name = Optional.of(module.group(1));
                kindDecided = true;
                return;
            }
            if (SUBROUTINE_HEADER.matcher(line).find() || FUNCTION_HEADER.matcher(line).find()) {
                kind = UnitKind.FLAT_ROUTINES;
                kindDecided = true;
            }
        }

        private void openRoutine(String routineName, int index) {
            if (openRoutine != null) {
                logger.debug("Routine {} opened at line {} replaces unterminated {}", routineName, index + 1,
                        openRoutine);
            }
            openRoutine = routineName;
            openStart = index;
        }

        private void closeRoutine(String line, int index) {
            if (openRoutine != null) {
                routines.add(new RoutineEntry(openRoutine, openStart, index));
                openRoutine = null;
                openStart = -1;
            } else if (line.equals("end")) {
                closeProgram(index);
            }
        }

        private void closeProgram(int index) {
            if (programStart >= 0 && mainProgram.isEmpty()) {
                mainProgram = Optional.of(new RoutineEntry(programName, programStart, index));
            }
        }

        void finish() {
            if (openRoutine != null) {
                logger.warn("Routine {} starting at line {} is never closed", openRoutine, openStart + 1);
            }
        }
    }
}
