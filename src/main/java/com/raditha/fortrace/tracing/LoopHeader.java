package com.raditha.fortrace.tracing;

import com.raditha.fortrace.classification.StatementText;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code do} loop headers. Trips are counted for loops whose bounds
 * are integer literals; every other loop header is unbounded.
 */
final class LoopHeader {

    private static final Pattern COUNTED_DO = Pattern.compile(
            "^do\\s+(?:\\d+\\s*,?\\s*)?[a-z_][a-z0-9_]*\\s*=\\s*([+-]?\\d+)\\s*,\\s*([+-]?\\d+)\\s*(?:,\\s*([+-]?\\d+)\\s*)?$");

    private static final Pattern TERMINAL_LABEL = Pattern.compile("^do\\s+(\\d+)(?=[\\s,]|$)");

    private LoopHeader() {
    }

    /**
     * Label of the statement that ends a labelled loop, as in
     * {@code do 10 i = 1, n}.
     *
     * @return the label, or empty for a loop closed by {@code end do}
     */
    static Optional<String> terminalLabel(String statement) {
        Matcher matcher = TERMINAL_LABEL.matcher(StatementText.normalize(statement));
        if (matcher.find()) {
            return Optional.of(matcher.group(1));
        }
        return Optional.empty();
    }

    /**
     * Number of iterations of {@code do v = start, end[, step]}, following the
     * Fortran rule {@code max((end - start + step) / step, 0)}.
     *
     * @return the trip count, or empty when the bounds are not literals
     */
    static OptionalLong tripCount(String statement) {
        Matcher matcher = COUNTED_DO.matcher(StatementText.normalize(statement));
        if (!matcher.matches()) {
            return OptionalLong.empty();
        }
        try {
            long start = Long.parseLong(matcher.group(1));
            long end = Long.parseLong(matcher.group(2));
            long step = matcher.group(3) == null ? 1 : Long.parseLong(matcher.group(3));
            if (step == 0) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(Math.max((end - start + step) / step, 0));
        } catch (NumberFormatException e) {
            // literal too large for a long: treat like a non-literal bound
            return OptionalLong.empty();
        }
    }
}
