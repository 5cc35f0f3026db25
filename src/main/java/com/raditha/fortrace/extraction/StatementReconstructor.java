package com.raditha.fortrace.extraction;

import com.raditha.fortrace.model.LogicalStatement;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Rebuilds logical statements from raw free-form source lines.
 * <p>
 * Comments ({@code !} to end of line) are cut, lines ending in {@code &} are
 * joined with the following line, and every other line closes the statement
 * being built. A blank or comment-only line contributes an empty string, so
 * on its own it is an empty statement and after a continuation it ends the
 * statement being joined. Input that ends in the middle of a continuation is
 * still emitted as a final statement.
 * <p>
 * The returned iterators are lazy: a line is looked at only when the caller
 * asks for the statement it belongs to.
 */
public class StatementReconstructor {

    private static final char COMMENT_MARKER = '!';
    private static final String CONTINUATION_MARKER = "&";

    /**
     * Reconstruct statement texts from the given lines.
     *
     * @param lines raw source lines
     * @return lazy, non-restartable sequence of statements
     */
    public Iterator<String> reconstruct(List<String> lines) {
        Iterator<LogicalStatement> statements = statements(lines, 0);
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return statements.hasNext();
            }

            @Override
            public String next() {
                return statements.next().text();
            }
        };
    }

    /**
     * Reconstruct statements and report which lines each came from.
     *
     * @param lines     raw source lines
     * @param firstLine file line index of {@code lines.get(0)}
     * @return lazy, non-restartable sequence of located statements
     */
    public Iterator<LogicalStatement> statements(List<String> lines, int firstLine) {
        return new LogicalStatementIterator(lines, firstLine);
    }

    /**
     * Strip the trailing comment and surrounding whitespace of one line.
     */
    public static String stripComment(String line) {
        int marker = line.indexOf(COMMENT_MARKER);
        String code = marker >= 0 ? line.substring(0, marker) : line;
        return code.trim();
    }

    private static final class LogicalStatementIterator implements Iterator<LogicalStatement> {
        private final Iterator<String> lines;
        private int lineIndex;
        private LogicalStatement pending;

        LogicalStatementIterator(List<String> lines, int firstLine) {
            this.lines = lines.iterator();
            this.lineIndex = firstLine;
        }

        @Override
        public boolean hasNext() {
            if (pending == null) {
                pending = readStatement();
            }
            return pending != null;
        }

        @Override
        public LogicalStatement next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            LogicalStatement statement = pending;
            pending = null;
            return statement;
        }

        /**
         * Consume lines up to the end of the next statement.
         *
         * @return the statement, or null once the input is exhausted
         */
        private LogicalStatement readStatement() {
            StringBuilder buffer = new StringBuilder();
            boolean continuing = false;
            int start = lineIndex;

            while (lines.hasNext()) {
                String line = stripComment(lines.next());
                int current = lineIndex++;

                // free-form continuation lines may repeat the marker at their start
                if (continuing && line.startsWith(CONTINUATION_MARKER)) {
                    line = line.substring(1);
                }

                if (line.endsWith(CONTINUATION_MARKER)) {
                    buffer.append(line, 0, line.length() - 1);
                    continuing = true;
                } else {
                    buffer.append(line);
                    return new LogicalStatement(buffer.toString(), start, current);
                }
            }

            if (buffer.length() > 0) {
                return new LogicalStatement(buffer.toString(), start, lineIndex - 1);
            }
            return null;
        }
    }
}
