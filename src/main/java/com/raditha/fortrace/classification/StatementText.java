package com.raditha.fortrace.classification;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the classifier and the tracer.
 */
public final class StatementText {

    private static final Pattern LABEL = Pattern.compile("^(\\d+)\\s+");
    private static final Pattern CONSTRUCT_NAME = Pattern.compile("^[a-z_][a-z0-9_]*\\s*:(?!:)\\s*");

    private StatementText() {
    }

    /**
     * Lowercase and trim a statement and drop its statement label and
     * construct name, leaving the keyword first.
     * <p>
     * {@code "10 Outer: DO i = 1, 3"} becomes {@code "do i = 1, 3"}.
     */
    public static String normalize(String statement) {
        String text = statement.trim().toLowerCase(Locale.ROOT);
        Matcher label = LABEL.matcher(text);
        if (label.find()) {
            text = text.substring(label.end());
        }
        Matcher name = CONSTRUCT_NAME.matcher(text);
        if (name.find()) {
            text = text.substring(name.end());
        }
        return text;
    }

    /**
     * Numeric statement label the statement starts with, if any.
     */
    public static Optional<String> label(String statement) {
        Matcher label = LABEL.matcher(statement.trim());
        if (label.find()) {
            return Optional.of(label.group(1));
        }
        return Optional.empty();
    }

    /**
     * Compare statement labels numerically, so {@code 010} and {@code 10} are the same label.
     */
    public static boolean sameLabel(String first, String second) {
        return stripLeadingZeros(first).equals(stripLeadingZeros(second));
    }

    private static String stripLeadingZeros(String label) {
        String stripped = label.replaceFirst("^0+", "");
        return stripped.isEmpty() ? "0" : stripped;
    }

    /**
     * Index of the parenthesis closing the one at {@code open}, or -1 when unbalanced.
     */
    static int closingParenthesis(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
