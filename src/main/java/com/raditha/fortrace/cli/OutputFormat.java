package com.raditha.fortrace.cli;

/**
 * How the CLI prints a trace.
 */
public enum OutputFormat {
    /**
     * One statement per line.
     */
    TEXT,

    /**
     * A single JSON document with every step and its location.
     */
    JSON;

    /**
     * Convert a string value to an OutputFormat.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding format
     * @throws IllegalArgumentException if the value is not a valid format
     */
    public static OutputFormat fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Output format cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "text" -> TEXT;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException(
                    "Invalid output format: " + value + ". Must be: text or json");
        };
    }

    public String toCliString() {
        return switch (this) {
            case TEXT -> "text";
            case JSON -> "json";
        };
    }
}
