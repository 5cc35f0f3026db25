package com.raditha.fortrace.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Configuration for loading and tracing sources.
 *
 * @param maxSteps        Maximum number of statements to emit before the trace is cut
 * @param charset         Encoding of the source files
 * @param extensions      File extensions treated as sources when walking directories
 * @param excludePatterns File patterns to exclude (glob format)
 */
public record TraceConfig(
        int maxSteps,
        Charset charset,
        List<String> extensions,
        List<String> excludePatterns) {

    public static final int DEFAULT_MAX_STEPS = 1000;

    /**
     * Validate configuration.
     */
    public TraceConfig {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be >= 1");
        }
        if (charset == null) {
            throw new IllegalArgumentException("charset cannot be null");
        }
        if (extensions == null || extensions.isEmpty()) {
            extensions = defaultExtensions();
        }
        if (excludePatterns == null) {
            excludePatterns = List.of();
        }
        extensions = extensions.stream().map(e -> e.toLowerCase(Locale.ROOT)).toList();
        excludePatterns = List.copyOf(excludePatterns);
    }

    /**
     * Defaults: 1000 steps, UTF-8, the usual free-form and fixed-form extensions.
     */
    public static TraceConfig defaults() {
        return new TraceConfig(
                DEFAULT_MAX_STEPS,
                StandardCharsets.UTF_8,
                defaultExtensions(),
                defaultExcludePatterns());
    }

    /**
     * Copy with a different step limit.
     */
    public TraceConfig withMaxSteps(int steps) {
        return new TraceConfig(steps, charset, extensions, excludePatterns);
    }

    /**
     * Free-form source extensions. Fixed-form {@code .f} and {@code .for}
     * files use column rules the reconstructor does not read, so they are
     * only loaded when configured explicitly.
     */
    static List<String> defaultExtensions() {
        return List.of(".f90", ".f95", ".f03", ".f08");
    }

    /**
     * Default file exclusion patterns.
     */
    static List<String> defaultExcludePatterns() {
        return List.of(
                "**/build/**",
                "**/.git/**");
    }

    /**
     * Check if a file name carries one of the source extensions.
     */
    public boolean isSourceFile(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(lower::endsWith);
    }

    /**
     * Check if a file path matches any exclusion pattern.
     */
    public boolean shouldExclude(String filePath) {
        for (String pattern : excludePatterns) {
            if (matchesGlobPattern(filePath, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Simple glob pattern matching.
     * Supports ** and * wildcards; a leading double-star directory also matches at the root.
     */
    private boolean matchesGlobPattern(String path, String pattern) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            if (pattern.startsWith("**/", i)) {
                regex.append("(?:.*/)?");
                i += 3;
            } else if (pattern.startsWith("**", i)) {
                regex.append(".*");
                i += 2;
            } else if (c == '*') {
                regex.append("[^/]*");
                i++;
            } else {
                if ("\\.[]{}()+-^$|?".indexOf(c) >= 0) {
                    regex.append('\\');
                }
                regex.append(c);
                i++;
            }
        }
        return path.matches(regex.toString());
    }
}
