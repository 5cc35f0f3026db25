package com.raditha.fortrace.config;

import java.nio.charset.Charset;
import java.util.List;
import java.util.Map;

/**
 * Loads trace configuration from Settings (fortrace.yml) with CLI overrides.
 * 
 * Configuration priority: CLI arguments > fortrace.yml > defaults
 */
public class TraceSettings {

    static final String CONFIG_KEY = "fortrace";

    private TraceSettings() {
    }

    /**
     * Load configuration from Settings, applying CLI overrides where provided.
     *
     * @param maxStepsCLI CLI step limit (0 = use YAML/default)
     * @param charsetCLI  CLI charset name (null = use YAML/default)
     * @return Complete trace configuration
     * @throws IllegalArgumentException for an unknown charset or invalid values
     */
    public static TraceConfig loadConfig(int maxStepsCLI, String charsetCLI) {
        Object yamlConfigRaw = Settings.getProperty(CONFIG_KEY);

        if (!(yamlConfigRaw instanceof Map)) {
            // No YAML config, use CLI or defaults
            return createFromCLI(maxStepsCLI, charsetCLI);
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) yamlConfigRaw;

        int maxSteps = maxStepsCLI != 0 ? maxStepsCLI : getInt(config, "max_steps", TraceConfig.DEFAULT_MAX_STEPS);
        String charsetName = charsetCLI != null ? charsetCLI : getString(config, "charset", "UTF-8");

        List<String> extensions = getListString(config, "extensions");
        if (extensions.isEmpty()) {
            extensions = TraceConfig.defaultExtensions();
        }

        List<String> excludePatterns = getListString(config, "exclude_patterns");
        if (excludePatterns.isEmpty()) {
            excludePatterns = TraceConfig.defaultExcludePatterns();
        }

        return new TraceConfig(
                maxSteps,
                toCharset(charsetName),
                extensions,
                excludePatterns);
    }

    private static TraceConfig createFromCLI(int maxStepsCLI, String charsetCLI) {
        TraceConfig defaults = TraceConfig.defaults();
        return new TraceConfig(
                maxStepsCLI != 0 ? maxStepsCLI : defaults.maxSteps(),
                charsetCLI != null ? toCharset(charsetCLI) : defaults.charset(),
                defaults.extensions(),
                defaults.excludePatterns());
    }

    private static Charset toCharset(String name) {
        try {
            return Charset.forName(name);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown charset: " + name, e);
        }
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    @SuppressWarnings("unchecked")
    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List) {
            return (List<String>) value;
        }
        return List.of();
    }
}
