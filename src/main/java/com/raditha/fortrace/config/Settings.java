package com.raditha.fortrace.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;

/**
 * Holds the YAML configuration map, loaded from {@code fortrace.yml} on the
 * classpath or from a file given on the command line.
 */
public final class Settings {

    public static final String DEFAULT_CONFIG = "fortrace.yml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static Map<String, Object> props = new HashMap<>();

    private Settings() {
    }

    /**
     * Load the default configuration from the classpath. A missing resource
     * leaves the settings empty.
     */
    public static void loadConfigMap() throws IOException {
        try (InputStream in = Settings.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG)) {
            props = in == null ? new HashMap<>() : read(YAML.readTree(in));
        }
    }

    /**
     * Load configuration from a YAML file.
     */
    public static void loadConfigMap(File configFile) throws IOException {
        props = read(YAML.readTree(configFile));
    }

    /**
     * An empty document yields empty settings.
     *
     * @throws IllegalArgumentException when the document is not a mapping
     */
    private static Map<String, Object> read(JsonNode tree) {
        if (tree == null || tree.isMissingNode() || tree.isNull()) {
            return new HashMap<>();
        }
        if (!tree.isObject()) {
            throw new IllegalArgumentException("Configuration must be a YAML mapping");
        }
        return new HashMap<>(YAML.convertValue(tree, MAP_TYPE));
    }

    public static Object getProperty(String key) {
        return props.get(key);
    }

    public static void setProperty(String key, Object value) {
        props.put(key, value);
    }

    /**
     * Forget everything loaded so far.
     */
    public static void clear() {
        props = new HashMap<>();
    }
}
