package com.raditha.flowcheck.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads checker configuration from flowcheck.yml with CLI overrides.
 *
 * Configuration priority: CLI arguments > YAML file > preset defaults
 */
public class CheckerSettings {

    static final String CONFIG_KEY = "equivalence_checker";
    static final String DEFAULT_RESOURCE = "/flowcheck.yml";

    private CheckerSettings() {
        /* this is only a utility class */
    }

    /**
     * Load configuration, applying CLI overrides where provided.
     *
     * @param configFile    YAML file to read, or null for the bundled defaults
     * @param maxPathsCLI   CLI path limit (0 = use YAML/default)
     * @param maxStepsCLI   CLI step limit (0 = use YAML/default)
     * @param presetCLI     CLI preset name (null = use YAML/default)
     * @param detailedCLI   true when the CLI asked for a detailed report
     * @return complete checker configuration
     * @throws IOException              if the configuration file cannot be read
     * @throws IllegalArgumentException for an unknown preset or out-of-range values
     */
    public static CheckerConfig loadConfig(Path configFile, int maxPathsCLI, long maxStepsCLI,
            String presetCLI, boolean detailedCLI) throws IOException {
        Map<String, Object> config = readSection(configFile);

        String preset = presetCLI != null ? presetCLI : getString(config, "preset", "standard");
        CheckerConfig base = CheckerConfig.preset(preset);

        int maxPaths = maxPathsCLI != 0 ? maxPathsCLI : getInt(config, "max_paths", base.maxPaths());
        long maxSteps = maxStepsCLI != 0 ? maxStepsCLI : getLong(config, "max_steps", base.maxSteps());
        boolean detailed = detailedCLI || getBoolean(config, "detailed_report", base.detailedReport());
        double minConfidence = getDouble(config, "min_confidence", base.minConfidence());

        return new CheckerConfig(maxPaths, maxSteps, detailed, minConfidence);
    }

    /**
     * Configuration from the bundled defaults only.
     */
    public static CheckerConfig loadDefaults() throws IOException {
        return loadConfig(null, 0, 0, null, false);
    }

    static Map<String, Object> readSection(Path configFile) throws IOException {
        Object root;
        if (configFile == null) {
            try (InputStream in = CheckerSettings.class.getResourceAsStream(DEFAULT_RESOURCE)) {
                if (in == null) {
                    return Map.of();
                }
                root = new Yaml().load(in);
            }
        } else {
            try (InputStream in = Files.newInputStream(configFile)) {
                root = new Yaml().load(in);
            }
        }

        if (root instanceof Map<?, ?> map && map.get(CONFIG_KEY) instanceof Map<?, ?> section) {
            @SuppressWarnings("unchecked")
            Map<String, Object> config = (Map<String, Object>) section;
            return config;
        }
        return Map.of();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
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
}
