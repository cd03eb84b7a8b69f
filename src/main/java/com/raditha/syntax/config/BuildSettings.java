package com.raditha.syntax.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads build options from the {@code syntax_tree} section of a YAML file
 * with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > YAML file > defaults
 *
 * <pre>
 * syntax_tree:
 *   preset: checked        # or unchecked
 *   verify_invariants: true
 *   log_summary: false
 * </pre>
 */
public class BuildSettings {

    private static final String CONFIG_KEY = "syntax_tree";
    private static final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    private BuildSettings() {
    }

    /**
     * Load options, applying CLI overrides where provided.
     *
     * @param configFile        YAML file (null = no file)
     * @param verifyCLI         CLI override for the invariant check (null = use YAML/default)
     * @param logSummaryCLI     CLI override for the summary log (null = use YAML/default)
     * @return complete build options
     * @throws IOException              if the file cannot be read or parsed
     * @throws IllegalArgumentException if the file names an unknown preset
     */
    public static BuildOptions loadConfig(@Nullable Path configFile, @Nullable Boolean verifyCLI,
                                          @Nullable Boolean logSummaryCLI) throws IOException {
        Map<String, Object> config = readSection(configFile);

        BuildOptions base = presetFor(getString(config, "preset", null));
        boolean verify = verifyCLI != null ? verifyCLI
                : getBoolean(config, "verify_invariants", base.verifyInvariants());
        boolean logSummary = logSummaryCLI != null ? logSummaryCLI
                : getBoolean(config, "log_summary", base.logSummary());

        return base.withVerifyInvariants(verify).withLogSummary(logSummary);
    }

    private static BuildOptions presetFor(@Nullable String preset) {
        if (preset == null) {
            return BuildOptions.defaults();
        }
        return switch (preset) {
            case "checked" -> BuildOptions.defaults();
            case "unchecked" -> BuildOptions.unchecked();
            default -> throw new IllegalArgumentException("Unknown preset '" + preset
                    + "', expected 'checked' or 'unchecked'");
        };
    }

    private static Map<String, Object> readSection(@Nullable Path configFile) throws IOException {
        if (configFile == null) {
            return Map.of();
        }
        if (!Files.isRegularFile(configFile)) {
            throw new IOException("Configuration file not found: " + configFile);
        }
        Map<String, Object> root = yaml.readValue(configFile.toFile(), new TypeReference<Map<String, Object>>() {
        });
        if (root == null) {
            return Map.of();
        }
        Object section = root.get(CONFIG_KEY);
        if (section instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> config = (Map<String, Object>) section;
            return config;
        }
        return Map.of();
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
