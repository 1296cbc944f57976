package io.surfworks.warplayout.pass;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads and saves LayoutPassConfig.
 *
 * <p>Keys missing from the file keep their default. A missing file yields the
 * defaults; a file that is not valid JSON, or holds a value of the wrong type,
 * is an error.
 *
 * <p>Example file:
 * <pre>{@code
 * {
 *   "numWarps": 8,
 *   "hoisting": false,
 *   "verifyEachStage": true
 * }
 * }</pre>
 */
public final class LayoutPassConfigLoader {

    private static final ObjectMapper JSON = new ObjectMapper();

    private LayoutPassConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     *
     * @return the loaded configuration
     * @throws LayoutConfigException if the file exists but cannot be parsed
     */
    public static LayoutPassConfig load() {
        return load(LayoutPassConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     * @throws LayoutConfigException if the file exists but cannot be parsed
     */
    public static LayoutPassConfig load(Path configFile) {
        LayoutPassConfig defaults = LayoutPassConfig.defaults();
        if (!Files.exists(configFile)) {
            return defaults;
        }
        JsonNode root;
        try {
            root = JSON.readTree(configFile.toFile());
        } catch (IOException e) {
            throw new LayoutConfigException("Cannot parse " + configFile + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new LayoutConfigException("Expected a JSON object in " + configFile);
        }
        try {
            return new LayoutPassConfig(
                    getIntOrDefault(root, "numWarps", defaults.numWarps()),
                    getIntOrDefault(root, "threadsPerWarp", defaults.threadsPerWarp()),
                    getIntOrDefault(root, "maxPatternIterations", defaults.maxPatternIterations()),
                    getBooleanOrDefault(root, "rematerialization", defaults.rematerialization()),
                    getBooleanOrDefault(root, "hoisting", defaults.hoisting()),
                    getBooleanOrDefault(root, "dotAccumulatorDecomposition", defaults.dotAccumulatorDecomposition()),
                    getBooleanOrDefault(root, "verifyEachStage", defaults.verifyEachStage()),
                    getBooleanOrDefault(root, "dumpIr", defaults.dumpIr()));
        } catch (IllegalArgumentException e) {
            throw new LayoutConfigException("Invalid configuration in " + configFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Saves configuration to the default config file.
     *
     * @param config the configuration to save
     * @throws IOException if saving fails
     */
    public static void save(LayoutPassConfig config) throws IOException {
        save(config, LayoutPassConfig.configFile());
    }

    /**
     * Saves configuration to a specific file.
     *
     * @param config     the configuration to save
     * @param configFile path to write the config
     * @throws IOException if saving fails
     */
    public static void save(LayoutPassConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("numWarps", config.numWarps());
        root.put("threadsPerWarp", config.threadsPerWarp());
        root.put("maxPatternIterations", config.maxPatternIterations());
        root.put("rematerialization", config.rematerialization());
        root.put("hoisting", config.hoisting());
        root.put("dotAccumulatorDecomposition", config.dotAccumulatorDecomposition());
        root.put("verifyEachStage", config.verifyEachStage());
        root.put("dumpIr", config.dumpIr());

        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    private static int getIntOrDefault(JsonNode node, String field, int defaultValue) {
        if (!node.has(field)) {
            return defaultValue;
        }
        JsonNode value = node.get(field);
        if (!value.isInt()) {
            throw new LayoutConfigException("Expected an integer for '" + field + "' but got " + value);
        }
        return value.asInt();
    }

    private static boolean getBooleanOrDefault(JsonNode node, String field, boolean defaultValue) {
        if (!node.has(field)) {
            return defaultValue;
        }
        JsonNode value = node.get(field);
        if (!value.isBoolean()) {
            throw new LayoutConfigException("Expected a boolean for '" + field + "' but got " + value);
        }
        return value.asBoolean();
    }
}
