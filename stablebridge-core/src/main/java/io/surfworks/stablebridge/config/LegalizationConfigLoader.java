package io.surfworks.stablebridge.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Loads and saves {@link LegalizationConfig} as JSON.
 *
 * <p>Keys missing from the file keep their default. A file that cannot be
 * read or parsed is reported and ignored.
 */
public final class LegalizationConfigLoader {

    private static final Logger LOG = Logger.getLogger(LegalizationConfigLoader.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    private LegalizationConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     *
     * @return the loaded configuration, or defaults if there is no file
     */
    public static LegalizationConfig load() {
        return load(LegalizationConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     */
    public static LegalizationConfig load(Path configFile) {
        LegalizationConfig config = LegalizationConfig.defaults();
        if (Files.exists(configFile)) {
            config = loadFromFile(configFile, config);
        }
        return config;
    }

    /**
     * Saves configuration to the default config file.
     *
     * @throws IOException if saving fails
     */
    public static void save(LegalizationConfig config) throws IOException {
        save(config, LegalizationConfig.configFile());
    }

    /**
     * Saves configuration to a specific file.
     *
     * @param config     the configuration to save
     * @param configFile path to write the config
     * @throws IOException if saving fails
     */
    public static void save(LegalizationConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("mode", config.mode().name());
        root.put("maxIterations", config.maxIterations());
        root.put("auditVocabulary", config.auditVocabulary());

        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    private static LegalizationConfig loadFromFile(Path configFile, LegalizationConfig base) {
        try {
            JsonNode root = JSON.readTree(configFile.toFile());
            if (root == null || !root.isObject()) {
                LOG.warning("Ignoring config file " + configFile + ": not a JSON object");
                return base;
            }

            LegalizationConfig config = base;
            if (root.has("mode")) {
                config = config.withMode(LegalizationMode.fromString(root.get("mode").asText()));
            }
            if (root.has("maxIterations")) {
                config = config.withMaxIterations(root.get("maxIterations").asInt());
            }
            if (root.has("auditVocabulary")) {
                config = config.withAuditVocabulary(root.get("auditVocabulary").asBoolean());
            }
            return config;

        } catch (IOException | IllegalArgumentException e) {
            LOG.warning("Ignoring config file " + configFile + ": " + e.getMessage());
            return base;
        }
    }
}
