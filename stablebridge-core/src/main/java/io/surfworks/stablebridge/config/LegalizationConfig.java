package io.surfworks.stablebridge.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration for the StableHLO to MHLO legalization pass.
 *
 * <p>Configuration is loaded in order of precedence:
 * <ol>
 *   <li>CLI arguments (highest priority)</li>
 *   <li>Config file ({@code ~/.config/stablebridge/legalize.json})</li>
 *   <li>Defaults (lowest priority)</li>
 * </ol>
 *
 * @param mode            what to do with operations that fail to convert
 * @param maxIterations   upper bound on conversion sweeps over the program
 * @param auditVocabulary whether the pass logs vocabulary drift when created
 */
public record LegalizationConfig(
        LegalizationMode mode,
        int maxIterations,
        boolean auditVocabulary
) {

    /** Default mode when none is configured */
    public static final LegalizationMode DEFAULT_MODE = LegalizationMode.PARTIAL;

    /** Default sweep limit */
    public static final int DEFAULT_MAX_ITERATIONS = 8;

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "stablebridge"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "legalize.json";

    public LegalizationConfig {
        Objects.requireNonNull(mode, "mode cannot be null");
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
    }

    /**
     * Returns the default configuration: partial mode, 8 sweeps, audit on.
     */
    public static LegalizationConfig defaults() {
        return new LegalizationConfig(DEFAULT_MODE, DEFAULT_MAX_ITERATIONS, true);
    }

    /**
     * Returns the config file path.
     */
    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public LegalizationConfig withMode(LegalizationMode newMode) {
        return new LegalizationConfig(newMode, maxIterations, auditVocabulary);
    }

    public LegalizationConfig withMaxIterations(int iterations) {
        return new LegalizationConfig(mode, iterations, auditVocabulary);
    }

    public LegalizationConfig withAuditVocabulary(boolean audit) {
        return new LegalizationConfig(mode, maxIterations, audit);
    }
}
