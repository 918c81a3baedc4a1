package io.surfworks.stablebridge.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for LegalizationConfig and LegalizationConfigLoader.
 */
class LegalizationConfigTest {

    @TempDir
    Path tempDir;

    // ===== LegalizationConfig tests =====

    @Test
    void defaultsArePartialWithEightSweepsAndAudit() {
        LegalizationConfig config = LegalizationConfig.defaults();

        assertEquals(LegalizationMode.PARTIAL, config.mode());
        assertEquals(8, config.maxIterations());
        assertTrue(config.auditVocabulary());
    }

    @Test
    void withModeCreatesNewInstance() {
        LegalizationConfig base = LegalizationConfig.defaults();
        LegalizationConfig modified = base.withMode(LegalizationMode.FULL);

        assertEquals(LegalizationMode.PARTIAL, base.mode());
        assertEquals(LegalizationMode.FULL, modified.mode());
    }

    @Test
    void rejectsNonPositiveIterations() {
        assertThrows(IllegalArgumentException.class,
                () -> LegalizationConfig.defaults().withMaxIterations(0));
    }

    @Test
    void rejectsNullMode() {
        assertThrows(NullPointerException.class, () -> new LegalizationConfig(null, 8, true));
    }

    @Test
    void configFileIsUnderConfigDir() {
        assertEquals(LegalizationConfig.CONFIG_DIR.resolve("legalize.json"), LegalizationConfig.configFile());
    }

    @Test
    void modeParsingIgnoresCase() {
        assertEquals(LegalizationMode.FULL, LegalizationMode.fromString("full"));
        assertThrows(IllegalArgumentException.class, () -> LegalizationMode.fromString("strict"));
    }

    // ===== LegalizationConfigLoader tests =====

    @Test
    void missingFileYieldsDefaults() {
        LegalizationConfig config = LegalizationConfigLoader.load(tempDir.resolve("missing.json"));

        assertEquals(LegalizationConfig.defaults(), config);
    }

    @Test
    void saveAndLoadRoundTrip() throws IOException {
        Path file = tempDir.resolve("nested").resolve("legalize.json");
        LegalizationConfig config = new LegalizationConfig(LegalizationMode.FULL, 3, false);

        LegalizationConfigLoader.save(config, file);

        assertTrue(Files.exists(file));
        assertEquals(config, LegalizationConfigLoader.load(file));
    }

    @Test
    void missingKeysKeepDefaults() throws IOException {
        Path file = tempDir.resolve("legalize.json");
        Files.writeString(file, "{\"mode\": \"FULL\"}");

        LegalizationConfig config = LegalizationConfigLoader.load(file);

        assertEquals(LegalizationMode.FULL, config.mode());
        assertEquals(LegalizationConfig.DEFAULT_MAX_ITERATIONS, config.maxIterations());
        assertTrue(config.auditVocabulary());
    }

    @Test
    void malformedFileYieldsDefaults() throws IOException {
        Path file = tempDir.resolve("legalize.json");
        Files.writeString(file, "{ not json");

        assertEquals(LegalizationConfig.defaults(), LegalizationConfigLoader.load(file));
    }

    @Test
    void invalidValuesYieldDefaults() throws IOException {
        Path file = tempDir.resolve("legalize.json");
        Files.writeString(file, "{\"mode\": \"STRICT\", \"maxIterations\": 4}");

        assertEquals(LegalizationConfig.defaults(), LegalizationConfigLoader.load(file));
    }
}
