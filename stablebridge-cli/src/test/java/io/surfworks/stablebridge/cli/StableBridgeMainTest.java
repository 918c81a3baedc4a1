package io.surfworks.stablebridge.cli;

import io.surfworks.stablebridge.config.LegalizationConfig;
import io.surfworks.stablebridge.config.LegalizationConfigLoader;
import io.surfworks.stablebridge.config.LegalizationMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StableBridgeMainTest {

    @TempDir
    Path tempDir;

    @Test
    void extractConfigConsumesOptionAndLoadsFile() throws IOException {
        Path file = tempDir.resolve("legalize.json");
        LegalizationConfigLoader.save(new LegalizationConfig(LegalizationMode.FULL, 2, false), file);
        List<String> args = new ArrayList<>(List.of("--config", file.toString(), "--example"));

        LegalizationConfig config = StableBridgeMain.extractConfig(args);

        assertEquals(LegalizationMode.FULL, config.mode());
        assertEquals(2, config.maxIterations());
        assertEquals(List.of("--example"), args);
    }

    @Test
    void extractConfigRequiresFile() {
        List<String> args = new ArrayList<>(List.of("--example", "--config"));

        assertThrows(IllegalArgumentException.class, () -> StableBridgeMain.extractConfig(args));
    }
}
