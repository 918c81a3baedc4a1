package io.surfworks.stablebridge.legalize;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.surfworks.stablebridge.config.LegalizationMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversionReportTest {

    @TempDir
    Path tempDir;

    private final ConversionReport report = new ConversionReport(LegalizationMode.PARTIAL, 5,
            List.of("stablehlo.custom_call"), 2, Duration.ofMillis(12));

    @Test
    void jsonCarriesEveryField() {
        JsonObject json = JsonParser.parseString(report.toJson()).getAsJsonObject();

        assertEquals("PARTIAL", json.get("mode").getAsString());
        assertEquals(5, json.get("converted").getAsInt());
        assertEquals(2, json.get("sweeps").getAsInt());
        assertEquals(12, json.get("elapsed_ms").getAsLong());
        assertFalse(json.get("complete").getAsBoolean());
        assertEquals("stablehlo.custom_call", json.getAsJsonArray("unconverted").get(0).getAsString());
    }

    @Test
    void completeWhenNothingIsLeft() {
        ConversionReport done = new ConversionReport(LegalizationMode.FULL, 1, List.of(), 1, Duration.ZERO);

        assertTrue(done.isComplete());
        assertFalse(report.isComplete());
    }

    @Test
    void saveToWritesJson() throws IOException {
        Path file = tempDir.resolve("report.json");

        report.saveTo(file);

        assertEquals(report.toJson(), Files.readString(file));
    }
}
