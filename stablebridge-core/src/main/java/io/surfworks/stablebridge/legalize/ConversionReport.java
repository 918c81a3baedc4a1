package io.surfworks.stablebridge.legalize;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

import io.surfworks.stablebridge.config.LegalizationMode;

/**
 * Summary of one legalization run.
 *
 * @param mode                mode the pass ran in
 * @param converted           number of operations rewritten to MHLO
 * @param unconvertedOperations names of StableHLO operations left, in program order
 * @param sweeps              number of walks over the program
 * @param elapsed             wall time of the run
 */
public record ConversionReport(
        LegalizationMode mode,
        int converted,
        List<String> unconvertedOperations,
        int sweeps,
        Duration elapsed
) {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    public ConversionReport {
        Objects.requireNonNull(mode, "mode cannot be null");
        Objects.requireNonNull(elapsed, "elapsed cannot be null");
        unconvertedOperations = List.copyOf(unconvertedOperations);
    }

    /**
     * Returns true if no StableHLO operation is left.
     */
    public boolean isComplete() {
        return unconvertedOperations.isEmpty();
    }

    /**
     * Convert to JSON string.
     */
    public String toJson() {
        JsonObject root = new JsonObject();
        root.addProperty("mode", mode.name());
        root.addProperty("converted", converted);
        root.addProperty("sweeps", sweeps);
        root.addProperty("elapsed_ms", elapsed.toMillis());
        root.addProperty("complete", isComplete());

        JsonArray unconverted = new JsonArray();
        for (String name : unconvertedOperations) {
            unconverted.add(name);
        }
        root.add("unconverted", unconverted);

        return GSON.toJson(root);
    }

    /**
     * Save report to JSON file.
     */
    public void saveTo(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            writer.write(toJson());
        }
    }

    @Override
    public String toString() {
        return String.format("ConversionReport[mode=%s, converted=%d, unconverted=%d, sweeps=%d, elapsed=%dms]",
                mode, converted, unconvertedOperations.size(), sweeps, elapsed.toMillis());
    }
}
