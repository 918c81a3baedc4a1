package io.surfworks.stablebridge.cli;

import io.surfworks.stablebridge.config.LegalizationConfig;
import io.surfworks.stablebridge.config.LegalizationConfigLoader;
import io.surfworks.stablebridge.ir.IrPrinter;
import io.surfworks.stablebridge.ir.Operation;
import io.surfworks.stablebridge.legalize.ConversionReport;
import io.surfworks.stablebridge.legalize.LegalizationException;
import io.surfworks.stablebridge.legalize.StablehloLegalizeToHloPass;
import io.surfworks.stablebridge.legalize.VocabularyAudit;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class StableBridgeMain {

    public static void main(String[] args) {
        if (args.length == 0) {
            printUsage();
            return;
        }

        List<String> rest = new ArrayList<>(List.of(args));
        LegalizationConfig config;
        try {
            config = extractConfig(rest);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(2);
            return;
        }
        if (rest.isEmpty()) {
            printUsage();
            return;
        }

        String command = rest.get(0);
        switch (command) {
            case "--help", "-h" -> printUsage();
            case "--audit" -> runAudit();
            case "--audit-json" -> runAuditJson(rest);
            case "--example" -> runExample(config, rest.contains("--typed-ffi"));
            default -> {
                System.err.println("Unknown command: " + command);
                printUsage();
                System.exit(1);
            }
        }
    }

    private static void printUsage() {
        System.out.println("StableBridge CLI - StableHLO to MHLO legalization");
        System.out.println();
        System.out.println("Usage: stablebridge [--config FILE] <command> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  --audit                  Compare the StableHLO and MHLO vocabularies");
        System.out.println("  --audit-json FILE        Write the vocabulary audit to FILE as JSON");
        System.out.println("  --example [--typed-ffi]  Legalize a built-in example program");
        System.out.println("  --help, -h               Print this help message");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --config FILE            Read settings from FILE instead of "
                + LegalizationConfig.configFile());
    }

    /**
     * Removes {@code --config FILE} from the arguments and loads the configuration.
     */
    static LegalizationConfig extractConfig(List<String> args) {
        int index = args.indexOf("--config");
        if (index < 0) {
            return LegalizationConfigLoader.load();
        }
        if (index + 1 >= args.size()) {
            throw new IllegalArgumentException("--config requires a FILE argument");
        }
        Path configFile = Path.of(args.get(index + 1));
        args.remove(index + 1);
        args.remove(index);
        return LegalizationConfigLoader.load(configFile);
    }

    private static void runAudit() {
        VocabularyAudit audit = VocabularyAudit.run();
        System.out.println("StableHLO operations: " + audit.stablehloOpKinds().size());
        System.out.println("MHLO-only operations: " + audit.mhloOnlyOpKinds().size());
        for (String name : audit.mhloOnlyOpKinds()) {
            System.out.println("  - " + name);
        }
        System.out.println();
        if (!audit.hasDrift()) {
            System.out.println("Every StableHLO enum symbol has an MHLO counterpart.");
            return;
        }
        System.out.println("StableHLO enum symbols without an MHLO counterpart:");
        audit.unmappedEnumSymbols().forEach((name, symbols) ->
                System.out.println("  " + name + ": " + String.join(", ", symbols)));
    }

    private static void runAuditJson(List<String> args) {
        if (args.size() < 2) {
            System.err.println("Error: --audit-json requires a FILE argument");
            System.exit(1);
        }

        Path outputPath = Path.of(args.get(1));
        try {
            Files.writeString(outputPath, VocabularyAudit.run().toJson());
            System.out.println("Wrote vocabulary audit to " + outputPath);
        } catch (IOException e) {
            System.err.println("Error writing file: " + e.getMessage());
            System.exit(1);
        }
    }

    private static void runExample(LegalizationConfig config, boolean typedFfi) {
        Operation module = ExampleProgram.build(typedFfi);

        System.out.println("=== StableHLO Input ===");
        System.out.println(IrPrinter.print(module));

        StablehloLegalizeToHloPass pass = new StablehloLegalizeToHloPass(config);
        try {
            ConversionReport report = pass.run(module);

            System.out.println("=== MHLO Output ===");
            System.out.println(IrPrinter.print(module));

            System.out.println("=== Report ===");
            System.out.println(report.toJson());
        } catch (LegalizationException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println(IrPrinter.print(module));
            System.exit(1);
        }
    }
}
