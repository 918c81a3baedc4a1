package io.surfworks.stablebridge.cli;

import io.surfworks.stablebridge.config.LegalizationConfig;
import io.surfworks.stablebridge.config.LegalizationMode;
import io.surfworks.stablebridge.ir.IrPrinter;
import io.surfworks.stablebridge.ir.Operation;
import io.surfworks.stablebridge.legalize.ConversionReport;
import io.surfworks.stablebridge.legalize.LegalizationException;
import io.surfworks.stablebridge.legalize.StablehloLegalizeToHloPass;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExampleProgramTest {

    private static final LegalizationConfig QUIET = LegalizationConfig.defaults().withAuditVocabulary(false);

    private static List<String> dialects(Operation root) {
        List<String> dialects = new ArrayList<>();
        root.walk(op -> dialects.add(op.dialect()));
        return dialects;
    }

    @Test
    void exampleLegalizesCompletely() {
        Operation module = ExampleProgram.build(false);

        ConversionReport report = new StablehloLegalizeToHloPass(QUIET).run(module);

        assertTrue(report.isComplete(), report.unconvertedOperations().toString());
        assertEquals(10, report.converted());
        assertFalse(dialects(module).contains("stablehlo"), IrPrinter.print(module));
    }

    @Test
    void typedFfiCustomCallIsLeftInPartialMode() {
        Operation module = ExampleProgram.build(true);

        ConversionReport report = new StablehloLegalizeToHloPass(QUIET).run(module);

        assertEquals(List.of("stablehlo.custom_call"), report.unconvertedOperations());
        assertEquals(9, report.converted());
    }

    @Test
    void typedFfiCustomCallFailsFullMode() {
        Operation module = ExampleProgram.build(true);
        StablehloLegalizeToHloPass pass = new StablehloLegalizeToHloPass(QUIET.withMode(LegalizationMode.FULL));

        assertThrows(LegalizationException.class, () -> pass.run(module));
    }
}
