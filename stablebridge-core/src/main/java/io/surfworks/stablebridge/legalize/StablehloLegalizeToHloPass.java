package io.surfworks.stablebridge.legalize;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import io.surfworks.stablebridge.config.LegalizationConfig;
import io.surfworks.stablebridge.config.LegalizationMode;
import io.surfworks.stablebridge.conversion.ConversionDriver;
import io.surfworks.stablebridge.conversion.ConversionResult;
import io.surfworks.stablebridge.conversion.ConversionTarget;
import io.surfworks.stablebridge.conversion.PatternSet;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloDialect;
import io.surfworks.stablebridge.ir.BuiltinOpKind;
import io.surfworks.stablebridge.ir.Operation;

/**
 * Legalizes every StableHLO operation in a program to MHLO.
 *
 * <p>The pass registers one rewrite per StableHLO operation kind, refusing to
 * start if any kind is missing, and drives them over the program until
 * nothing more converts. A {@code func.func} counts as legal only once its
 * signature and entry-block arguments are free of StableHLO types.
 *
 * <p>Example usage:
 * <pre>{@code
 * StablehloLegalizeToHloPass pass = new StablehloLegalizeToHloPass(LegalizationConfigLoader.load());
 * ConversionReport report = pass.run(module);
 * System.out.println(report.toJson());
 * }</pre>
 *
 * <p>In {@link LegalizationMode#FULL} mode, {@link #run} throws
 * {@link LegalizationException} if anything is left; the operations already
 * converted are not restored.
 */
public final class StablehloLegalizeToHloPass {

    private static final Logger LOG = Logger.getLogger(StablehloLegalizeToHloPass.class.getName());

    private final LegalizationConfig config;
    private final StablehloToHloTypeConverter typeConverter = new StablehloToHloTypeConverter();
    private final PatternSet patterns = new PatternSet();
    private final FuncSignatureConverter signatureConverter = new FuncSignatureConverter(typeConverter);

    public StablehloLegalizeToHloPass() {
        this(LegalizationConfig.defaults());
    }

    public StablehloLegalizeToHloPass(LegalizationConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        StablehloToHloPatterns.populate(patterns, typeConverter);
        StablehloToHloPatterns.verifyComplete(patterns);
        patterns.add(signatureConverter);
        if (config.auditVocabulary()) {
            VocabularyAudit.run().logWarnings();
        }
    }

    public LegalizationConfig config() {
        return config;
    }

    /**
     * Runs the legalization over every operation nested in {@code root}.
     *
     * @param root the operation holding the program, typically a module
     * @return what was converted and what was left
     * @throws LegalizationException in full mode, if a StableHLO operation is left
     */
    public ConversionReport run(Operation root) {
        long start = System.nanoTime();
        ConversionDriver driver = new ConversionDriver(patterns, typeConverter,
                legalTarget(), config.maxIterations());
        ConversionResult result = driver.apply(root);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        List<String> remaining = result.illegalRemaining().stream()
                .map(Operation::name)
                .toList();
        ConversionReport report = new ConversionReport(
                config.mode(), result.converted(), remaining, result.sweeps(), elapsed);
        LOG.info("Legalized " + report.converted() + " operations to MHLO in " + report.sweeps()
                + " sweep(s), " + remaining.size() + " left");

        if (config.mode() == LegalizationMode.FULL && !remaining.isEmpty()) {
            throw new LegalizationException(remaining);
        }
        return report;
    }

    private ConversionTarget legalTarget() {
        return ConversionTarget.withIllegalDialect(StablehloDialect.NAMESPACE)
                .withDynamicLegality(BuiltinOpKind.FUNC, signatureConverter::isSignatureLegal);
    }
}
