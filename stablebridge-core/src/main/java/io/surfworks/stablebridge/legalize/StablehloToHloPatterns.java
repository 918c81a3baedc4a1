package io.surfworks.stablebridge.legalize;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import io.surfworks.stablebridge.conversion.PatternSet;
import io.surfworks.stablebridge.conversion.TypeConverter;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloOpKind;
import io.surfworks.stablebridge.ir.OpKind;

/**
 * Registers the StableHLO to MHLO rewrite of every StableHLO operation kind.
 *
 * <p>Example usage:
 * <pre>{@code
 * PatternSet patterns = new PatternSet();
 * StablehloToHloPatterns.populate(patterns, new StablehloToHloTypeConverter());
 * StablehloToHloPatterns.verifyComplete(patterns);
 * }</pre>
 */
public final class StablehloToHloPatterns {

    private StablehloToHloPatterns() {}

    /**
     * Adds one {@link StablehloToHloOpConverter} per {@link StablehloOpKind}.
     *
     * @param patterns the set to populate
     * @param converter the type converter the rewrites use for result types
     * @throws IllegalStateException if {@code patterns} already has a pattern
     *         for a StableHLO kind
     */
    public static void populate(PatternSet patterns, TypeConverter converter) {
        StablehloToHloAttributeConverter attributeConverter = new StablehloToHloAttributeConverter();
        for (StablehloOpKind kind : StablehloOpKind.values()) {
            patterns.add(new StablehloToHloOpConverter(kind, converter, attributeConverter));
        }
    }

    /**
     * Checks that the registered kinds are exactly the StableHLO kinds.
     *
     * @throws IllegalStateException listing missing and unexpected kinds otherwise
     */
    public static void verifyComplete(PatternSet patterns) {
        Set<OpKind> expected = new LinkedHashSet<>(List.of(StablehloOpKind.values()));

        List<String> missing = expected.stream()
                .filter(kind -> !patterns.contains(kind))
                .map(OpKind::operationName)
                .toList();
        List<String> unexpected = patterns.kinds().stream()
                .filter(kind -> !expected.contains(kind))
                .map(OpKind::operationName)
                .toList();

        if (!missing.isEmpty() || !unexpected.isEmpty()) {
            throw new IllegalStateException(String.format(
                    "StableHLO patterns out of sync: missing=%s, unexpected=%s", missing, unexpected));
        }
    }
}
