package io.surfworks.stablebridge.legalize;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

import io.surfworks.stablebridge.dialect.mhlo.MhloOpKind;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloOpKind;

/**
 * Maps each StableHLO operation kind to the MHLO kind it legalizes to.
 *
 * <p>Kinds are paired by mnemonic. The table is built when the class is
 * loaded and loading fails if a StableHLO kind has no MHLO counterpart with
 * the same region arity.
 */
public final class OpKindMapping {

    private static final Map<StablehloOpKind, MhloOpKind> TO_HLO = build();

    private OpKindMapping() {}

    /**
     * Returns the MHLO kind for a StableHLO kind.
     */
    public static MhloOpKind toHlo(StablehloOpKind kind) {
        return TO_HLO.get(kind);
    }

    private static Map<StablehloOpKind, MhloOpKind> build() {
        Map<String, MhloOpKind> byMnemonic = new HashMap<>();
        for (MhloOpKind kind : MhloOpKind.values()) {
            byMnemonic.put(kind.mnemonic(), kind);
        }

        Map<StablehloOpKind, MhloOpKind> mapping = new EnumMap<>(StablehloOpKind.class);
        for (StablehloOpKind kind : StablehloOpKind.values()) {
            MhloOpKind target = byMnemonic.get(kind.mnemonic());
            if (target == null) {
                throw new IllegalStateException("No MHLO counterpart for " + kind.operationName());
            }
            if (target.regionCount() != kind.regionCount()) {
                throw new IllegalStateException(String.format(
                        "%s and %s disagree on region count", kind.operationName(), target.operationName()));
            }
            mapping.put(kind, target);
        }
        return mapping;
    }
}
