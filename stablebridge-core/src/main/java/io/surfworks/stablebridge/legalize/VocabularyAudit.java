package io.surfworks.stablebridge.legalize;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import io.surfworks.stablebridge.dialect.mhlo.MhloOpKind;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloOpKind;
import io.surfworks.stablebridge.ir.OpKind;
import io.surfworks.stablebridge.ir.SymbolicEnum;

/**
 * Compares the StableHLO and MHLO vocabularies.
 *
 * <p>An enum symbol StableHLO has and MHLO lacks means every attribute
 * carrying it fails to convert. MHLO-only operation kinds are informational:
 * nothing produces them from StableHLO.
 *
 * @param unmappedEnumSymbols StableHLO symbols without an MHLO counterpart, by attribute name;
 *                            only attributes with at least one such symbol appear
 * @param stablehloOpKinds    every StableHLO operation name
 * @param mhloOnlyOpKinds     MHLO operation names that no StableHLO kind maps to
 */
public record VocabularyAudit(
        Map<String, List<String>> unmappedEnumSymbols,
        List<String> stablehloOpKinds,
        List<String> mhloOnlyOpKinds
) {

    private static final Logger LOG = Logger.getLogger(VocabularyAudit.class.getName());
    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    public VocabularyAudit {
        unmappedEnumSymbols = Collections.unmodifiableMap(new LinkedHashMap<>(unmappedEnumSymbols));
        stablehloOpKinds = List.copyOf(stablehloOpKinds);
        mhloOnlyOpKinds = List.copyOf(mhloOnlyOpKinds);
    }

    /**
     * Audits the vocabularies currently compiled in.
     */
    public static VocabularyAudit run() {
        Map<String, List<String>> unmapped = new LinkedHashMap<>();
        for (EnumCodec<?, ?> codec : EnumCodecs.all()) {
            List<String> symbols = codec.unmappedSymbols().stream()
                    .map(SymbolicEnum::stringify)
                    .toList();
            if (!symbols.isEmpty()) {
                unmapped.put(codec.name(), symbols);
            }
        }

        List<String> stablehlo = new ArrayList<>();
        EnumSet<MhloOpKind> reached = EnumSet.noneOf(MhloOpKind.class);
        for (StablehloOpKind kind : StablehloOpKind.values()) {
            stablehlo.add(kind.operationName());
            reached.add(OpKindMapping.toHlo(kind));
        }

        List<String> mhloOnly = EnumSet.complementOf(reached).stream()
                .map(OpKind::operationName)
                .toList();

        return new VocabularyAudit(unmapped, stablehlo, mhloOnly);
    }

    /**
     * Returns true if some StableHLO enum symbol has no MHLO counterpart.
     */
    public boolean hasDrift() {
        return !unmappedEnumSymbols.isEmpty();
    }

    /**
     * Logs one warning per StableHLO enum symbol without an MHLO counterpart.
     */
    public void logWarnings() {
        unmappedEnumSymbols.forEach((name, symbols) -> {
            for (String symbol : symbols) {
                LOG.warning("#stablehlo<" + name + " " + symbol + "> has no MHLO counterpart");
            }
        });
    }

    /**
     * Convert to JSON string.
     */
    public String toJson() {
        JsonObject root = new JsonObject();

        JsonObject unmapped = new JsonObject();
        unmappedEnumSymbols.forEach((name, symbols) -> unmapped.add(name, toArray(symbols)));
        root.add("unmapped_enum_symbols", unmapped);
        root.add("stablehlo_ops", toArray(stablehloOpKinds));
        root.add("mhlo_only_ops", toArray(mhloOnlyOpKinds));

        return GSON.toJson(root);
    }

    private static JsonArray toArray(List<String> values) {
        JsonArray array = new JsonArray();
        for (String value : values) {
            array.add(value);
        }
        return array;
    }
}
