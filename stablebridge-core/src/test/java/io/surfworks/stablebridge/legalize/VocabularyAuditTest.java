package io.surfworks.stablebridge.legalize;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloOpKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VocabularyAuditTest {

    private final VocabularyAudit audit = VocabularyAudit.run();

    @Test
    void reportsTypedFfiAsOnlyDrift() {
        assertTrue(audit.hasDrift());
        assertEquals(List.of("custom_call_api_version"), List.copyOf(audit.unmappedEnumSymbols().keySet()));
        assertEquals(List.of("API_VERSION_TYPED_FFI"), audit.unmappedEnumSymbols().get("custom_call_api_version"));
    }

    @Test
    void listsEveryStablehloKind() {
        assertEquals(StablehloOpKind.values().length, audit.stablehloOpKinds().size());
        assertTrue(audit.stablehloOpKinds().contains("stablehlo.while"));
    }

    @Test
    void listsMhloOnlyKinds() {
        assertTrue(audit.mhloOnlyOpKinds().contains("mhlo.fusion"));
        assertTrue(audit.mhloOnlyOpKinds().contains("mhlo.xla.rng_get_and_update_state"));
        assertFalse(audit.mhloOnlyOpKinds().contains("mhlo.add"));
    }

    @Test
    void jsonMirrorsAudit() {
        JsonObject json = JsonParser.parseString(audit.toJson()).getAsJsonObject();

        assertEquals("API_VERSION_TYPED_FFI", json.getAsJsonObject("unmapped_enum_symbols")
                .getAsJsonArray("custom_call_api_version").get(0).getAsString());
        assertEquals(audit.stablehloOpKinds().size(), json.getAsJsonArray("stablehlo_ops").size());
        assertEquals(audit.mhloOnlyOpKinds().size(), json.getAsJsonArray("mhlo_only_ops").size());
    }
}
