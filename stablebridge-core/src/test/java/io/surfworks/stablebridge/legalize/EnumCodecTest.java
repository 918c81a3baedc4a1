package io.surfworks.stablebridge.legalize;

import io.surfworks.stablebridge.dialect.mhlo.MhloAttributes;
import io.surfworks.stablebridge.dialect.mhlo.MhloEnums;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloEnums;
import io.surfworks.stablebridge.ir.Attribute;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EnumCodecTest {

    @ParameterizedTest
    @EnumSource(StablehloEnums.ComparisonDirection.class)
    void comparisonDirectionsConvertByName(StablehloEnums.ComparisonDirection direction) {
        Optional<MhloEnums.ComparisonDirection> converted = EnumCodecs.COMPARISON_DIRECTION.convert(direction);

        assertTrue(converted.isPresent());
        assertEquals(direction.name(), converted.get().name());
    }

    @Test
    void typedFfiHasNoMhloCounterpart() {
        assertTrue(EnumCodecs.CUSTOM_CALL_API_VERSION
                .convert(StablehloEnums.CustomCallApiVersion.API_VERSION_TYPED_FFI)
                .isEmpty());
        assertEquals(List.of(StablehloEnums.CustomCallApiVersion.API_VERSION_TYPED_FFI),
                EnumCodecs.CUSTOM_CALL_API_VERSION.unmappedSymbols());
    }

    @Test
    void mhloOnlySymbolsDoNotCountAsUnmapped() {
        // PACKED_NIBBLE exists only on the MHLO side.
        assertTrue(EnumCodecs.PRECISION.unmappedSymbols().isEmpty());
    }

    @Test
    void convertAttributeWrapsInMhloAttribute() {
        Optional<Attribute> converted = EnumCodecs.PRECISION.convertAttribute(
                new StablehloAttributes.PrecisionAttr(StablehloEnums.Precision.HIGHEST));

        assertEquals(Optional.of(new MhloAttributes.PrecisionAttr(MhloEnums.Precision.HIGHEST)), converted);
    }

    @Test
    void allListsEightCodecsWithDistinctNames() {
        List<String> names = EnumCodecs.all().stream().map(EnumCodec::name).toList();

        assertEquals(8, names.size());
        assertEquals(8, names.stream().distinct().count());
        assertTrue(names.contains("custom_call_api_version"));
    }
}
