package io.surfworks.stablebridge.legalize;

import io.surfworks.stablebridge.dialect.mhlo.MhloAttributes;
import io.surfworks.stablebridge.dialect.mhlo.MhloTypes;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloEnums;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloTypes;
import io.surfworks.stablebridge.ir.Attributes.OpaqueAttr;
import io.surfworks.stablebridge.ir.Type;
import io.surfworks.stablebridge.ir.Types;
import io.surfworks.stablebridge.ir.Types.FunctionType;
import io.surfworks.stablebridge.ir.Types.RankedTensorType;
import io.surfworks.stablebridge.ir.Types.ScalarType;
import io.surfworks.stablebridge.ir.Types.TupleType;
import io.surfworks.stablebridge.ir.Types.UnrankedTensorType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StablehloToHloTypeConverterTest {

    private final StablehloToHloTypeConverter converter = new StablehloToHloTypeConverter();

    @Test
    void tokenBecomesMhloToken() {
        assertEquals(Optional.of(MhloTypes.TokenType.INSTANCE), converter.convertType(StablehloTypes.TokenType.INSTANCE));
    }

    @Test
    void builtinTypesAreReturnedAsIs() {
        RankedTensorType tensor = new RankedTensorType(List.of(2L, 3L), ScalarType.F32);

        assertSame(ScalarType.BF16, converter.convertType(ScalarType.BF16).orElseThrow());
        assertSame(tensor, converter.convertType(tensor).orElseThrow());
    }

    @Test
    void boundedTensorEncodingBecomesMhlo() {
        RankedTensorType bounded = new RankedTensorType(List.of(Types.DYNAMIC), ScalarType.I32,
                new StablehloAttributes.TypeExtensionsAttr(List.of(16L)));

        Type converted = converter.convertType(bounded).orElseThrow();

        assertEquals(new RankedTensorType(List.of(Types.DYNAMIC), ScalarType.I32,
                new MhloAttributes.TypeExtensionsAttr(List.of(16L))), converted);
    }

    @Test
    void foreignEncodingIsKept() {
        RankedTensorType sparse = new RankedTensorType(List.of(8L), ScalarType.F32,
                new OpaqueAttr("sparse_tensor", "encoding<{}>"));

        assertSame(sparse, converter.convertType(sparse).orElseThrow());
    }

    @Test
    void otherStablehloEncodingFails() {
        RankedTensorType odd = new RankedTensorType(List.of(8L), ScalarType.F32,
                new StablehloAttributes.PrecisionAttr(StablehloEnums.Precision.HIGH));

        assertTrue(converter.convertType(odd).isEmpty());
    }

    @Test
    void containersConvertMembers() {
        TupleType tuple = new TupleType(List.of(StablehloTypes.TokenType.INSTANCE, ScalarType.F32));
        FunctionType function = new FunctionType(List.of(StablehloTypes.TokenType.INSTANCE),
                List.of(new UnrankedTensorType(ScalarType.F32)));

        assertEquals(Optional.of(new TupleType(List.of(MhloTypes.TokenType.INSTANCE, ScalarType.F32))),
                converter.convertType(tuple));
        assertEquals(Optional.of(new FunctionType(List.of(MhloTypes.TokenType.INSTANCE),
                        List.of(new UnrankedTensorType(ScalarType.F32)))),
                converter.convertType(function));
    }

    @Test
    void tupleWithUnconvertibleMemberFails() {
        RankedTensorType odd = new RankedTensorType(List.of(8L), ScalarType.F32,
                new StablehloAttributes.PrecisionAttr(StablehloEnums.Precision.HIGH));

        assertTrue(converter.convertType(new TupleType(List.of(ScalarType.F32, odd))).isEmpty());
        assertTrue(converter.convertTypes(List.of(ScalarType.F32, odd)).isEmpty());
    }
}
