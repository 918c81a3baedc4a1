package io.surfworks.stablebridge.ir;

import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes.ComparisonDirectionAttr;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloEnums.ComparisonDirection;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloOpKind;
import io.surfworks.stablebridge.ir.Types.RankedTensorType;
import io.surfworks.stablebridge.ir.Types.ScalarType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IrPrinterTest {

    @Test
    void printsGenericFormWithRegionsAndAttributes() {
        Type vector = new RankedTensorType(List.of(4L), ScalarType.F32);
        Type mask = new RankedTensorType(List.of(4L), ScalarType.I1);

        Operation func = Operation.create(BuiltinOpKind.FUNC, List.of(), List.of(), Map.of());
        Block body = func.region(0).append(new Block(List.of(vector, vector)));
        Operation compare = body.append(Operation.create(StablehloOpKind.COMPARE, List.of(mask),
                List.of(body.argument(0), body.argument(1)),
                Map.of("comparison_direction", new ComparisonDirectionAttr(ComparisonDirection.EQ))));
        body.append(Operation.create(BuiltinOpKind.RETURN, List.of(), List.of(compare.result(0)), Map.of()));

        String text = IrPrinter.print(func);

        assertTrue(text.startsWith("\"func.func\"() ({"), text);
        assertTrue(text.contains("^bb(%arg0: tensor<4xf32>, %arg1: tensor<4xf32>):"), text);
        assertTrue(text.contains("%0 = \"stablehlo.compare\"(%arg0, %arg1)"
                + " {comparison_direction = #stablehlo<comparison_direction EQ>}"
                + " : (tensor<4xf32>, tensor<4xf32>) -> tensor<4xi1>"), text);
        assertTrue(text.contains("\"func.return\"(%0) : (tensor<4xi1>) -> ()"), text);
    }
}
