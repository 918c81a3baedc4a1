package io.surfworks.stablebridge.cli;

import java.util.List;
import java.util.Map;

import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes.ComparisonDirectionAttr;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes.ComparisonTypeAttr;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes.CustomCallApiVersionAttr;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloEnums.ComparisonDirection;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloEnums.ComparisonType;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloEnums.CustomCallApiVersion;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloOpKind;
import io.surfworks.stablebridge.ir.Attribute;
import io.surfworks.stablebridge.ir.Attributes.DenseElementsAttr;
import io.surfworks.stablebridge.ir.Attributes.StringAttr;
import io.surfworks.stablebridge.ir.Attributes.TypeAttr;
import io.surfworks.stablebridge.ir.Block;
import io.surfworks.stablebridge.ir.BuiltinOpKind;
import io.surfworks.stablebridge.ir.Operation;
import io.surfworks.stablebridge.ir.Type;
import io.surfworks.stablebridge.ir.Types.FunctionType;
import io.surfworks.stablebridge.ir.Types.RankedTensorType;
import io.surfworks.stablebridge.ir.Types.ScalarType;
import io.surfworks.stablebridge.ir.Value;

/**
 * Builds a small StableHLO program for demonstrating the legalization.
 *
 * <p>{@code @main} selects between its arguments, squares the selection in a
 * {@code stablehlo.while} loop, then hands the result to a custom call:
 * <pre>
 * func.func @main(%arg0: tensor&lt;4xf32&gt;, %arg1: tensor&lt;4xf32&gt;) -&gt; tensor&lt;4xf32&gt; {
 *   %0 = stablehlo.compare EQ, %arg0, %arg1, FLOAT
 *   %1 = stablehlo.select %0, %arg0, %arg1
 *   %2 = stablehlo.while(%1) cond { ... } do { ... }
 *   %3 = stablehlo.custom_call @host_callback(%2)
 *   func.return %3
 * }
 * </pre>
 * With {@code typedFfi} set, the custom call uses the typed FFI API version,
 * which MHLO has no counterpart for, so it stays StableHLO.
 */
public final class ExampleProgram {

    static final RankedTensorType VECTOR = new RankedTensorType(List.of(4L), ScalarType.F32);
    static final RankedTensorType MASK = new RankedTensorType(List.of(4L), ScalarType.I1);
    static final RankedTensorType PREDICATE = new RankedTensorType(List.of(), ScalarType.I1);

    private ExampleProgram() {}

    /**
     * Returns a fresh {@code builtin.module} holding {@code @main}.
     *
     * @param typedFfi whether the custom call uses the typed FFI API version
     */
    public static Operation build(boolean typedFfi) {
        Operation module = Operation.create(BuiltinOpKind.MODULE, List.of(), List.of(), Map.of());
        Block moduleBody = module.region(0).append(new Block());

        FunctionType signature = new FunctionType(List.of(VECTOR, VECTOR), List.of(VECTOR));
        Operation func = Operation.create(BuiltinOpKind.FUNC, List.of(), List.of(), Map.of(
                "sym_name", new StringAttr("main"),
                "function_type", new TypeAttr(signature)));
        moduleBody.append(func);

        Block body = func.region(0).append(new Block(List.of(VECTOR, VECTOR)));
        Value lhs = body.argument(0);
        Value rhs = body.argument(1);

        Operation compare = body.append(stablehlo(StablehloOpKind.COMPARE, MASK, List.of(lhs, rhs), Map.of(
                "comparison_direction", new ComparisonDirectionAttr(ComparisonDirection.EQ),
                "compare_type", new ComparisonTypeAttr(ComparisonType.FLOAT))));
        Operation select = body.append(stablehlo(StablehloOpKind.SELECT, VECTOR,
                List.of(compare.result(0), lhs, rhs), Map.of()));

        Operation loop = body.append(buildWhile(select.result(0)));

        CustomCallApiVersion apiVersion = typedFfi
                ? CustomCallApiVersion.API_VERSION_TYPED_FFI
                : CustomCallApiVersion.API_VERSION_STATUS_RETURNING;
        Operation call = body.append(stablehlo(StablehloOpKind.CUSTOM_CALL, VECTOR, List.of(loop.result(0)), Map.of(
                "call_target_name", new StringAttr("host_callback"),
                "api_version", new CustomCallApiVersionAttr(apiVersion))));

        body.append(Operation.create(BuiltinOpKind.RETURN, List.of(), List.of(call.result(0)), Map.of()));
        return module;
    }

    private static Operation buildWhile(Value init) {
        Operation loop = stablehlo(StablehloOpKind.WHILE, VECTOR, List.of(init), Map.of());

        Block cond = loop.region(0).append(new Block(List.of(VECTOR)));
        Operation zero = cond.append(stablehlo(StablehloOpKind.CONSTANT, VECTOR, List.of(), Map.of(
                "value", new DenseElementsAttr(List.of(0.0f), VECTOR))));
        Operation positive = cond.append(stablehlo(StablehloOpKind.COMPARE, MASK,
                List.of(cond.argument(0), zero.result(0)), Map.of(
                        "comparison_direction", new ComparisonDirectionAttr(ComparisonDirection.GT))));
        Operation any = cond.append(stablehlo(StablehloOpKind.CONVERT, PREDICATE,
                List.of(positive.result(0)), Map.of()));
        cond.append(stablehlo(StablehloOpKind.RETURN, List.of(), List.of(any.result(0)), Map.of()));

        Block step = loop.region(1).append(new Block(List.of(VECTOR)));
        Operation squared = step.append(stablehlo(StablehloOpKind.MULTIPLY, VECTOR,
                List.of(step.argument(0), step.argument(0)), Map.of()));
        step.append(stablehlo(StablehloOpKind.RETURN, List.of(), List.of(squared.result(0)), Map.of()));
        return loop;
    }

    private static Operation stablehlo(StablehloOpKind kind, Type resultType, List<Value> operands,
                                       Map<String, Attribute> attributes) {
        return stablehlo(kind, List.of(resultType), operands, attributes);
    }

    private static Operation stablehlo(StablehloOpKind kind, List<Type> resultTypes, List<Value> operands,
                                       Map<String, Attribute> attributes) {
        return Operation.create(kind, resultTypes, operands, attributes);
    }
}
