package io.surfworks.stablebridge.conversion;

import io.surfworks.stablebridge.dialect.mhlo.MhloOpKind;
import io.surfworks.stablebridge.dialect.mhlo.MhloOps;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloDialect;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloOpKind;
import io.surfworks.stablebridge.ir.Block;
import io.surfworks.stablebridge.ir.BuiltinOpKind;
import io.surfworks.stablebridge.ir.OpKind;
import io.surfworks.stablebridge.ir.Operation;
import io.surfworks.stablebridge.ir.Type;
import io.surfworks.stablebridge.ir.Types.RankedTensorType;
import io.surfworks.stablebridge.ir.Types.ScalarType;
import io.surfworks.stablebridge.ir.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

import static org.junit.jupiter.api.Assertions.*;

class ConversionDriverTest {

    private static final Type VECTOR = new RankedTensorType(List.of(4L), ScalarType.F32);
    private static final TypeConverter IDENTITY = Optional::of;
    private static final ConversionTarget TARGET = ConversionTarget.withIllegalDialect(StablehloDialect.NAMESPACE);

    private Operation module;
    private Block body;

    @BeforeEach
    void setUp() {
        module = Operation.create(BuiltinOpKind.MODULE, List.of(), List.of(), Map.of());
        body = module.region(0).append(new Block(List.of(VECTOR)));
    }

    private static ConversionPattern pattern(OpKind kind, BiFunction<Operation, List<Value>, Operation> rewrite) {
        return new ConversionPattern() {
            @Override
            public OpKind rootKind() {
                return kind;
            }

            @Override
            public Optional<Operation> matchAndRewrite(Operation op, List<Value> operands) {
                return Optional.ofNullable(rewrite.apply(op, operands));
            }
        };
    }

    /** abs becomes stablehlo.negate, which only a later sweep turns into mhlo.negate. */
    private static PatternSet twoStepPatterns() {
        return new PatternSet()
                .add(pattern(StablehloOpKind.ABS, (op, operands) ->
                        Operation.create(StablehloOpKind.NEGATE, op.resultTypes(), operands, Map.of())))
                .add(pattern(StablehloOpKind.NEGATE, (op, operands) ->
                        MhloOps.create(MhloOpKind.NEGATE, op.resultTypes(), operands, Map.of())));
    }

    @Test
    void repeatsSweepsUntilNothingConverts() {
        Operation abs = body.append(Operation.create(StablehloOpKind.ABS, List.of(VECTOR),
                List.of(body.argument(0)), Map.of()));
        Operation user = body.append(Operation.create(BuiltinOpKind.RETURN, List.of(), List.of(abs.result(0)),
                Map.of()));

        ConversionDriver driver = new ConversionDriver(twoStepPatterns(), IDENTITY, TARGET, 8);
        ConversionResult result = driver.apply(module);

        assertTrue(result.isComplete());
        assertEquals(2, result.converted());
        assertEquals(3, result.sweeps());
        Operation negate = body.operations().get(0);
        assertEquals(MhloOpKind.NEGATE, negate.kind());
        assertSame(negate.result(0), user.operand(0));
        assertSame(negate.result(0), driver.lookup(abs.result(0)));
    }

    @Test
    void stopsAtSweepLimit() {
        body.append(Operation.create(StablehloOpKind.ABS, List.of(VECTOR), List.of(body.argument(0)), Map.of()));

        ConversionResult result = new ConversionDriver(twoStepPatterns(), IDENTITY, TARGET, 1).apply(module);

        assertEquals(1, result.sweeps());
        assertEquals(1, result.illegalRemaining().size());
        assertEquals("stablehlo.negate", result.illegalRemaining().get(0).name());
    }

    @Test
    void operationWithoutPatternStaysIllegal() {
        Operation sub = body.append(Operation.create(StablehloOpKind.SUBTRACT, List.of(VECTOR),
                List.of(body.argument(0), body.argument(0)), Map.of()));

        ConversionResult result = new ConversionDriver(twoStepPatterns(), IDENTITY, TARGET, 8).apply(module);

        assertEquals(List.of(sub), result.illegalRemaining());
        assertEquals(0, result.converted());
    }

    @Test
    void rejectsReplacementWithDifferentResultCount() {
        body.append(Operation.create(StablehloOpKind.ABS, List.of(VECTOR), List.of(body.argument(0)), Map.of()));
        PatternSet patterns = new PatternSet().add(pattern(StablehloOpKind.ABS, (op, operands) ->
                MhloOps.create(MhloOpKind.ABS, List.of(), operands, Map.of())));

        ConversionDriver driver = new ConversionDriver(patterns, IDENTITY, TARGET, 8);

        assertThrows(IllegalStateException.class, () -> driver.apply(module));
    }

    @Test
    void rejectsSweepLimitBelowOne() {
        assertThrows(IllegalArgumentException.class,
                () -> new ConversionDriver(new PatternSet(), IDENTITY, TARGET, 0));
    }
}
