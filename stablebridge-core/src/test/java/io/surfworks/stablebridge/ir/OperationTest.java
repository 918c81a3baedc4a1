package io.surfworks.stablebridge.ir;

import io.surfworks.stablebridge.dialect.stablehlo.StablehloOpKind;
import io.surfworks.stablebridge.ir.Attributes.IntegerAttr;
import io.surfworks.stablebridge.ir.Types.RankedTensorType;
import io.surfworks.stablebridge.ir.Types.ScalarType;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OperationTest {

    private static final Type VECTOR = new RankedTensorType(List.of(4L), ScalarType.F32);

    @Nested
    class CreationTests {

        @Test
        void createsResultsWithTypesAndIndices() {
            Operation op = Operation.create(StablehloOpKind.ADD, List.of(VECTOR), List.of(), Map.of());

            assertEquals("stablehlo.add", op.name());
            assertEquals("stablehlo", op.dialect());
            assertEquals(1, op.results().size());
            assertSame(op, op.result(0).definingOp());
            assertEquals(VECTOR, op.result(0).type());
            assertEquals(0, op.result(0).index());
            assertFalse(op.result(0).isBlockArgument());
        }

        @Test
        void createsFixedNumberOfRegions() {
            Operation loop = Operation.create(StablehloOpKind.WHILE, List.of(), List.of(), Map.of());

            assertEquals(2, loop.regions().size());
            assertTrue(loop.region(0).isEmpty());
            assertSame(loop, loop.region(1).parentOp());
        }

        @Test
        void rejectsWrongRegionCount() {
            assertThrows(IllegalArgumentException.class, () ->
                    Operation.create(StablehloOpKind.WHILE, List.of(), List.of(), Map.of(), 1));
        }

        @Test
        void variadicKindNeedsExplicitRegionCount() {
            assertThrows(IllegalArgumentException.class, () ->
                    Operation.create(StablehloOpKind.CASE, List.of(), List.of(), Map.of()));

            Operation caseOp = Operation.create(StablehloOpKind.CASE, List.of(), List.of(), Map.of(), 3);
            assertEquals(3, caseOp.regions().size());
        }

        @Test
        void keepsAttributeInsertionOrder() {
            Map<String, Attribute> attrs = new LinkedHashMap<>();
            attrs.put("zeta", new IntegerAttr(1));
            attrs.put("alpha", new IntegerAttr(2));
            Operation op = Operation.create(StablehloOpKind.ADD, List.of(), List.of(), attrs);

            assertEquals(List.of("zeta", "alpha"), new ArrayList<>(op.attributes().keySet()));
            assertTrue(op.attribute("alpha").isPresent());
            assertTrue(op.attribute("missing").isEmpty());
        }
    }

    @Nested
    class StructureTests {

        @Test
        void appendRejectsOperationWithParent() {
            Block first = new Block();
            Block second = new Block();
            Operation op = first.append(Operation.create(StablehloOpKind.ADD, List.of(), List.of(), Map.of()));

            assertSame(first, op.parentBlock());
            assertThrows(IllegalStateException.class, () -> second.append(op));
        }

        @Test
        void replaceSwapsOperationInPlace() {
            Block block = new Block();
            Operation a = block.append(Operation.create(StablehloOpKind.ADD, List.of(), List.of(), Map.of()));
            Operation b = block.append(Operation.create(StablehloOpKind.ABS, List.of(), List.of(), Map.of()));
            Operation c = Operation.create(StablehloOpKind.NEGATE, List.of(), List.of(), Map.of());

            block.replace(a, c);

            assertEquals(List.of(c, b), block.operations());
            assertNull(a.parentBlock());
            assertSame(block, c.parentBlock());
        }

        @Test
        void parentOpFollowsRegionNesting() {
            Operation loop = Operation.create(StablehloOpKind.WHILE, List.of(), List.of(), Map.of());
            Block body = loop.region(1).append(new Block());
            Operation inner = body.append(Operation.create(StablehloOpKind.ADD, List.of(), List.of(), Map.of()));

            assertSame(loop, inner.parentOp());
            assertNull(loop.parentOp());
        }

        @Test
        void takeBlocksMovesBlocksByIdentity() {
            Operation from = Operation.create(StablehloOpKind.REDUCE, List.of(), List.of(), Map.of());
            Operation to = Operation.create(StablehloOpKind.REDUCE, List.of(), List.of(), Map.of());
            Block block = from.region(0).append(new Block(List.of(VECTOR)));
            Value arg = block.argument(0);

            to.region(0).takeBlocks(from.region(0));

            assertTrue(from.region(0).isEmpty());
            assertSame(block, to.region(0).front());
            assertSame(to.region(0), block.parentRegion());
            assertSame(arg, block.argument(0));
        }

        @Test
        void replaceArgumentCreatesFreshValue() {
            Block block = new Block(List.of(VECTOR));
            Value old = block.argument(0);
            Type i32 = new RankedTensorType(List.of(4L), ScalarType.I32);

            Value fresh = block.replaceArgument(0, i32);

            assertNotSame(old, fresh);
            assertSame(fresh, block.argument(0));
            assertEquals(i32, fresh.type());
            assertTrue(fresh.isBlockArgument());
            assertSame(block, fresh.ownerBlock());
        }

        @Test
        void walkVisitsInPreOrder() {
            Operation loop = Operation.create(StablehloOpKind.WHILE, List.of(), List.of(), Map.of());
            Operation cond = loop.region(0).append(new Block())
                    .append(Operation.create(StablehloOpKind.COMPARE, List.of(), List.of(), Map.of()));
            Operation body = loop.region(1).append(new Block())
                    .append(Operation.create(StablehloOpKind.ADD, List.of(), List.of(), Map.of()));

            List<Operation> visited = new ArrayList<>();
            loop.walk(visited::add);

            assertEquals(List.of(loop, cond, body), visited);
        }
    }
}
