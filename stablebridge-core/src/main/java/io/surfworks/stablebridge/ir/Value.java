package io.surfworks.stablebridge.ir;

import java.util.Objects;

/**
 * An SSA value: either the result of an operation or the argument of a block.
 *
 * <p>Values are owned by their defining operation or block and compared by
 * identity. Operand lists only reference them.
 */
public final class Value {

    private final Type type;
    private final Operation definingOp;
    private final Block ownerBlock;
    private final int index;

    private Value(Type type, Operation definingOp, Block ownerBlock, int index) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.definingOp = definingOp;
        this.ownerBlock = ownerBlock;
        this.index = index;
    }

    static Value result(Operation op, Type type, int index) {
        return new Value(type, op, null, index);
    }

    static Value argument(Block block, Type type, int index) {
        return new Value(type, null, block, index);
    }

    public Type type() {
        return type;
    }

    /**
     * Returns the operation producing this value, or null for block arguments.
     */
    public Operation definingOp() {
        return definingOp;
    }

    /**
     * Returns the block declaring this argument, or null for operation results.
     */
    public Block ownerBlock() {
        return ownerBlock;
    }

    public boolean isBlockArgument() {
        return ownerBlock != null;
    }

    /**
     * Returns the result number or the argument number.
     */
    public int index() {
        return index;
    }

    @Override
    public String toString() {
        String owner = isBlockArgument() ? "arg" : definingOp.name() + "#";
        return owner + index + " : " + type.toMlirString();
    }
}
