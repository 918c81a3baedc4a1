package io.surfworks.stablebridge.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered list of operations with typed arguments.
 */
public final class Block {

    private final List<Value> arguments = new ArrayList<>();
    private final List<Operation> operations = new ArrayList<>();
    private Region parent;

    public Block() {}

    public Block(List<Type> argumentTypes) {
        for (Type type : argumentTypes) {
            addArgument(type);
        }
    }

    public Value addArgument(Type type) {
        Value arg = Value.argument(this, type, arguments.size());
        arguments.add(arg);
        return arg;
    }

    /**
     * Replaces argument {@code index} by a fresh argument of {@code newType}.
     *
     * <p>Uses of the old argument are not updated; callers remap them.
     *
     * @return the new argument
     */
    public Value replaceArgument(int index, Type newType) {
        Value arg = Value.argument(this, newType, index);
        arguments.set(index, arg);
        return arg;
    }

    public List<Value> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public Value argument(int index) {
        return arguments.get(index);
    }

    public List<Operation> operations() {
        return Collections.unmodifiableList(operations);
    }

    /**
     * Appends a detached operation to the end of this block.
     */
    public Operation append(Operation op) {
        if (op.parentBlock() != null) {
            throw new IllegalStateException(op.name() + " already belongs to a block");
        }
        operations.add(op);
        op.setParentBlock(this);
        return op;
    }

    /**
     * Puts a detached operation in place of {@code existing}, which is detached.
     */
    public void replace(Operation existing, Operation replacement) {
        int pos = indexOf(existing);
        if (replacement.parentBlock() != null) {
            throw new IllegalStateException(replacement.name() + " already belongs to a block");
        }
        operations.set(pos, replacement);
        replacement.setParentBlock(this);
        existing.setParentBlock(null);
    }

    public Region parentRegion() {
        return parent;
    }

    void setParentRegion(Region region) {
        this.parent = region;
    }

    private int indexOf(Operation op) {
        for (int i = 0; i < operations.size(); i++) {
            if (operations.get(i) == op) {
                return i;
            }
        }
        throw new IllegalArgumentException(op.name() + " is not in this block");
    }
}
