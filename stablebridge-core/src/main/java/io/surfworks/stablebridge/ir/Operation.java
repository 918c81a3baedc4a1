package io.surfworks.stablebridge.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A node of the IR: kind, typed results, operand references, named attributes
 * and nested regions.
 *
 * <p>Results are created with the operation and owned by it. Operands are
 * references to values owned elsewhere. Attribute names are unique; the map
 * keeps insertion order for stable printing.
 */
public final class Operation {

    private final OpKind kind;
    private final List<Value> results;
    private final List<Value> operands;
    private final Map<String, Attribute> attributes;
    private final List<Region> regions;
    private Block parent;

    private Operation(OpKind kind, List<Type> resultTypes, List<Value> operands,
                      Map<String, Attribute> attributes, int regionCount) {
        this.kind = kind;
        List<Value> res = new ArrayList<>(resultTypes.size());
        for (int i = 0; i < resultTypes.size(); i++) {
            res.add(Value.result(this, resultTypes.get(i), i));
        }
        this.results = Collections.unmodifiableList(res);
        this.operands = new ArrayList<>(operands);
        this.attributes = new LinkedHashMap<>(attributes);
        List<Region> regs = new ArrayList<>(regionCount);
        for (int i = 0; i < regionCount; i++) {
            regs.add(new Region(this));
        }
        this.regions = Collections.unmodifiableList(regs);
    }

    /**
     * Creates a detached operation with empty regions.
     *
     * @param kind the operation kind
     * @param resultTypes one type per result
     * @param operands operand values, referenced as given
     * @param attributes attributes by name
     * @param regionCount number of regions; must equal the kind's fixed count
     *                    unless the kind has variadic regions
     * @return the new operation
     */
    public static Operation create(OpKind kind, List<Type> resultTypes, List<Value> operands,
                                   Map<String, Attribute> attributes, int regionCount) {
        Objects.requireNonNull(kind, "kind cannot be null");
        if (regionCount < 0) {
            throw new IllegalArgumentException("regionCount cannot be negative: " + regionCount);
        }
        if (!kind.hasVariadicRegions() && kind.regionCount() != regionCount) {
            throw new IllegalArgumentException(String.format(
                    "%s has %d regions, got %d", kind.operationName(), kind.regionCount(), regionCount));
        }
        for (Value operand : operands) {
            Objects.requireNonNull(operand, "operand cannot be null");
        }
        return new Operation(kind, resultTypes, operands, attributes, regionCount);
    }

    /**
     * Creates a detached operation with the kind's fixed number of regions.
     */
    public static Operation create(OpKind kind, List<Type> resultTypes, List<Value> operands,
                                   Map<String, Attribute> attributes) {
        if (kind.hasVariadicRegions()) {
            throw new IllegalArgumentException(kind.operationName() + " needs an explicit region count");
        }
        return create(kind, resultTypes, operands, attributes, kind.regionCount());
    }

    public OpKind kind() {
        return kind;
    }

    /**
     * Returns the fully qualified operation name, e.g. {@code mhlo.add}.
     */
    public String name() {
        return kind.operationName();
    }

    public String dialect() {
        return kind.dialect();
    }

    public List<Value> results() {
        return results;
    }

    public Value result(int index) {
        return results.get(index);
    }

    public List<Type> resultTypes() {
        return results.stream().map(Value::type).toList();
    }

    public List<Value> operands() {
        return Collections.unmodifiableList(operands);
    }

    public Value operand(int index) {
        return operands.get(index);
    }

    public void setOperand(int index, Value value) {
        operands.set(index, Objects.requireNonNull(value, "value cannot be null"));
    }

    public Map<String, Attribute> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Optional<Attribute> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public List<Region> regions() {
        return regions;
    }

    public Region region(int index) {
        return regions.get(index);
    }

    public Block parentBlock() {
        return parent;
    }

    void setParentBlock(Block block) {
        this.parent = block;
    }

    /**
     * Returns the operation whose region contains this one, or null.
     */
    public Operation parentOp() {
        if (parent == null || parent.parentRegion() == null) {
            return null;
        }
        return parent.parentRegion().parentOp();
    }

    /**
     * Visits this operation and every nested operation in pre-order.
     */
    public void walk(Consumer<Operation> visitor) {
        visitor.accept(this);
        for (Region region : regions) {
            for (Block block : List.copyOf(region.blocks())) {
                for (Operation op : List.copyOf(block.operations())) {
                    op.walk(visitor);
                }
            }
        }
    }

    @Override
    public String toString() {
        return String.format("%s[results=%d, operands=%d, attrs=%s, regions=%d]",
                name(), results.size(), operands.size(), attributes.keySet(), regions.size());
    }
}
