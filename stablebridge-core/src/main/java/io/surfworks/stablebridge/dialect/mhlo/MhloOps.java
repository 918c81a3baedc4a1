package io.surfworks.stablebridge.dialect.mhlo;

import java.util.List;
import java.util.Map;

import io.surfworks.stablebridge.ir.Attribute;
import io.surfworks.stablebridge.ir.Operation;
import io.surfworks.stablebridge.ir.Type;
import io.surfworks.stablebridge.ir.Value;

/**
 * Builders for MHLO operations.
 *
 * <p>Every kind with a fixed number of regions is built through
 * {@link #create}. {@code mhlo.case} carries one region per branch and can
 * only be built through {@link #createCase}, which takes the branch count.
 */
public final class MhloOps {

    private MhloOps() {}

    /**
     * Builds a detached MHLO operation with empty regions.
     *
     * @throws IllegalArgumentException if {@code kind} has a variadic number of regions
     */
    public static Operation create(MhloOpKind kind, List<Type> resultTypes, List<Value> operands,
                                   Map<String, Attribute> attributes) {
        if (kind.hasVariadicRegions()) {
            throw new IllegalArgumentException(kind.operationName()
                    + " has a variadic number of regions; use a dedicated builder");
        }
        return Operation.create(kind, resultTypes, operands, attributes, kind.regionCount());
    }

    /**
     * Builds a detached {@code mhlo.case} with {@code branchCount} empty branch regions.
     */
    public static Operation createCase(List<Type> resultTypes, List<Value> operands,
                                       Map<String, Attribute> attributes, int branchCount) {
        return Operation.create(MhloOpKind.CASE, resultTypes, operands, attributes, branchCount);
    }
}
