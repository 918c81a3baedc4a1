package io.surfworks.stablebridge.conversion;

import java.util.List;
import java.util.Optional;

import io.surfworks.stablebridge.ir.OpKind;
import io.surfworks.stablebridge.ir.Operation;
import io.surfworks.stablebridge.ir.Value;

/**
 * Rewrites operations of one kind into a replacement operation.
 *
 * <p>Patterns are applied by {@link ConversionDriver}, which supplies the
 * operands already remapped to converted values and installs the replacement.
 */
public interface ConversionPattern {

    /**
     * Returns the operation kind this pattern applies to.
     */
    OpKind rootKind();

    /**
     * Attempts to build the replacement of {@code op}.
     *
     * <p>On failure the pattern must leave {@code op} exactly as it found it.
     * On success the replacement is detached; the driver puts it in place of
     * {@code op}.
     *
     * @param op the operation to rewrite, of kind {@link #rootKind()}
     * @param operands the converted operand values, one per operand of {@code op}
     * @return the replacement, or empty if the operation cannot be rewritten
     */
    Optional<Operation> matchAndRewrite(Operation op, List<Value> operands);
}
