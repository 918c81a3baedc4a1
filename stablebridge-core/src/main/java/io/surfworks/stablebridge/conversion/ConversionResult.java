package io.surfworks.stablebridge.conversion;

import java.util.List;

import io.surfworks.stablebridge.ir.Operation;

/**
 * Outcome of one {@link ConversionDriver} run.
 *
 * @param converted number of operations replaced
 * @param sweeps number of walks over the program
 * @param illegalRemaining operations still illegal after the run, in program order
 */
public record ConversionResult(int converted, int sweeps, List<Operation> illegalRemaining) {

    public ConversionResult {
        illegalRemaining = List.copyOf(illegalRemaining);
    }

    /**
     * Returns true if no illegal operation is left.
     */
    public boolean isComplete() {
        return illegalRemaining.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("ConversionResult[converted=%d, sweeps=%d, illegal=%d]",
                converted, sweeps, illegalRemaining.size());
    }
}
