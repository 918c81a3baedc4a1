package io.surfworks.stablebridge.legalize;

import java.util.List;

/**
 * Exception thrown when a full legalization leaves StableHLO operations behind.
 *
 * <p>Operations converted before the failure stay converted.
 */
public class LegalizationException extends RuntimeException {

    private final List<String> remainingOperations;

    public LegalizationException(List<String> remainingOperations) {
        super(String.format("Failed to legalize %d operation(s): %s",
                remainingOperations.size(), remainingOperations));
        this.remainingOperations = List.copyOf(remainingOperations);
    }

    /**
     * Returns the names of the operations left unconverted, in program order.
     */
    public List<String> getRemainingOperations() {
        return remainingOperations;
    }
}
