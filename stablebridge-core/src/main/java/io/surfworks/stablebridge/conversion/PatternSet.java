package io.surfworks.stablebridge.conversion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.surfworks.stablebridge.ir.OpKind;

/**
 * Registry of conversion patterns keyed by the operation kind they rewrite.
 *
 * <p>At most one pattern may be registered per kind.
 */
public final class PatternSet {

    private final Map<OpKind, ConversionPattern> patterns = new LinkedHashMap<>();

    /**
     * Registers a pattern.
     *
     * @param pattern the pattern to add
     * @return this set for chaining
     * @throws IllegalStateException if a pattern is already registered for its kind
     */
    public PatternSet add(ConversionPattern pattern) {
        OpKind kind = pattern.rootKind();
        if (patterns.containsKey(kind)) {
            throw new IllegalStateException("Pattern for " + kind.operationName() + " already registered");
        }
        patterns.put(kind, pattern);
        return this;
    }

    public Optional<ConversionPattern> lookup(OpKind kind) {
        return Optional.ofNullable(patterns.get(kind));
    }

    public boolean contains(OpKind kind) {
        return patterns.containsKey(kind);
    }

    /**
     * Returns the registered kinds in registration order.
     */
    public Set<OpKind> kinds() {
        return Collections.unmodifiableSet(patterns.keySet());
    }

    public int size() {
        return patterns.size();
    }

    @Override
    public String toString() {
        return String.format("PatternSet[patterns=%d]", patterns.size());
    }
}
