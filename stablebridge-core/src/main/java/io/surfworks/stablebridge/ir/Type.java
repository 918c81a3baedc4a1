package io.surfworks.stablebridge.ir;

/**
 * Base interface for all IR types.
 *
 * <p>Builtin types live in {@link Types}; dialects contribute their own
 * (for example {@code stablehlo.token}).
 */
public interface Type {

    /**
     * Returns the namespace of the dialect that owns this type.
     */
    String dialect();

    String toMlirString();
}
