package io.surfworks.stablebridge.ir;

/**
 * Base interface for IR attributes.
 *
 * <p>An attribute is an immutable compile-time value attached to an operation
 * by name. Every attribute belongs to exactly one dialect namespace.
 */
public interface Attribute {

    /**
     * Returns the namespace of the dialect that owns this attribute.
     */
    String dialect();

    String toMlirString();
}
