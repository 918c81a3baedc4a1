package io.surfworks.stablebridge.ir;

/**
 * Discriminant identifying what computation an operation performs.
 *
 * <p>Each dialect enumerates its kinds in an enum implementing this interface.
 */
public interface OpKind {

    /** Region count of kinds whose number of regions is chosen per operation. */
    int VARIADIC_REGIONS = -1;

    /**
     * Returns the namespace of the dialect that defines this kind.
     */
    String dialect();

    /**
     * Returns the kind's name within its dialect, e.g. {@code dot_general}.
     */
    String mnemonic();

    /**
     * Returns the fixed number of regions, or {@link #VARIADIC_REGIONS}.
     */
    int regionCount();

    default boolean hasVariadicRegions() {
        return regionCount() == VARIADIC_REGIONS;
    }

    /**
     * Returns the fully qualified name, e.g. {@code stablehlo.dot_general}.
     */
    default String operationName() {
        return dialect() + "." + mnemonic();
    }
}
