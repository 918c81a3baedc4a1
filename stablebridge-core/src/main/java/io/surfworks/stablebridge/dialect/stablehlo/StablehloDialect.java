package io.surfworks.stablebridge.dialect.stablehlo;

/**
 * The StableHLO dialect: a versioned, portable opset for ML compilers.
 */
public final class StablehloDialect {

    public static final String NAMESPACE = "stablehlo";

    private StablehloDialect() {}
}
