package io.surfworks.stablebridge.dialect.mhlo;

/**
 * The MHLO dialect: XLA's in-tree HLO opset.
 */
public final class MhloDialect {

    public static final String NAMESPACE = "mhlo";

    private MhloDialect() {}
}
