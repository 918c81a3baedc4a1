package io.surfworks.stablebridge.ir;

/**
 * Namespaces of the dialects that ship with the IR itself.
 */
public final class Namespaces {

    public static final String BUILTIN = "builtin";
    public static final String FUNC = "func";

    private Namespaces() {}
}
