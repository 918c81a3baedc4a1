package io.surfworks.stablebridge.ir;

/**
 * Structural operations that hold dialect code: modules and functions.
 */
public enum BuiltinOpKind implements OpKind {
    MODULE(Namespaces.BUILTIN, "module", 1),
    FUNC(Namespaces.FUNC, "func", 1),
    RETURN(Namespaces.FUNC, "return", 0),
    CALL(Namespaces.FUNC, "call", 0);

    private final String dialect;
    private final String mnemonic;
    private final int regionCount;

    BuiltinOpKind(String dialect, String mnemonic, int regionCount) {
        this.dialect = dialect;
        this.mnemonic = mnemonic;
        this.regionCount = regionCount;
    }

    @Override
    public String dialect() {
        return dialect;
    }

    @Override
    public String mnemonic() {
        return mnemonic;
    }

    @Override
    public int regionCount() {
        return regionCount;
    }
}
