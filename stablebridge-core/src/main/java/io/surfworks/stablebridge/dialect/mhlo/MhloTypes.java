package io.surfworks.stablebridge.dialect.mhlo;

import io.surfworks.stablebridge.ir.Type;

/**
 * Types of the MHLO dialect.
 */
public final class MhloTypes {

    private MhloTypes() {}

    /**
     * {@code !mhlo.token}: orders side-effecting operations.
     */
    public record TokenType() implements Type {
        public static final TokenType INSTANCE = new TokenType();

        @Override
        public String dialect() {
            return MhloDialect.NAMESPACE;
        }

        @Override
        public String toMlirString() {
            return "!mhlo.token";
        }
    }
}
