package io.surfworks.stablebridge.dialect.stablehlo;

import io.surfworks.stablebridge.ir.Type;

/**
 * Types of the StableHLO dialect.
 */
public final class StablehloTypes {

    private StablehloTypes() {}

    /**
     * {@code !stablehlo.token}: orders side-effecting operations.
     */
    public record TokenType() implements Type {
        public static final TokenType INSTANCE = new TokenType();

        @Override
        public String dialect() {
            return StablehloDialect.NAMESPACE;
        }

        @Override
        public String toMlirString() {
            return "!stablehlo.token";
        }
    }
}
