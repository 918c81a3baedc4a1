package io.surfworks.stablebridge.dialect.mhlo;

import java.util.Optional;

import io.surfworks.stablebridge.ir.SymbolicEnum;

/**
 * Closed symbol sets of the MHLO dialect.
 *
 * <p>Canonical symbols are the constant names. They are compared by name
 * against the other dialect's symbols, so renaming a constant changes the
 * vocabulary.
 */
public final class MhloEnums {

    private MhloEnums() {}

    /** Direction of an elementwise comparison. */
    public enum ComparisonDirection implements SymbolicEnum {
        EQ, NE, GE, GT, LE, LT;

        @Override
        public String stringify() {
            return name();
        }

        public static Optional<ComparisonDirection> symbolize(String symbol) {
            return SymbolicEnum.symbolize(ComparisonDirection.class, symbol);
        }
    }

    /** Ordering used by a comparison. */
    public enum ComparisonType implements SymbolicEnum {
        NOTYPE, FLOAT, TOTALORDER, SIGNED, UNSIGNED;

        @Override
        public String stringify() {
            return name();
        }

        public static Optional<ComparisonType> symbolize(String symbol) {
            return SymbolicEnum.symbolize(ComparisonType.class, symbol);
        }
    }

    /** Calling convention of a custom call target. */
    public enum CustomCallApiVersion implements SymbolicEnum {
        API_VERSION_UNSPECIFIED, API_VERSION_ORIGINAL, API_VERSION_STATUS_RETURNING, API_VERSION_STATUS_RETURNING_UNIFIED;

        @Override
        public String stringify() {
            return name();
        }

        public static Optional<CustomCallApiVersion> symbolize(String symbol) {
            return SymbolicEnum.symbolize(CustomCallApiVersion.class, symbol);
        }
    }

    /** Variant of a fast Fourier transform. */
    public enum FftType implements SymbolicEnum {
        FFT, IFFT, RFFT, IRFFT;

        @Override
        public String stringify() {
            return name();
        }

        public static Optional<FftType> symbolize(String symbol) {
            return SymbolicEnum.symbolize(FftType.class, symbol);
        }
    }

    /** Precision configuration of dot and convolution operands. */
    public enum Precision implements SymbolicEnum {
        DEFAULT, HIGH, HIGHEST, PACKED_NIBBLE;

        @Override
        public String stringify() {
            return name();
        }

        public static Optional<Precision> symbolize(String symbol) {
            return SymbolicEnum.symbolize(Precision.class, symbol);
        }
    }

    /** Bit generator algorithm. */
    public enum RngAlgorithm implements SymbolicEnum {
        DEFAULT, THREE_FRY, PHILOX;

        @Override
        public String stringify() {
            return name();
        }

        public static Optional<RngAlgorithm> symbolize(String symbol) {
            return SymbolicEnum.symbolize(RngAlgorithm.class, symbol);
        }
    }

    /** Distribution sampled by rng. */
    public enum RngDistribution implements SymbolicEnum {
        UNIFORM, NORMAL;

        @Override
        public String stringify() {
            return name();
        }

        public static Optional<RngDistribution> symbolize(String symbol) {
            return SymbolicEnum.symbolize(RngDistribution.class, symbol);
        }
    }

    /** Transpose applied to the matrix of a triangular solve. */
    public enum Transpose implements SymbolicEnum {
        TRANSPOSE_INVALID, NO_TRANSPOSE, TRANSPOSE, ADJOINT;

        @Override
        public String stringify() {
            return name();
        }

        public static Optional<Transpose> symbolize(String symbol) {
            return SymbolicEnum.symbolize(Transpose.class, symbol);
        }
    }
}
