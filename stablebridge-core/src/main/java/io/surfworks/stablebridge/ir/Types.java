package io.surfworks.stablebridge.ir;

import java.util.List;
import java.util.Objects;

/**
 * Builtin types: scalars, tensors, tuples and functions.
 */
public final class Types {

    /** Marker for a dynamic dimension in a {@link RankedTensorType} shape. */
    public static final long DYNAMIC = -1;

    private Types() {}

    /**
     * Scalar element types: f32, f64, i32, i64, etc.
     */
    public record ScalarType(String name) implements Type {
        public static final ScalarType F16 = new ScalarType("f16");
        public static final ScalarType F32 = new ScalarType("f32");
        public static final ScalarType F64 = new ScalarType("f64");
        public static final ScalarType BF16 = new ScalarType("bf16");
        public static final ScalarType I1 = new ScalarType("i1");
        public static final ScalarType I8 = new ScalarType("i8");
        public static final ScalarType I16 = new ScalarType("i16");
        public static final ScalarType I32 = new ScalarType("i32");
        public static final ScalarType I64 = new ScalarType("i64");
        public static final ScalarType UI32 = new ScalarType("ui32");
        public static final ScalarType UI64 = new ScalarType("ui64");
        public static final ScalarType INDEX = new ScalarType("index");

        public ScalarType {
            Objects.requireNonNull(name, "name cannot be null");
        }

        @Override
        public String dialect() {
            return Namespaces.BUILTIN;
        }

        @Override
        public String toMlirString() {
            return name;
        }
    }

    /**
     * Ranked tensor type: {@code tensor<4x?xf32, #encoding>}.
     *
     * @param shape dimension sizes, {@link Types#DYNAMIC} for unknown
     * @param elementType the element type
     * @param encoding optional encoding attribute, may be null
     */
    public record RankedTensorType(List<Long> shape, Type elementType, Attribute encoding) implements Type {

        public RankedTensorType {
            shape = List.copyOf(shape);
            Objects.requireNonNull(elementType, "elementType cannot be null");
        }

        public RankedTensorType(List<Long> shape, Type elementType) {
            this(shape, elementType, null);
        }

        @Override
        public String dialect() {
            return Namespaces.BUILTIN;
        }

        @Override
        public String toMlirString() {
            StringBuilder sb = new StringBuilder("tensor<");
            for (long d : shape) {
                sb.append(d == DYNAMIC ? "?" : String.valueOf(d)).append("x");
            }
            sb.append(elementType.toMlirString());
            if (encoding != null) {
                sb.append(", ").append(encoding.toMlirString());
            }
            return sb.append(">").toString();
        }
    }

    /**
     * Unranked tensor type: {@code tensor<*xf32>}.
     */
    public record UnrankedTensorType(Type elementType) implements Type {

        public UnrankedTensorType {
            Objects.requireNonNull(elementType, "elementType cannot be null");
        }

        @Override
        public String dialect() {
            return Namespaces.BUILTIN;
        }

        @Override
        public String toMlirString() {
            return "tensor<*x" + elementType.toMlirString() + ">";
        }
    }

    /**
     * Tuple type: {@code tuple<tensor<f32>, !stablehlo.token>}.
     */
    public record TupleType(List<Type> types) implements Type {

        public TupleType {
            types = List.copyOf(types);
        }

        public int size() {
            return types.size();
        }

        @Override
        public String dialect() {
            return Namespaces.BUILTIN;
        }

        @Override
        public String toMlirString() {
            return "tuple<" + join(types) + ">";
        }
    }

    /**
     * Function type: {@code (tensor<...>, tensor<...>) -> (tensor<...>)}.
     */
    public record FunctionType(List<Type> inputTypes, List<Type> resultTypes) implements Type {

        public FunctionType {
            inputTypes = List.copyOf(inputTypes);
            resultTypes = List.copyOf(resultTypes);
        }

        @Override
        public String dialect() {
            return Namespaces.BUILTIN;
        }

        @Override
        public String toMlirString() {
            return "(" + join(inputTypes) + ") -> (" + join(resultTypes) + ")";
        }
    }

    static String join(List<Type> types) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < types.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(types.get(i).toMlirString());
        }
        return sb.toString();
    }
}
