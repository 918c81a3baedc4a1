package io.surfworks.stablebridge.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builtin attributes, plus {@link OpaqueAttr} for attributes of dialects the
 * IR has no model for.
 */
public final class Attributes {

    private Attributes() {}

    public record IntegerAttr(long value, Type type) implements Attribute {

        public IntegerAttr(long value) {
            this(value, Types.ScalarType.I64);
        }

        @Override
        public String dialect() {
            return Namespaces.BUILTIN;
        }

        @Override
        public String toMlirString() {
            return value + " : " + type.toMlirString();
        }
    }

    public record FloatAttr(double value, Type type) implements Attribute {

        public FloatAttr(double value) {
            this(value, Types.ScalarType.F32);
        }

        @Override
        public String dialect() {
            return Namespaces.BUILTIN;
        }

        @Override
        public String toMlirString() {
            return value + " : " + type.toMlirString();
        }
    }

    public record BoolAttr(boolean value) implements Attribute {
        public static final BoolAttr TRUE = new BoolAttr(true);
        public static final BoolAttr FALSE = new BoolAttr(false);

        @Override
        public String dialect() {
            return Namespaces.BUILTIN;
        }

        @Override
        public String toMlirString() {
            return String.valueOf(value);
        }
    }

    public record StringAttr(String value) implements Attribute {

        public StringAttr {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public String dialect() {
            return Namespaces.BUILTIN;
        }

        @Override
        public String toMlirString() {
            return "\"" + value + "\"";
        }
    }

    public record UnitAttr() implements Attribute {
        public static final UnitAttr INSTANCE = new UnitAttr();

        @Override
        public String dialect() {
            return Namespaces.BUILTIN;
        }

        @Override
        public String toMlirString() {
            return "unit";
        }
    }

    public record TypeAttr(Type value) implements Attribute {
        @Override
        public String dialect() {
            return Namespaces.BUILTIN;
        }

        @Override
        public String toMlirString() {
            return value.toMlirString();
        }
    }

    /**
     * Symbol reference: {@code @callee}.
     */
    public record SymbolRefAttr(String symbol) implements Attribute {
        @Override
        public String dialect() {
            return Namespaces.BUILTIN;
        }

        @Override
        public String toMlirString() {
            return "@" + symbol;
        }
    }

    /**
     * Dense attribute for constants: {@code dense<[1, 2, 3]> : tensor<3xi32>}.
     */
    public record DenseElementsAttr(List<? extends Number> values, Type type) implements Attribute {

        public DenseElementsAttr {
            values = List.copyOf(values);
        }

        @Override
        public String dialect() {
            return Namespaces.BUILTIN;
        }

        @Override
        public String toMlirString() {
            String body = values.size() == 1 ? String.valueOf(values.get(0)) : values.toString();
            return "dense<" + body + "> : " + type.toMlirString();
        }
    }

    /**
     * Ordered list of attributes: {@code [1 : i64, "a"]}.
     */
    public record ArrayAttr(List<Attribute> values) implements Attribute {

        public ArrayAttr {
            values = List.copyOf(values);
        }

        public static ArrayAttr of(Attribute... values) {
            return new ArrayAttr(List.of(values));
        }

        public int size() {
            return values.size();
        }

        public Attribute get(int i) {
            return values.get(i);
        }

        @Override
        public String dialect() {
            return Namespaces.BUILTIN;
        }

        @Override
        public String toMlirString() {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(values.get(i).toMlirString());
            }
            return sb.append("]").toString();
        }
    }

    /**
     * Name to attribute mapping: {@code {a = 1 : i64}}.
     */
    public record DictionaryAttr(Map<String, Attribute> values) implements Attribute {

        public DictionaryAttr {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        @Override
        public String dialect() {
            return Namespaces.BUILTIN;
        }

        @Override
        public String toMlirString() {
            StringBuilder sb = new StringBuilder("{");
            for (Map.Entry<String, Attribute> e : values.entrySet()) {
                if (sb.length() > 1) sb.append(", ");
                sb.append(e.getKey()).append(" = ").append(e.getValue().toMlirString());
            }
            return sb.append("}").toString();
        }
    }

    /**
     * An attribute whose structure is unknown to this IR.
     *
     * <p>It is identified only by its owning dialect and its textual body,
     * e.g. {@code #custom<tag "x">}.
     */
    public record OpaqueAttr(String dialect, String body) implements Attribute {

        public OpaqueAttr {
            Objects.requireNonNull(dialect, "dialect cannot be null");
            Objects.requireNonNull(body, "body cannot be null");
        }

        @Override
        public String toMlirString() {
            return "#" + dialect + "<" + body + ">";
        }
    }
}
