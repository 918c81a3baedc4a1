package io.surfworks.stablebridge.legalize;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import io.surfworks.stablebridge.conversion.ConversionPattern;
import io.surfworks.stablebridge.conversion.TypeConverter;
import io.surfworks.stablebridge.ir.Attribute;
import io.surfworks.stablebridge.ir.Attributes.TypeAttr;
import io.surfworks.stablebridge.ir.Block;
import io.surfworks.stablebridge.ir.BuiltinOpKind;
import io.surfworks.stablebridge.ir.OpKind;
import io.surfworks.stablebridge.ir.Operation;
import io.surfworks.stablebridge.ir.Region;
import io.surfworks.stablebridge.ir.Type;
import io.surfworks.stablebridge.ir.Value;

/**
 * Rewrites the signature of a {@code func.func} whose {@code function_type}
 * or entry-block arguments still mention StableHLO types.
 *
 * <p>The replacement carries the converted {@code function_type} and takes
 * over the body. Block arguments are retyped by the driver once the body has
 * moved, so uses inside the body follow the new arguments.
 */
public final class FuncSignatureConverter implements ConversionPattern {

    static final String FUNCTION_TYPE = "function_type";

    private static final Logger LOG = Logger.getLogger(FuncSignatureConverter.class.getName());

    private final TypeConverter typeConverter;

    public FuncSignatureConverter(TypeConverter typeConverter) {
        this.typeConverter = Objects.requireNonNull(typeConverter, "typeConverter cannot be null");
    }

    @Override
    public OpKind rootKind() {
        return BuiltinOpKind.FUNC;
    }

    /**
     * Returns whether the signature of {@code func} is already in the target
     * vocabulary, that is, converting it would change nothing.
     */
    public boolean isSignatureLegal(Operation func) {
        if (func.attribute(FUNCTION_TYPE).orElse(null) instanceof TypeAttr functionType
                && !isUnchanged(functionType.value())) {
            return false;
        }
        return entryArgumentTypes(func).stream().allMatch(this::isUnchanged);
    }

    @Override
    public Optional<Operation> matchAndRewrite(Operation op, List<Value> operands) {
        if (op.kind() != BuiltinOpKind.FUNC) {
            throw new IllegalArgumentException("Expected func.func, got " + op.name());
        }
        if (typeConverter.convertTypes(entryArgumentTypes(op)).isEmpty()) {
            LOG.fine("Cannot convert argument types of " + op.name() + ": " + entryArgumentTypes(op));
            return Optional.empty();
        }

        Map<String, Attribute> attrs = new LinkedHashMap<>(op.attributes());
        if (op.attribute(FUNCTION_TYPE).orElse(null) instanceof TypeAttr functionType) {
            Optional<Type> converted = typeConverter.convertType(functionType.value());
            if (converted.isEmpty()) {
                LOG.fine("Cannot convert function_type of " + op.name() + ": "
                        + functionType.value().toMlirString());
                return Optional.empty();
            }
            attrs.put(FUNCTION_TYPE, new TypeAttr(converted.get()));
        }

        Operation replacement = Operation.create(BuiltinOpKind.FUNC, op.resultTypes(), operands, attrs);
        replacement.region(0).takeBlocks(op.region(0));
        return Optional.of(replacement);
    }

    private boolean isUnchanged(Type type) {
        return typeConverter.convertType(type).map(type::equals).orElse(false);
    }

    private static List<Type> entryArgumentTypes(Operation func) {
        Region body = func.region(0);
        if (body.isEmpty()) {
            return List.of();
        }
        Block entry = body.front();
        return entry.arguments().stream().map(Value::type).toList();
    }
}
