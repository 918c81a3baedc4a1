package io.surfworks.stablebridge.legalize;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import io.surfworks.stablebridge.conversion.ConversionPattern;
import io.surfworks.stablebridge.conversion.TypeConverter;
import io.surfworks.stablebridge.dialect.mhlo.MhloOpKind;
import io.surfworks.stablebridge.dialect.mhlo.MhloOps;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloOpKind;
import io.surfworks.stablebridge.ir.Attribute;
import io.surfworks.stablebridge.ir.OpKind;
import io.surfworks.stablebridge.ir.Operation;
import io.surfworks.stablebridge.ir.Type;
import io.surfworks.stablebridge.ir.Value;

/**
 * Rewrites a StableHLO operation of one kind into its MHLO counterpart.
 *
 * <p>The rewrite is the same for every kind: convert the result types,
 * convert every attribute under its original name, build the MHLO operation
 * from those and the given operands, then move the regions over. Nothing is
 * built and the original is not touched unless every type and attribute
 * converts.
 *
 * <p>{@code stablehlo.case} is the exception: {@code mhlo.case} needs the
 * number of branch regions up front, taken from the original operation.
 */
public final class StablehloToHloOpConverter implements ConversionPattern {

    private static final Logger LOG = Logger.getLogger(StablehloToHloOpConverter.class.getName());

    private final StablehloOpKind kind;
    private final MhloOpKind targetKind;
    private final TypeConverter typeConverter;
    private final StablehloToHloAttributeConverter attributeConverter;

    public StablehloToHloOpConverter(StablehloOpKind kind, TypeConverter typeConverter,
                                     StablehloToHloAttributeConverter attributeConverter) {
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.targetKind = OpKindMapping.toHlo(kind);
        this.typeConverter = Objects.requireNonNull(typeConverter, "typeConverter cannot be null");
        this.attributeConverter = Objects.requireNonNull(attributeConverter, "attributeConverter cannot be null");
    }

    @Override
    public OpKind rootKind() {
        return kind;
    }

    @Override
    public Optional<Operation> matchAndRewrite(Operation op, List<Value> operands) {
        if (op.kind() != kind) {
            throw new IllegalArgumentException("Expected " + kind.operationName() + ", got " + op.name());
        }
        if (operands.size() != op.operands().size()) {
            throw new IllegalArgumentException(String.format(
                    "%s has %d operands, got %d converted operands", op.name(), op.operands().size(), operands.size()));
        }

        Optional<List<Type>> hloTypes = typeConverter.convertTypes(op.resultTypes());
        if (hloTypes.isEmpty()) {
            LOG.fine("Cannot convert result types of " + op.name() + ": " + op.resultTypes());
            return Optional.empty();
        }

        Map<String, Attribute> hloAttrs = new LinkedHashMap<>();
        for (Map.Entry<String, Attribute> entry : op.attributes().entrySet()) {
            Optional<Attribute> hloAttr = attributeConverter.convert(entry.getValue());
            if (hloAttr.isEmpty()) {
                LOG.fine("Cannot convert attribute '" + entry.getKey() + "' of " + op.name());
                return Optional.empty();
            }
            hloAttrs.put(entry.getKey(), hloAttr.get());
        }

        Operation hloOp;
        if (kind == StablehloOpKind.CASE) {
            hloOp = MhloOps.createCase(hloTypes.get(), operands, hloAttrs, op.regions().size());
        } else {
            hloOp = MhloOps.create(targetKind, hloTypes.get(), operands, hloAttrs);
        }

        for (int i = 0; i < op.regions().size(); i++) {
            hloOp.region(i).takeBlocks(op.region(i));
        }
        return Optional.of(hloOp);
    }

    @Override
    public String toString() {
        return "StablehloToHloOpConverter[" + kind.operationName() + " -> " + targetKind.operationName() + "]";
    }
}
