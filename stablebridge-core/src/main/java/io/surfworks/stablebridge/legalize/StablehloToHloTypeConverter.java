package io.surfworks.stablebridge.legalize;

import java.util.Optional;

import io.surfworks.stablebridge.conversion.TypeConverter;
import io.surfworks.stablebridge.dialect.mhlo.MhloAttributes;
import io.surfworks.stablebridge.dialect.mhlo.MhloTypes;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes.TypeExtensionsAttr;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloDialect;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloTypes;
import io.surfworks.stablebridge.ir.Attribute;
import io.surfworks.stablebridge.ir.Type;
import io.surfworks.stablebridge.ir.Types.FunctionType;
import io.surfworks.stablebridge.ir.Types.RankedTensorType;
import io.surfworks.stablebridge.ir.Types.TupleType;
import io.surfworks.stablebridge.ir.Types.UnrankedTensorType;

/**
 * Converts StableHLO types to their MHLO equivalents.
 *
 * <p>{@code !stablehlo.token} becomes {@code !mhlo.token}. Tensors, tuples and
 * function types are converted recursively; a ranked tensor's
 * {@code #stablehlo.type_extensions} encoding becomes
 * {@code #mhlo.type_extensions} with the same bounds. Any other StableHLO
 * type, or StableHLO encoding, cannot be converted. Types of other dialects
 * are returned unchanged.
 */
public final class StablehloToHloTypeConverter implements TypeConverter {

    @Override
    public Optional<Type> convertType(Type type) {
        if (type instanceof StablehloTypes.TokenType) {
            return Optional.of(MhloTypes.TokenType.INSTANCE);
        }
        if (type instanceof RankedTensorType tensor) {
            return convertRankedTensor(tensor);
        }
        if (type instanceof UnrankedTensorType tensor) {
            return convertType(tensor.elementType()).map(UnrankedTensorType::new);
        }
        if (type instanceof TupleType tuple) {
            return convertTypes(tuple.types()).map(TupleType::new);
        }
        if (type instanceof FunctionType function) {
            var inputs = convertTypes(function.inputTypes());
            var results = convertTypes(function.resultTypes());
            if (inputs.isEmpty() || results.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new FunctionType(inputs.get(), results.get()));
        }
        if (StablehloDialect.NAMESPACE.equals(type.dialect())) {
            return Optional.empty();
        }
        return Optional.of(type);
    }

    private Optional<Type> convertRankedTensor(RankedTensorType tensor) {
        Optional<Type> elementType = convertType(tensor.elementType());
        if (elementType.isEmpty()) {
            return Optional.empty();
        }
        Attribute encoding = tensor.encoding();
        if (encoding instanceof TypeExtensionsAttr extensions) {
            encoding = new MhloAttributes.TypeExtensionsAttr(extensions.bounds());
        } else if (encoding != null && StablehloDialect.NAMESPACE.equals(encoding.dialect())) {
            return Optional.empty();
        }
        if (elementType.get() == tensor.elementType() && encoding == tensor.encoding()) {
            return Optional.of(tensor);
        }
        return Optional.of(new RankedTensorType(tensor.shape(), elementType.get(), encoding));
    }
}
