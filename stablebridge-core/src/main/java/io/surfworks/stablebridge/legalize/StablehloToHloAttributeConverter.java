package io.surfworks.stablebridge.legalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import io.surfworks.stablebridge.dialect.mhlo.MhloAttributes;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes.ChannelHandleAttr;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes.ComparisonDirectionAttr;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes.ComparisonTypeAttr;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes.ConvDimensionNumbersAttr;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes.CustomCallApiVersionAttr;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes.DotDimensionNumbersAttr;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes.FftTypeAttr;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes.GatherDimensionNumbersAttr;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes.PrecisionAttr;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes.RngAlgorithmAttr;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes.RngDistributionAttr;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes.ScatterDimensionNumbersAttr;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes.StablehloAttribute;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloAttributes.TransposeAttr;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloDialect;
import io.surfworks.stablebridge.ir.Attribute;
import io.surfworks.stablebridge.ir.EnumAttribute;
import io.surfworks.stablebridge.ir.SymbolicEnum;
import io.surfworks.stablebridge.ir.Attributes.ArrayAttr;

/**
 * Converts attribute values from the StableHLO vocabulary to the MHLO one.
 *
 * <p>Checked in this order, first match wins:
 * <ol>
 *   <li>StableHLO channel handles, enums and dimension numbers are rebuilt as
 *       their MHLO counterparts, field by field. Enums convert by name and
 *       fail if MHLO has no symbol of that name.</li>
 *   <li>Any other attribute owned by StableHLO fails.</li>
 *   <li>Arrays are converted element by element; one failing element fails
 *       the whole array.</li>
 *   <li>Everything else is returned unchanged.</li>
 * </ol>
 *
 * <p>Arrays come after the dialect-specific shapes because their elements may
 * themselves be StableHLO attributes.
 */
public final class StablehloToHloAttributeConverter {

    private static final Logger LOG = Logger.getLogger(StablehloToHloAttributeConverter.class.getName());

    /**
     * Converts one attribute.
     *
     * @param attr the attribute to convert
     * @return the MHLO equivalent, {@code attr} itself if it needs no
     *         conversion, or empty if it cannot be converted
     */
    public Optional<Attribute> convert(Attribute attr) {
        if (attr instanceof StablehloAttribute stablehloAttr) {
            return convertStablehlo(stablehloAttr);
        }
        if (StablehloDialect.NAMESPACE.equals(attr.dialect())) {
            return unhandled(attr);
        }
        if (attr instanceof ArrayAttr array) {
            return convertArray(array);
        }
        return Optional.of(attr);
    }

    private Optional<Attribute> convertStablehlo(StablehloAttribute attr) {
        return switch (attr.kind()) {
            case CHANNEL_HANDLE -> Optional.of(convertChannelHandle((ChannelHandleAttr) attr));
            case COMPARISON_DIRECTION -> convertEnum(EnumCodecs.COMPARISON_DIRECTION,
                    (ComparisonDirectionAttr) attr);
            case COMPARISON_TYPE -> convertEnum(EnumCodecs.COMPARISON_TYPE, (ComparisonTypeAttr) attr);
            case CONV_DIMENSION_NUMBERS -> Optional.of(convertConv((ConvDimensionNumbersAttr) attr));
            case CUSTOM_CALL_API_VERSION -> convertEnum(EnumCodecs.CUSTOM_CALL_API_VERSION,
                    (CustomCallApiVersionAttr) attr);
            case DOT_DIMENSION_NUMBERS -> Optional.of(convertDot((DotDimensionNumbersAttr) attr));
            case FFT_TYPE -> convertEnum(EnumCodecs.FFT_TYPE, (FftTypeAttr) attr);
            case GATHER_DIMENSION_NUMBERS -> Optional.of(convertGather((GatherDimensionNumbersAttr) attr));
            case PRECISION -> convertEnum(EnumCodecs.PRECISION, (PrecisionAttr) attr);
            case RNG_ALGORITHM -> convertEnum(EnumCodecs.RNG_ALGORITHM, (RngAlgorithmAttr) attr);
            case RNG_DISTRIBUTION -> convertEnum(EnumCodecs.RNG_DISTRIBUTION, (RngDistributionAttr) attr);
            case SCATTER_DIMENSION_NUMBERS -> Optional.of(convertScatter((ScatterDimensionNumbersAttr) attr));
            case TRANSPOSE -> convertEnum(EnumCodecs.TRANSPOSE, (TransposeAttr) attr);
            // Only meaningful as a tensor encoding, handled by the type converter.
            case TYPE_EXTENSIONS -> unhandled(attr);
        };
    }

    private static <S extends Enum<S> & SymbolicEnum>
            Optional<Attribute> convertEnum(EnumCodec<S, ?> codec,
                                            EnumAttribute<S> attr) {
        Optional<Attribute> converted = codec.convertAttribute(attr);
        if (converted.isEmpty()) {
            LOG.fine("No MHLO " + codec.name() + " named " + attr.value().stringify());
        }
        return converted;
    }

    private static Attribute convertChannelHandle(ChannelHandleAttr attr) {
        return new MhloAttributes.ChannelHandleAttr(attr.handle(), attr.type());
    }

    private static Attribute convertConv(ConvDimensionNumbersAttr attr) {
        return new MhloAttributes.ConvDimensionNumbersAttr(
                attr.inputBatchDimension(),
                attr.inputFeatureDimension(),
                attr.inputSpatialDimensions(),
                attr.kernelInputFeatureDimension(),
                attr.kernelOutputFeatureDimension(),
                attr.kernelSpatialDimensions(),
                attr.outputBatchDimension(),
                attr.outputFeatureDimension(),
                attr.outputSpatialDimensions());
    }

    private static Attribute convertDot(DotDimensionNumbersAttr attr) {
        return new MhloAttributes.DotDimensionNumbersAttr(
                attr.lhsBatchingDimensions(),
                attr.rhsBatchingDimensions(),
                attr.lhsContractingDimensions(),
                attr.rhsContractingDimensions());
    }

    private static Attribute convertGather(GatherDimensionNumbersAttr attr) {
        return new MhloAttributes.GatherDimensionNumbersAttr(
                attr.offsetDims(),
                attr.collapsedSliceDims(),
                attr.startIndexMap(),
                attr.indexVectorDim());
    }

    private static Attribute convertScatter(ScatterDimensionNumbersAttr attr) {
        return new MhloAttributes.ScatterDimensionNumbersAttr(
                attr.updateWindowDims(),
                attr.insertedWindowDims(),
                attr.scatterDimsToOperandDims(),
                attr.indexVectorDim());
    }

    private Optional<Attribute> convertArray(ArrayAttr array) {
        List<Attribute> converted = new ArrayList<>(array.size());
        for (Attribute element : array.values()) {
            Optional<Attribute> result = convert(element);
            if (result.isEmpty()) {
                return Optional.empty();
            }
            converted.add(result.get());
        }
        return Optional.of(new ArrayAttr(converted));
    }

    private static Optional<Attribute> unhandled(Attribute attr) {
        // Every StableHLO attribute should have an MHLO counterpart; reaching
        // this means the two vocabularies drifted.
        LOG.warning("Unhandled StableHLO attribute: " + attr.toMlirString());
        return Optional.empty();
    }
}
