package io.surfworks.stablebridge.dialect.stablehlo;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.surfworks.stablebridge.dialect.stablehlo.StablehloEnums.ComparisonDirection;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloEnums.ComparisonType;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloEnums.CustomCallApiVersion;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloEnums.FftType;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloEnums.Precision;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloEnums.RngAlgorithm;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloEnums.RngDistribution;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloEnums.Transpose;
import io.surfworks.stablebridge.ir.Attribute;
import io.surfworks.stablebridge.ir.CompositeAttribute;
import io.surfworks.stablebridge.ir.EnumAttribute;

/**
 * Attributes of the StableHLO dialect.
 *
 * <p>The hierarchy is sealed and every attribute reports a {@link Kind}, so a
 * {@code switch} over {@link StablehloAttribute#kind()} without a default
 * branch stops compiling when a new attribute is added.
 */
public final class StablehloAttributes {

    private StablehloAttributes() {}

    /**
     * Closed list of StableHLO attribute shapes.
     */
    public enum Kind {
        CHANNEL_HANDLE,
        COMPARISON_DIRECTION,
        COMPARISON_TYPE,
        CONV_DIMENSION_NUMBERS,
        CUSTOM_CALL_API_VERSION,
        DOT_DIMENSION_NUMBERS,
        FFT_TYPE,
        GATHER_DIMENSION_NUMBERS,
        PRECISION,
        RNG_ALGORITHM,
        RNG_DISTRIBUTION,
        SCATTER_DIMENSION_NUMBERS,
        TRANSPOSE,
        TYPE_EXTENSIONS
    }

    /**
     * Base interface for all StableHLO attributes.
     */
    public sealed interface StablehloAttribute extends Attribute permits
            ChannelHandleAttr, ComparisonDirectionAttr, ComparisonTypeAttr,
            ConvDimensionNumbersAttr, CustomCallApiVersionAttr, DotDimensionNumbersAttr,
            FftTypeAttr, GatherDimensionNumbersAttr, PrecisionAttr, RngAlgorithmAttr,
            RngDistributionAttr, ScatterDimensionNumbersAttr, TransposeAttr, TypeExtensionsAttr {

        Kind kind();

        @Override
        default String dialect() {
            return StablehloDialect.NAMESPACE;
        }
    }

    // ==================== Records ====================

    /**
     * Handle of a send/recv or collective channel.
     */
    public record ChannelHandleAttr(
            long handle,
            long type
    ) implements StablehloAttribute, CompositeAttribute {

        @Override
        public Kind kind() {
            return Kind.CHANNEL_HANDLE;
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("handle", handle);
            fields.put("type", type);
            return fields;
        }

        @Override
        public String toMlirString() {
            return "#stablehlo.channel_handle<" + CompositeAttribute.formatFields(fields()) + ">";
        }
    }

    /**
     * Dimension layout of convolution input, kernel and output.
     */
    public record ConvDimensionNumbersAttr(
            long inputBatchDimension,
            long inputFeatureDimension,
            List<Long> inputSpatialDimensions,
            long kernelInputFeatureDimension,
            long kernelOutputFeatureDimension,
            List<Long> kernelSpatialDimensions,
            long outputBatchDimension,
            long outputFeatureDimension,
            List<Long> outputSpatialDimensions
    ) implements StablehloAttribute, CompositeAttribute {

        public ConvDimensionNumbersAttr {
            inputSpatialDimensions = List.copyOf(inputSpatialDimensions);
            kernelSpatialDimensions = List.copyOf(kernelSpatialDimensions);
            outputSpatialDimensions = List.copyOf(outputSpatialDimensions);
        }

        @Override
        public Kind kind() {
            return Kind.CONV_DIMENSION_NUMBERS;
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("input_batch_dimension", inputBatchDimension);
            fields.put("input_feature_dimension", inputFeatureDimension);
            fields.put("input_spatial_dimensions", inputSpatialDimensions);
            fields.put("kernel_input_feature_dimension", kernelInputFeatureDimension);
            fields.put("kernel_output_feature_dimension", kernelOutputFeatureDimension);
            fields.put("kernel_spatial_dimensions", kernelSpatialDimensions);
            fields.put("output_batch_dimension", outputBatchDimension);
            fields.put("output_feature_dimension", outputFeatureDimension);
            fields.put("output_spatial_dimensions", outputSpatialDimensions);
            return fields;
        }

        @Override
        public String toMlirString() {
            return "#stablehlo.conv<" + CompositeAttribute.formatFields(fields()) + ">";
        }
    }

    /**
     * Batching and contracting dimensions of dot_general.
     */
    public record DotDimensionNumbersAttr(
            List<Long> lhsBatchingDimensions,
            List<Long> rhsBatchingDimensions,
            List<Long> lhsContractingDimensions,
            List<Long> rhsContractingDimensions
    ) implements StablehloAttribute, CompositeAttribute {

        public DotDimensionNumbersAttr {
            lhsBatchingDimensions = List.copyOf(lhsBatchingDimensions);
            rhsBatchingDimensions = List.copyOf(rhsBatchingDimensions);
            lhsContractingDimensions = List.copyOf(lhsContractingDimensions);
            rhsContractingDimensions = List.copyOf(rhsContractingDimensions);
        }

        @Override
        public Kind kind() {
            return Kind.DOT_DIMENSION_NUMBERS;
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("lhs_batching_dimensions", lhsBatchingDimensions);
            fields.put("rhs_batching_dimensions", rhsBatchingDimensions);
            fields.put("lhs_contracting_dimensions", lhsContractingDimensions);
            fields.put("rhs_contracting_dimensions", rhsContractingDimensions);
            return fields;
        }

        @Override
        public String toMlirString() {
            return "#stablehlo.dot<" + CompositeAttribute.formatFields(fields()) + ">";
        }
    }

    /**
     * Dimension mapping of gather.
     */
    public record GatherDimensionNumbersAttr(
            List<Long> offsetDims,
            List<Long> collapsedSliceDims,
            List<Long> startIndexMap,
            long indexVectorDim
    ) implements StablehloAttribute, CompositeAttribute {

        public GatherDimensionNumbersAttr {
            offsetDims = List.copyOf(offsetDims);
            collapsedSliceDims = List.copyOf(collapsedSliceDims);
            startIndexMap = List.copyOf(startIndexMap);
        }

        @Override
        public Kind kind() {
            return Kind.GATHER_DIMENSION_NUMBERS;
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("offset_dims", offsetDims);
            fields.put("collapsed_slice_dims", collapsedSliceDims);
            fields.put("start_index_map", startIndexMap);
            fields.put("index_vector_dim", indexVectorDim);
            return fields;
        }

        @Override
        public String toMlirString() {
            return "#stablehlo.gather<" + CompositeAttribute.formatFields(fields()) + ">";
        }
    }

    /**
     * Dimension mapping of scatter.
     */
    public record ScatterDimensionNumbersAttr(
            List<Long> updateWindowDims,
            List<Long> insertedWindowDims,
            List<Long> scatterDimsToOperandDims,
            long indexVectorDim
    ) implements StablehloAttribute, CompositeAttribute {

        public ScatterDimensionNumbersAttr {
            updateWindowDims = List.copyOf(updateWindowDims);
            insertedWindowDims = List.copyOf(insertedWindowDims);
            scatterDimsToOperandDims = List.copyOf(scatterDimsToOperandDims);
        }

        @Override
        public Kind kind() {
            return Kind.SCATTER_DIMENSION_NUMBERS;
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("update_window_dims", updateWindowDims);
            fields.put("inserted_window_dims", insertedWindowDims);
            fields.put("scatter_dims_to_operand_dims", scatterDimsToOperandDims);
            fields.put("index_vector_dim", indexVectorDim);
            return fields;
        }

        @Override
        public String toMlirString() {
            return "#stablehlo.scatter<" + CompositeAttribute.formatFields(fields()) + ">";
        }
    }

    /**
     * Bounds of dynamic dimensions, used as a ranked tensor encoding.
     */
    public record TypeExtensionsAttr(
            List<Long> bounds
    ) implements StablehloAttribute, CompositeAttribute {

        public TypeExtensionsAttr {
            bounds = List.copyOf(bounds);
        }

        @Override
        public Kind kind() {
            return Kind.TYPE_EXTENSIONS;
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("bounds", bounds);
            return fields;
        }

        @Override
        public String toMlirString() {
            return "#stablehlo.type_extensions<" + CompositeAttribute.formatFields(fields()) + ">";
        }
    }

    // ==================== Enums ====================

    public record ComparisonDirectionAttr(ComparisonDirection value) implements StablehloAttribute, EnumAttribute<ComparisonDirection> {

        public ComparisonDirectionAttr {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public Kind kind() {
            return Kind.COMPARISON_DIRECTION;
        }

        @Override
        public String mnemonic() {
            return "comparison_direction";
        }
    }

    public record ComparisonTypeAttr(ComparisonType value) implements StablehloAttribute, EnumAttribute<ComparisonType> {

        public ComparisonTypeAttr {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public Kind kind() {
            return Kind.COMPARISON_TYPE;
        }

        @Override
        public String mnemonic() {
            return "comparison_type";
        }
    }

    public record CustomCallApiVersionAttr(CustomCallApiVersion value) implements StablehloAttribute, EnumAttribute<CustomCallApiVersion> {

        public CustomCallApiVersionAttr {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public Kind kind() {
            return Kind.CUSTOM_CALL_API_VERSION;
        }

        @Override
        public String mnemonic() {
            return "custom_call_api_version";
        }
    }

    public record FftTypeAttr(FftType value) implements StablehloAttribute, EnumAttribute<FftType> {

        public FftTypeAttr {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public Kind kind() {
            return Kind.FFT_TYPE;
        }

        @Override
        public String mnemonic() {
            return "fft_type";
        }
    }

    public record PrecisionAttr(Precision value) implements StablehloAttribute, EnumAttribute<Precision> {

        public PrecisionAttr {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public Kind kind() {
            return Kind.PRECISION;
        }

        @Override
        public String mnemonic() {
            return "precision";
        }
    }

    public record RngAlgorithmAttr(RngAlgorithm value) implements StablehloAttribute, EnumAttribute<RngAlgorithm> {

        public RngAlgorithmAttr {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public Kind kind() {
            return Kind.RNG_ALGORITHM;
        }

        @Override
        public String mnemonic() {
            return "rng_algorithm";
        }
    }

    public record RngDistributionAttr(RngDistribution value) implements StablehloAttribute, EnumAttribute<RngDistribution> {

        public RngDistributionAttr {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public Kind kind() {
            return Kind.RNG_DISTRIBUTION;
        }

        @Override
        public String mnemonic() {
            return "rng_distribution";
        }
    }

    public record TransposeAttr(Transpose value) implements StablehloAttribute, EnumAttribute<Transpose> {

        public TransposeAttr {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public Kind kind() {
            return Kind.TRANSPOSE;
        }

        @Override
        public String mnemonic() {
            return "transpose";
        }
    }
}
