package io.surfworks.stablebridge.dialect.mhlo;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.surfworks.stablebridge.dialect.mhlo.MhloEnums.ComparisonDirection;
import io.surfworks.stablebridge.dialect.mhlo.MhloEnums.ComparisonType;
import io.surfworks.stablebridge.dialect.mhlo.MhloEnums.CustomCallApiVersion;
import io.surfworks.stablebridge.dialect.mhlo.MhloEnums.FftType;
import io.surfworks.stablebridge.dialect.mhlo.MhloEnums.Precision;
import io.surfworks.stablebridge.dialect.mhlo.MhloEnums.RngAlgorithm;
import io.surfworks.stablebridge.dialect.mhlo.MhloEnums.RngDistribution;
import io.surfworks.stablebridge.dialect.mhlo.MhloEnums.Transpose;
import io.surfworks.stablebridge.ir.Attribute;
import io.surfworks.stablebridge.ir.CompositeAttribute;
import io.surfworks.stablebridge.ir.EnumAttribute;

/**
 * Attributes of the MHLO dialect.
 */
public final class MhloAttributes {

    private MhloAttributes() {}

    /**
     * Base interface for all MHLO attributes.
     */
    public sealed interface MhloAttribute extends Attribute permits
            ChannelHandleAttr, ComparisonDirectionAttr, ComparisonTypeAttr,
            ConvDimensionNumbersAttr, CustomCallApiVersionAttr, DotDimensionNumbersAttr,
            FftTypeAttr, GatherDimensionNumbersAttr, PrecisionAttr, RngAlgorithmAttr,
            RngDistributionAttr, ScatterDimensionNumbersAttr, TransposeAttr, TypeExtensionsAttr {

        @Override
        default String dialect() {
            return MhloDialect.NAMESPACE;
        }
    }

    // ==================== Records ====================

    /**
     * Handle of a send/recv or collective channel.
     */
    public record ChannelHandleAttr(
            long handle,
            long type
    ) implements MhloAttribute, CompositeAttribute {

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("handle", handle);
            fields.put("type", type);
            return fields;
        }

        @Override
        public String toMlirString() {
            return "#mhlo.channel_handle<" + CompositeAttribute.formatFields(fields()) + ">";
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
    ) implements MhloAttribute, CompositeAttribute {

        public ConvDimensionNumbersAttr {
            inputSpatialDimensions = List.copyOf(inputSpatialDimensions);
            kernelSpatialDimensions = List.copyOf(kernelSpatialDimensions);
            outputSpatialDimensions = List.copyOf(outputSpatialDimensions);
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
            return "#mhlo.conv<" + CompositeAttribute.formatFields(fields()) + ">";
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
    ) implements MhloAttribute, CompositeAttribute {

        public DotDimensionNumbersAttr {
            lhsBatchingDimensions = List.copyOf(lhsBatchingDimensions);
            rhsBatchingDimensions = List.copyOf(rhsBatchingDimensions);
            lhsContractingDimensions = List.copyOf(lhsContractingDimensions);
            rhsContractingDimensions = List.copyOf(rhsContractingDimensions);
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
            return "#mhlo.dot<" + CompositeAttribute.formatFields(fields()) + ">";
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
    ) implements MhloAttribute, CompositeAttribute {

        public GatherDimensionNumbersAttr {
            offsetDims = List.copyOf(offsetDims);
            collapsedSliceDims = List.copyOf(collapsedSliceDims);
            startIndexMap = List.copyOf(startIndexMap);
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
            return "#mhlo.gather<" + CompositeAttribute.formatFields(fields()) + ">";
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
    ) implements MhloAttribute, CompositeAttribute {

        public ScatterDimensionNumbersAttr {
            updateWindowDims = List.copyOf(updateWindowDims);
            insertedWindowDims = List.copyOf(insertedWindowDims);
            scatterDimsToOperandDims = List.copyOf(scatterDimsToOperandDims);
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
            return "#mhlo.scatter<" + CompositeAttribute.formatFields(fields()) + ">";
        }
    }

    /**
     * Bounds of dynamic dimensions, used as a ranked tensor encoding.
     */
    public record TypeExtensionsAttr(
            List<Long> bounds
    ) implements MhloAttribute, CompositeAttribute {

        public TypeExtensionsAttr {
            bounds = List.copyOf(bounds);
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("bounds", bounds);
            return fields;
        }

        @Override
        public String toMlirString() {
            return "#mhlo.type_extensions<" + CompositeAttribute.formatFields(fields()) + ">";
        }
    }

    // ==================== Enums ====================

    public record ComparisonDirectionAttr(ComparisonDirection value) implements MhloAttribute, EnumAttribute<ComparisonDirection> {

        public ComparisonDirectionAttr {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public String mnemonic() {
            return "comparison_direction";
        }
    }

    public record ComparisonTypeAttr(ComparisonType value) implements MhloAttribute, EnumAttribute<ComparisonType> {

        public ComparisonTypeAttr {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public String mnemonic() {
            return "comparison_type";
        }
    }

    public record CustomCallApiVersionAttr(CustomCallApiVersion value) implements MhloAttribute, EnumAttribute<CustomCallApiVersion> {

        public CustomCallApiVersionAttr {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public String mnemonic() {
            return "custom_call_api_version";
        }
    }

    public record FftTypeAttr(FftType value) implements MhloAttribute, EnumAttribute<FftType> {

        public FftTypeAttr {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public String mnemonic() {
            return "fft_type";
        }
    }

    public record PrecisionAttr(Precision value) implements MhloAttribute, EnumAttribute<Precision> {

        public PrecisionAttr {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public String mnemonic() {
            return "precision";
        }
    }

    public record RngAlgorithmAttr(RngAlgorithm value) implements MhloAttribute, EnumAttribute<RngAlgorithm> {

        public RngAlgorithmAttr {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public String mnemonic() {
            return "rng_algorithm";
        }
    }

    public record RngDistributionAttr(RngDistribution value) implements MhloAttribute, EnumAttribute<RngDistribution> {

        public RngDistributionAttr {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public String mnemonic() {
            return "rng_distribution";
        }
    }

    public record TransposeAttr(Transpose value) implements MhloAttribute, EnumAttribute<Transpose> {

        public TransposeAttr {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public String mnemonic() {
            return "transpose";
        }
    }
}
