package io.surfworks.stablebridge.legalize;

import java.util.List;

import io.surfworks.stablebridge.dialect.mhlo.MhloAttributes;
import io.surfworks.stablebridge.dialect.mhlo.MhloEnums;
import io.surfworks.stablebridge.dialect.stablehlo.StablehloEnums;

/**
 * The StableHLO to MHLO codec of every enum attribute.
 *
 * <p>These tables are the only place where the two enum vocabularies meet.
 */
public final class EnumCodecs {

    public static final EnumCodec<StablehloEnums.ComparisonDirection, MhloEnums.ComparisonDirection>
            COMPARISON_DIRECTION = new EnumCodec<>("comparison_direction",
                    StablehloEnums.ComparisonDirection.class,
                    MhloEnums.ComparisonDirection::symbolize,
                    MhloAttributes.ComparisonDirectionAttr::new);

    public static final EnumCodec<StablehloEnums.ComparisonType, MhloEnums.ComparisonType>
            COMPARISON_TYPE = new EnumCodec<>("comparison_type",
                    StablehloEnums.ComparisonType.class,
                    MhloEnums.ComparisonType::symbolize,
                    MhloAttributes.ComparisonTypeAttr::new);

    public static final EnumCodec<StablehloEnums.CustomCallApiVersion, MhloEnums.CustomCallApiVersion>
            CUSTOM_CALL_API_VERSION = new EnumCodec<>("custom_call_api_version",
                    StablehloEnums.CustomCallApiVersion.class,
                    MhloEnums.CustomCallApiVersion::symbolize,
                    MhloAttributes.CustomCallApiVersionAttr::new);

    public static final EnumCodec<StablehloEnums.FftType, MhloEnums.FftType>
            FFT_TYPE = new EnumCodec<>("fft_type",
                    StablehloEnums.FftType.class,
                    MhloEnums.FftType::symbolize,
                    MhloAttributes.FftTypeAttr::new);

    public static final EnumCodec<StablehloEnums.Precision, MhloEnums.Precision>
            PRECISION = new EnumCodec<>("precision",
                    StablehloEnums.Precision.class,
                    MhloEnums.Precision::symbolize,
                    MhloAttributes.PrecisionAttr::new);

    public static final EnumCodec<StablehloEnums.RngAlgorithm, MhloEnums.RngAlgorithm>
            RNG_ALGORITHM = new EnumCodec<>("rng_algorithm",
                    StablehloEnums.RngAlgorithm.class,
                    MhloEnums.RngAlgorithm::symbolize,
                    MhloAttributes.RngAlgorithmAttr::new);

    public static final EnumCodec<StablehloEnums.RngDistribution, MhloEnums.RngDistribution>
            RNG_DISTRIBUTION = new EnumCodec<>("rng_distribution",
                    StablehloEnums.RngDistribution.class,
                    MhloEnums.RngDistribution::symbolize,
                    MhloAttributes.RngDistributionAttr::new);

    public static final EnumCodec<StablehloEnums.Transpose, MhloEnums.Transpose>
            TRANSPOSE = new EnumCodec<>("transpose",
                    StablehloEnums.Transpose.class,
                    MhloEnums.Transpose::symbolize,
                    MhloAttributes.TransposeAttr::new);

    private EnumCodecs() {}

    /**
     * Returns every codec, ordered by attribute name.
     */
    public static List<EnumCodec<?, ?>> all() {
        return List.of(COMPARISON_DIRECTION, COMPARISON_TYPE, CUSTOM_CALL_API_VERSION, FFT_TYPE,
                PRECISION, RNG_ALGORITHM, RNG_DISTRIBUTION, TRANSPOSE);
    }
}
