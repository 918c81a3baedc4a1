package io.surfworks.stablebridge.dialect.mhlo;

import io.surfworks.stablebridge.ir.OpKind;

/**
 * Every operation kind of the MHLO dialect.
 *
 * <p>MHLO is a superset of StableHLO: each StableHLO kind has a same-named
 * counterpart here, plus XLA-specific kinds such as {@link #FUSION}.
 */
public enum MhloOpKind implements OpKind {
    ABS("abs"),
    ADD("add"),
    ADD_DEPENDENCY("add_dependency"),
    AFTER_ALL("after_all"),
    ALL_GATHER("all_gather"),
    ALL_REDUCE("all_reduce", 1),
    ALL_TO_ALL("all_to_all"),
    AND("and"),
    ASYNC_DONE("async_done"),
    ASYNC_START("async_start", 1),
    ASYNC_UPDATE("async_update"),
    ATAN2("atan2"),
    BATCH_NORM_GRAD("batch_norm_grad"),
    BATCH_NORM_INFERENCE("batch_norm_inference"),
    BATCH_NORM_TRAINING("batch_norm_training"),
    BITCAST("bitcast"),
    BITCAST_CONVERT("bitcast_convert"),
    BROADCAST("broadcast"),
    BROADCAST_IN_DIM("broadcast_in_dim"),
    CASE("case", VARIADIC_REGIONS),
    CBRT("cbrt"),
    CEIL("ceil"),
    CHOLESKY("cholesky"),
    CLAMP("clamp"),
    COLLECTIVE_PERMUTE("collective_permute"),
    COMPARE("compare"),
    COMPLEX("complex"),
    COMPUTE_RESHAPE_SHAPE("compute_reshape_shape"),
    CONCATENATE("concatenate"),
    CONSTANT("constant"),
    CONVERT("convert"),
    CONVOLUTION("convolution"),
    COPY("copy"),
    COSINE("cosine"),
    COUNT_LEADING_ZEROS("count_leading_zeros"),
    CREATE_TOKEN("create_token"),
    CROSS_REPLICA_SUM("cross-replica-sum"),
    CSTR_RESHAPABLE("cstr_reshapable"),
    CUSTOM_CALL("custom_call"),
    DIVIDE("divide"),
    DOMAIN("domain"),
    DOT("dot"),
    DOT_GENERAL("dot_general"),
    DYNAMIC_BROADCAST_IN_DIM("dynamic_broadcast_in_dim"),
    DYNAMIC_CONV("dynamic_conv"),
    DYNAMIC_GATHER("dynamic_gather"),
    DYNAMIC_IOTA("dynamic_iota"),
    DYNAMIC_PAD("dynamic_pad"),
    DYNAMIC_RESHAPE("dynamic_reshape"),
    DYNAMIC_SLICE("dynamic_slice"),
    DYNAMIC_UPDATE_SLICE("dynamic_update_slice"),
    EINSUM("einsum"),
    EXPONENTIAL("exponential"),
    EXPONENTIAL_MINUS_ONE("exponential_minus_one"),
    FFT("fft"),
    FLOOR("floor"),
    FUSION("fusion", 1),
    GATHER("gather"),
    GET_DIMENSION_SIZE("get_dimension_size"),
    GET_TUPLE_ELEMENT("get_tuple_element"),
    IF("if", 2),
    IMAG("imag"),
    INFEED("infeed"),
    IOTA("iota"),
    IS_FINITE("is_finite"),
    LOG("log"),
    LOGISTIC("logistic"),
    LOG_PLUS_ONE("log_plus_one"),
    MAP("map", 1),
    MAXIMUM("maximum"),
    MINIMUM("minimum"),
    MULTIPLY("multiply"),
    NEGATE("negate"),
    NOT("not"),
    OPTIMIZATION_BARRIER("optimization_barrier"),
    OR("or"),
    OUTFEED("outfeed"),
    PAD("pad"),
    PARTITION_ID("partition_id"),
    POPCNT("popcnt"),
    POWER("power"),
    REAL("real"),
    REAL_DYNAMIC_SLICE("real_dynamic_slice"),
    RECV("recv"),
    REDUCE("reduce", 1),
    REDUCE_PRECISION("reduce_precision"),
    REDUCE_SCATTER("reduce_scatter", 1),
    REDUCE_WINDOW("reduce_window", 1),
    REMAINDER("remainder"),
    REPLICA_ID("replica_id"),
    RESHAPE("reshape"),
    RETURN("return"),
    REVERSE("reverse"),
    RNG("rng"),
    RNG_BIT_GENERATOR("rng_bit_generator"),
    ROUND_NEAREST_AFZ("round_nearest_afz"),
    ROUND_NEAREST_EVEN("round_nearest_even"),
    RSQRT("rsqrt"),
    SCATTER("scatter", 1),
    SELECT("select"),
    SELECT_AND_SCATTER("select_and_scatter", 2),
    SEND("send"),
    SET_DIMENSION_SIZE("set_dimension_size"),
    SHIFT_LEFT("shift_left"),
    SHIFT_RIGHT_ARITHMETIC("shift_right_arithmetic"),
    SHIFT_RIGHT_LOGICAL("shift_right_logical"),
    SIGN("sign"),
    SINE("sine"),
    SLICE("slice"),
    SORT("sort", 1),
    SQRT("sqrt"),
    STOCHASTIC_CONVERT("stochastic_convert"),
    SUBTRACT("subtract"),
    TANH("tanh"),
    TOPK("topk"),
    TORCH_INDEX_SELECT("torch_index_select"),
    TRACE("trace"),
    TRANSPOSE("transpose"),
    TRIANGULAR_SOLVE("triangular_solve"),
    TUPLE("tuple"),
    UNARY_EINSUM("unary_einsum"),
    UNIFORM_DEQUANTIZE("uniform_dequantize"),
    UNIFORM_QUANTIZE("uniform_quantize"),
    WHILE("while", 2),
    XLA_RNG_GET_AND_UPDATE_STATE("xla.rng_get_and_update_state"),
    XOR("xor");

    private final String mnemonic;
    private final int regionCount;

    MhloOpKind(String mnemonic) {
        this(mnemonic, 0);
    }

    MhloOpKind(String mnemonic, int regionCount) {
        this.mnemonic = mnemonic;
        this.regionCount = regionCount;
    }

    @Override
    public String dialect() {
        return MhloDialect.NAMESPACE;
    }

    @Override
    public String mnemonic() {
        return mnemonic;
    }

    @Override
    public int regionCount() {
        return regionCount;
    }
}
