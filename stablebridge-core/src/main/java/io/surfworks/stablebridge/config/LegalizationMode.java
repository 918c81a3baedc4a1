package io.surfworks.stablebridge.config;

/**
 * How the legalization pass treats operations it could not convert.
 */
public enum LegalizationMode {
    /** Leave unconvertible operations in place and report them. */
    PARTIAL,
    /** Fail the pass if any StableHLO operation is left. */
    FULL;

    /**
     * Parses a mode name, ignoring case.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static LegalizationMode fromString(String value) {
        for (LegalizationMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown legalization mode: " + value);
    }
}
