package com.setupbrain.domain.enums;

/**
 * The named detector rules. {@code storageKey} is the value persisted in the
 * setup_type column and used in the setup identity key.
 */
public enum SetupType {
    VOLATILITY_EXPANSION("volatility_expansion"),
    RANGE_BREAK_ATTEMPT("range_break_attempt"),
    TREND_ACCELERATION("trend_acceleration"),
    COMPRESSION_EXPANSION("compression_expansion");

    private final String storageKey;

    SetupType(String storageKey) {
        this.storageKey = storageKey;
    }

    public String getStorageKey() {
        return storageKey;
    }

    /**
     * Whether the setup describes a clear price structure (a level being tested or a
     * volatility squeeze releasing) rather than a pure momentum reading.
     */
    public boolean isStructural() {
        return this == RANGE_BREAK_ATTEMPT || this == COMPRESSION_EXPANSION;
    }

    public static SetupType fromStorageKey(String storageKey) {
        for (SetupType setupType : values()) {
            if (setupType.storageKey.equals(storageKey)) {
                return setupType;
            }
        }
        throw new IllegalArgumentException("Unknown setup type: " + storageKey);
    }
}
