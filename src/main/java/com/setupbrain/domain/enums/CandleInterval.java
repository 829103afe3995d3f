package com.setupbrain.domain.enums;

import java.time.Duration;

/**
 * Candle timeframes the brain can evaluate.
 *
 * <p>The suffix is the form used in configuration, in market-data requests and in
 * persisted records (e.g. "4h", "1d").
 */
public enum CandleInterval {
    ONE_HOUR(3_600_000L, "1h"),
    FOUR_HOURS(14_400_000L, "4h"),
    ONE_DAY(86_400_000L, "1d");

    private final long durationMs;
    private final String suffix;

    CandleInterval(long durationMs, String suffix) {
        this.durationMs = durationMs;
        this.suffix = suffix;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public Duration getDuration() {
        return Duration.ofMillis(durationMs);
    }

    public String getSuffix() {
        return suffix;
    }

    /**
     * Resolve a CandleInterval from its suffix string (e.g., "4h" → FOUR_HOURS).
     *
     * @throws IllegalArgumentException if no interval matches the suffix
     */
    public static CandleInterval fromSuffix(String suffix) {
        for (CandleInterval interval : values()) {
            if (interval.suffix.equals(suffix)) {
                return interval;
            }
        }
        throw new IllegalArgumentException("Unknown candle interval suffix: " + suffix);
    }
}
