package com.setupbrain.feature;

import lombok.Builder;
import lombok.Value;

/**
 * Lookback periods for the feature engine. Loaded from {@code brain.features.*}.
 */
@Value
@Builder
public class FeatureParameters {

    /** Candles in the mean true range used as the volatility proxy. */
    @Builder.Default
    int volatilityPeriod = 20;

    @Builder.Default
    int fastMaPeriod = 20;

    @Builder.Default
    int slowMaPeriod = 50;

    @Builder.Default
    int trendMaPeriod = 200;

    /** Candles scanned for the recent high and low. */
    @Builder.Default
    int rangeLookback = 20;

    /** Number of prior volatility values handed to the detector. */
    @Builder.Default
    int historyLength = 20;

    /** Minimum window size: the longest configured lookback. */
    public int getRequiredCandles() {
        int longest = Math.max(volatilityPeriod, rangeLookback);
        longest = Math.max(longest, fastMaPeriod);
        longest = Math.max(longest, slowMaPeriod);
        return Math.max(longest, trendMaPeriod);
    }

    public void validate() {
        if (volatilityPeriod < 1 || fastMaPeriod < 1 || slowMaPeriod < 1 || trendMaPeriod < 1 || rangeLookback < 1) {
            throw new IllegalStateException("brain.features periods must be positive: " + this);
        }
        if (historyLength < 2) {
            throw new IllegalStateException("brain.features.history-length must be at least 2, was " + historyLength);
        }
        if (!(fastMaPeriod < slowMaPeriod && slowMaPeriod < trendMaPeriod)) {
            throw new IllegalStateException("brain.features moving averages must satisfy fast < slow < trend: " + this);
        }
    }
}
