package com.setupbrain.detect;

import lombok.Builder;
import lombok.Value;

/**
 * Named thresholds for the detector rules. Loaded from {@code brain.detection.*}.
 * Ratios are multiples of a volatility reference; percents are price distances.
 */
@Value
@Builder
public class DetectionThresholds {

    @Builder.Default
    double volatilityExpansionRatio = 2.0;

    @Builder.Default
    double volatilityExpansionHighRatio = 3.0;

    @Builder.Default
    double rangeProximityPercent = 2.0;

    @Builder.Default
    double rangeBreakVolatilityRatio = 1.5;

    @Builder.Default
    double fastMaDistancePercent = 5.0;

    @Builder.Default
    double slowMaDistancePercent = 8.0;

    /** Compressed volatility must sit below this multiple of the reference. */
    @Builder.Default
    double compressionRatio = 0.7;

    @Builder.Default
    double compressionBreakoutRatio = 1.5;

    @Builder.Default
    double compressionBreakoutHighRatio = 2.0;

    public void validate() {
        if (volatilityExpansionHighRatio < volatilityExpansionRatio) {
            throw new IllegalStateException("brain.detection.volatility-expansion-high-ratio must be >= volatility-expansion-ratio");
        }
        if (compressionBreakoutHighRatio < compressionBreakoutRatio) {
            throw new IllegalStateException("brain.detection.compression-breakout-high-ratio must be >= compression-breakout-ratio");
        }
        if (compressionRatio <= 0 || compressionRatio >= 1) {
            throw new IllegalStateException("brain.detection.compression-ratio must be in (0, 1), was " + compressionRatio);
        }
        if (rangeProximityPercent <= 0 || fastMaDistancePercent <= 0 || slowMaDistancePercent <= 0) {
            throw new IllegalStateException("brain.detection percent thresholds must be positive");
        }
    }
}
