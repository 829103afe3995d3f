package com.setupbrain.detect;

import com.setupbrain.domain.enums.ConfidenceTier;
import com.setupbrain.domain.enums.SetupType;
import com.setupbrain.domain.vo.FeatureSet;
import com.setupbrain.domain.vo.SetupCandidate;
import java.time.Instant;
import java.util.Optional;

/**
 * Fires when current volatility exceeds {@code volatilityExpansionRatio} times its
 * rolling average. HIGH above {@code volatilityExpansionHighRatio}.
 */
public class VolatilityExpansionRule extends AbstractSetupRule {

    public VolatilityExpansionRule(DetectionThresholds thresholds) {
        super(thresholds);
    }

    @Override
    public SetupType getSetupType() {
        return SetupType.VOLATILITY_EXPANSION;
    }

    @Override
    public Optional<SetupCandidate> evaluate(FeatureSet features, Instant detectedAt) {
        double average = features.averageHistoricalVolatility();
        if (average <= 0) {
            return Optional.empty();
        }
        double ratio = features.getVolatility() / average;
        if (ratio <= thresholds.getVolatilityExpansionRatio()) {
            return Optional.empty();
        }

        ConfidenceTier confidence =
                ratio > thresholds.getVolatilityExpansionHighRatio() ? ConfidenceTier.HIGH : ConfidenceTier.MEDIUM;
        return candidate(
                features,
                detectedAt,
                confidence,
                momentumDirection(features),
                format(
                        "Volatility expanding: %.2f%% vs %.2f%% average (%.2fx)",
                        features.getVolatility(),
                        average,
                        ratio));
    }
}
