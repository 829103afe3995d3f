package com.setupbrain.detect;

import com.setupbrain.domain.enums.ConfidenceTier;
import com.setupbrain.domain.enums.SetupType;
import com.setupbrain.domain.vo.FeatureSet;
import com.setupbrain.domain.vo.SetupCandidate;
import java.time.Instant;
import java.util.Optional;

/**
 * Fires when the close has run away from the fast MA by more than
 * {@code fastMaDistancePercent} or from the slow MA by more than
 * {@code slowMaDistancePercent}. The slow-MA condition alone is enough for HIGH.
 */
public class TrendAccelerationRule extends AbstractSetupRule {

    public TrendAccelerationRule(DetectionThresholds thresholds) {
        super(thresholds);
    }

    @Override
    public SetupType getSetupType() {
        return SetupType.TREND_ACCELERATION;
    }

    @Override
    public Optional<SetupCandidate> evaluate(FeatureSet features, Instant detectedAt) {
        double fastDistance = features.getDistanceFromFastMaPct();
        double slowDistance = features.getDistanceFromSlowMaPct();
        boolean fastTriggered = Math.abs(fastDistance) > thresholds.getFastMaDistancePercent();
        boolean slowTriggered = Math.abs(slowDistance) > thresholds.getSlowMaDistancePercent();
        if (!fastTriggered && !slowTriggered) {
            return Optional.empty();
        }

        return candidate(
                features,
                detectedAt,
                slowTriggered ? ConfidenceTier.HIGH : ConfidenceTier.MEDIUM,
                momentumDirection(features),
                format("Trend accelerating: %+.2f%% from fast MA, %+.2f%% from slow MA", fastDistance, slowDistance));
    }
}
