package com.setupbrain.detect;

import com.setupbrain.domain.enums.ConfidenceTier;
import com.setupbrain.domain.enums.TradeDirection;
import com.setupbrain.domain.vo.FeatureSet;
import com.setupbrain.domain.vo.SetupCandidate;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Shared candidate construction for the detector rules.
 */
abstract class AbstractSetupRule implements SetupRule {

    protected final DetectionThresholds thresholds;

    protected AbstractSetupRule(DetectionThresholds thresholds) {
        this.thresholds = thresholds;
    }

    protected Optional<SetupCandidate> candidate(
            FeatureSet features,
            Instant detectedAt,
            ConfidenceTier confidence,
            TradeDirection direction,
            String context) {
        return Optional.of(SetupCandidate.builder()
                .symbol(features.getSymbol())
                .timeframe(features.getTimeframe())
                .setupType(getSetupType())
                .confidence(confidence)
                .direction(direction)
                .context(context)
                .detectedAt(detectedAt)
                .features(features)
                .build());
    }

    /** Momentum direction: above the fast MA reads as LONG, below as SHORT. */
    protected static TradeDirection momentumDirection(FeatureSet features) {
        return features.getDistanceFromFastMaPct() >= 0 ? TradeDirection.LONG : TradeDirection.SHORT;
    }

    protected static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }
}
