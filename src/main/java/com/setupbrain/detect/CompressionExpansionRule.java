package com.setupbrain.detect;

import com.setupbrain.domain.enums.ConfidenceTier;
import com.setupbrain.domain.enums.SetupType;
import com.setupbrain.domain.vo.FeatureSet;
import com.setupbrain.domain.vo.SetupCandidate;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Fires when volatility was squeezed and is now releasing.
 *
 * <p>The history is split in two: the older half gives the reference (its mean), the
 * recent half gives the compressed value (its minimum). A squeeze is a compressed
 * value below {@code compressionRatio} times the reference. The release is current
 * volatility above {@code compressionBreakoutRatio} times the compressed value,
 * HIGH above {@code compressionBreakoutHighRatio}.
 */
public class CompressionExpansionRule extends AbstractSetupRule {

    public CompressionExpansionRule(DetectionThresholds thresholds) {
        super(thresholds);
    }

    @Override
    public SetupType getSetupType() {
        return SetupType.COMPRESSION_EXPANSION;
    }

    @Override
    public Optional<SetupCandidate> evaluate(FeatureSet features, Instant detectedAt) {
        List<Double> history = features.getVolatilityHistory();
        if (history == null || history.size() < 2) {
            return Optional.empty();
        }

        int split = history.size() / 2;
        double reference = 0.0;
        for (int i = 0; i < split; i++) {
            reference += history.get(i);
        }
        reference /= split;

        double compressed = Double.MAX_VALUE;
        for (int i = split; i < history.size(); i++) {
            compressed = Math.min(compressed, history.get(i));
        }

        if (reference <= 0 || compressed <= 0 || compressed >= reference * thresholds.getCompressionRatio()) {
            return Optional.empty();
        }
        double current = features.getVolatility();
        if (current <= compressed * thresholds.getCompressionBreakoutRatio()) {
            return Optional.empty();
        }

        ConfidenceTier confidence = current > compressed * thresholds.getCompressionBreakoutHighRatio()
                ? ConfidenceTier.HIGH
                : ConfidenceTier.MEDIUM;
        return candidate(
                features,
                detectedAt,
                confidence,
                momentumDirection(features),
                format(
                        "Compression releasing: squeezed to %.2f%% from %.2f%%, now %.2f%%",
                        compressed,
                        reference,
                        current));
    }
}
