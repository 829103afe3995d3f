package com.setupbrain.detect;

import com.setupbrain.domain.vo.FeatureSet;
import com.setupbrain.domain.vo.SetupCandidate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs every detector rule against a feature set and collects the candidates.
 *
 * <p>Rule order is fixed (volatility expansion, range-break attempt, trend acceleration,
 * compression/expansion) and every rule is evaluated, so the output for a given
 * feature set and detection time is always the same list in the same order.
 */
@Component
public class SetupDetector {

    private static final Logger log = LoggerFactory.getLogger(SetupDetector.class);

    private final List<SetupRule> rules;

    @Autowired
    public SetupDetector(DetectionThresholds thresholds) {
        this(List.of(
                new VolatilityExpansionRule(thresholds),
                new RangeBreakAttemptRule(thresholds),
                new TrendAccelerationRule(thresholds),
                new CompressionExpansionRule(thresholds)));
    }

    public SetupDetector(List<SetupRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<SetupCandidate> detect(FeatureSet features, Instant detectedAt) {
        List<SetupCandidate> candidates = new ArrayList<>();
        for (SetupRule rule : rules) {
            rule.evaluate(features, detectedAt).ifPresent(candidates::add);
        }
        if (!candidates.isEmpty()) {
            log.debug(
                    "{} {}: {} setup(s) detected {}",
                    features.getSymbol(),
                    features.getTimeframe().getSuffix(),
                    candidates.size(),
                    candidates.stream().map(c -> c.getSetupType().name()).toList());
        }
        return List.copyOf(candidates);
    }

    public List<SetupRule> getRules() {
        return rules;
    }
}
