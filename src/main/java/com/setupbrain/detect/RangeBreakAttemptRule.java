package com.setupbrain.detect;

import com.setupbrain.domain.enums.ConfidenceTier;
import com.setupbrain.domain.enums.SetupType;
import com.setupbrain.domain.enums.TradeDirection;
import com.setupbrain.domain.vo.FeatureSet;
import com.setupbrain.domain.vo.SetupCandidate;
import java.time.Instant;
import java.util.Optional;

/**
 * Fires when the close sits strictly within {@code rangeProximityPercent} of the window high or
 * low while volatility is above {@code rangeBreakVolatilityRatio} times its average.
 *
 * <p>Near the high reads as an upside attempt (LONG), near the low as a downside
 * attempt (SHORT). When both are in range the nearer extreme wins; an exact tie goes
 * to the upside.
 */
public class RangeBreakAttemptRule extends AbstractSetupRule {

    public RangeBreakAttemptRule(DetectionThresholds thresholds) {
        super(thresholds);
    }

    @Override
    public SetupType getSetupType() {
        return SetupType.RANGE_BREAK_ATTEMPT;
    }

    @Override
    public Optional<SetupCandidate> evaluate(FeatureSet features, Instant detectedAt) {
        double average = features.averageHistoricalVolatility();
        if (average <= 0 || features.getVolatility() <= average * thresholds.getRangeBreakVolatilityRatio()) {
            return Optional.empty();
        }

        double toHigh = features.getDistanceFromHighPct();
        double toLow = features.getDistanceFromLowPct();
        boolean nearHigh = toHigh < thresholds.getRangeProximityPercent();
        boolean nearLow = toLow < thresholds.getRangeProximityPercent();
        if (!nearHigh && !nearLow) {
            return Optional.empty();
        }

        boolean upside = nearHigh && (!nearLow || toHigh <= toLow);
        TradeDirection direction = upside ? TradeDirection.LONG : TradeDirection.SHORT;
        String context = upside
                ? format("Upside break attempt: %.2f%% below %s high", toHigh, features.getRecentHigh().toPlainString())
                : format("Downside break attempt: %.2f%% above %s low", toLow, features.getRecentLow().toPlainString());

        return candidate(features, detectedAt, ConfidenceTier.MEDIUM, direction, context);
    }
}
