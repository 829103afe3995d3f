package com.setupbrain.decision;

import com.setupbrain.domain.enums.TradeDirection;
import com.setupbrain.domain.vo.FeatureSet;
import com.setupbrain.domain.vo.SetupCandidate;
import java.math.BigDecimal;

/**
 * Structural reward/risk from the window extremes, in the candidate's direction.
 *
 * <p>LONG: reward is the room up to the recent high, risk the drop to the recent low.
 * SHORT mirrors it. No risk (close at the stop-side extreme) means the bucket does not fire.
 */
public class RewardRiskScore implements ScoringRule {

    private final int points;
    private final double minimumRatio;

    public RewardRiskScore(int points, double minimumRatio) {
        this.points = points;
        this.minimumRatio = minimumRatio;
    }

    @Override
    public String getName() {
        return "reward_risk";
    }

    @Override
    public int getPoints() {
        return points;
    }

    @Override
    public boolean fires(SetupCandidate candidate) {
        double ratio = ratio(candidate);
        return ratio >= minimumRatio;
    }

    /** Reward over risk, or 0 when the risk is not positive. */
    public static double ratio(SetupCandidate candidate) {
        FeatureSet features = candidate.getFeatures();
        BigDecimal close = features.getLastClose();
        BigDecimal toHigh = features.getRecentHigh().subtract(close);
        BigDecimal toLow = close.subtract(features.getRecentLow());

        boolean isLong = candidate.getDirection() == TradeDirection.LONG;
        BigDecimal reward = isLong ? toHigh : toLow;
        BigDecimal risk = isLong ? toLow : toHigh;
        if (risk.signum() <= 0) {
            return 0.0;
        }
        return reward.doubleValue() / risk.doubleValue();
    }
}
