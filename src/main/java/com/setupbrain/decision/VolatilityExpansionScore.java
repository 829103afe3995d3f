package com.setupbrain.decision;

import com.setupbrain.domain.vo.SetupCandidate;

/** Volatility at or above {@code minimumRatio} times its rolling average. */
public class VolatilityExpansionScore implements ScoringRule {

    private final int points;
    private final double minimumRatio;

    public VolatilityExpansionScore(int points, double minimumRatio) {
        this.points = points;
        this.minimumRatio = minimumRatio;
    }

    @Override
    public String getName() {
        return "volatility_expansion";
    }

    @Override
    public int getPoints() {
        return points;
    }

    @Override
    public boolean fires(SetupCandidate candidate) {
        return candidate.getFeatures().getVolatilityRatio() >= minimumRatio;
    }
}
