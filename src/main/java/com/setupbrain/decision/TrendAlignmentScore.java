package com.setupbrain.decision;

import com.setupbrain.domain.enums.TradeDirection;
import com.setupbrain.domain.vo.FeatureSet;
import com.setupbrain.domain.vo.SetupCandidate;
import java.math.BigDecimal;

/**
 * Close and moving averages stacked in the candidate's direction:
 * close &gt; fast &gt; slow &gt; trend for LONG, the reverse for SHORT.
 */
public class TrendAlignmentScore implements ScoringRule {

    private final int points;

    public TrendAlignmentScore(int points) {
        this.points = points;
    }

    @Override
    public String getName() {
        return "trend_alignment";
    }

    @Override
    public int getPoints() {
        return points;
    }

    @Override
    public boolean fires(SetupCandidate candidate) {
        FeatureSet features = candidate.getFeatures();
        BigDecimal[] stack = {features.getLastClose(), features.getFastMa(), features.getSlowMa(), features.getTrendMa()};
        for (int i = 0; i < stack.length - 1; i++) {
            int comparison = stack[i].compareTo(stack[i + 1]);
            if (candidate.getDirection() == TradeDirection.LONG ? comparison <= 0 : comparison >= 0) {
                return false;
            }
        }
        return true;
    }
}
