package com.setupbrain.decision;

import lombok.Builder;
import lombok.Value;

/**
 * Bucket weights and cutoffs for the decision engine. Loaded from {@code brain.scoring.*}.
 */
@Value
@Builder
public class ScoringParameters {

    @Builder.Default
    int trendAlignmentPoints = 30;

    @Builder.Default
    int volatilityExpansionPoints = 25;

    @Builder.Default
    int rewardRiskPoints = 25;

    @Builder.Default
    int structurePoints = 20;

    /** Volatility ratio at or above which the volatility bucket fires. */
    @Builder.Default
    double volatilityRatioMinimum = 2.0;

    /** Structural reward/risk at or above which the reward/risk bucket fires. */
    @Builder.Default
    double rewardRiskMinimum = 2.0;

    @Builder.Default
    int minFormingScore = 50;

    @Builder.Default
    int highCutoff = 75;

    @Builder.Default
    int mediumCutoff = 50;

    public void validate() {
        if (trendAlignmentPoints < 0 || volatilityExpansionPoints < 0 || rewardRiskPoints < 0 || structurePoints < 0) {
            throw new IllegalStateException("brain.scoring bucket points must not be negative");
        }
        if (highCutoff < mediumCutoff) {
            throw new IllegalStateException("brain.scoring.high-cutoff must be >= medium-cutoff");
        }
        if (minFormingScore < 0 || minFormingScore > 100) {
            throw new IllegalStateException("brain.scoring.min-forming-score must be in [0, 100], was " + minFormingScore);
        }
    }
}
