package com.setupbrain.decision;

import com.setupbrain.domain.enums.ConfidenceTier;
import com.setupbrain.domain.enums.DecisionStatus;
import com.setupbrain.domain.enums.TradeDirection;
import com.setupbrain.domain.vo.Decision;
import com.setupbrain.domain.vo.FeatureSet;
import com.setupbrain.domain.vo.SetupCandidate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Scores setup candidates into go/no-go decisions.
 *
 * <p>The score is the sum of the scoring buckets that fire, capped to [0, 100].
 * A decision is FORMING when the score reaches {@code minFormingScore}, otherwise
 * REJECT. The tier comes from the high and medium cutoffs. Every candidate yields
 * exactly one decision, whatever its status.
 */
@Component
public class DecisionEngine {

    private final ScoringParameters scoringParameters;
    private final List<ScoringRule> scoringRules;

    @Autowired
    public DecisionEngine(ScoringParameters scoringParameters) {
        this(
                scoringParameters,
                List.of(
                        new TrendAlignmentScore(scoringParameters.getTrendAlignmentPoints()),
                        new VolatilityExpansionScore(
                                scoringParameters.getVolatilityExpansionPoints(),
                                scoringParameters.getVolatilityRatioMinimum()),
                        new RewardRiskScore(
                                scoringParameters.getRewardRiskPoints(), scoringParameters.getRewardRiskMinimum()),
                        new StructureClarityScore(scoringParameters.getStructurePoints())));
    }

    public DecisionEngine(ScoringParameters scoringParameters, List<ScoringRule> scoringRules) {
        this.scoringParameters = scoringParameters;
        this.scoringRules = List.copyOf(scoringRules);
    }

    public List<Decision> decideAll(List<SetupCandidate> candidates) {
        return candidates.stream().map(this::decide).toList();
    }

    public Decision decide(SetupCandidate candidate) {
        int score = 0;
        List<String> fired = new ArrayList<>();
        for (ScoringRule scoringRule : scoringRules) {
            if (scoringRule.fires(candidate)) {
                score += scoringRule.getPoints();
                fired.add(scoringRule.getName());
            }
        }
        score = Math.max(0, Math.min(100, score));

        DecisionStatus status =
                score >= scoringParameters.getMinFormingScore() ? DecisionStatus.FORMING : DecisionStatus.REJECT;
        FeatureSet features = candidate.getFeatures();
        TradeDirection direction = candidate.getDirection();

        return Decision.builder()
                .decisionId(candidate.getKey() + ":" + features.getAsOf().toEpochMilli())
                .candidate(candidate)
                .score(score)
                .status(status)
                .tier(tierFor(score))
                .justification(justify(candidate, score, status, fired))
                .firedBuckets(List.copyOf(fired))
                .direction(direction)
                .entryPrice(features.getLastClose())
                .stopPrice(direction == TradeDirection.LONG ? features.getRecentLow() : features.getRecentHigh())
                .build();
    }

    public ConfidenceTier tierFor(int score) {
        if (score >= scoringParameters.getHighCutoff()) {
            return ConfidenceTier.HIGH;
        }
        if (score >= scoringParameters.getMediumCutoff()) {
            return ConfidenceTier.MEDIUM;
        }
        return ConfidenceTier.LOW;
    }

    private String justify(SetupCandidate candidate, int score, DecisionStatus status, List<String> fired) {
        String buckets = fired.isEmpty() ? "none" : String.join(", ", fired);
        if (status == DecisionStatus.REJECT) {
            return String.format(
                    Locale.ROOT,
                    "Setup rejected: score %d below threshold %d; buckets: %s",
                    score,
                    scoringParameters.getMinFormingScore(),
                    buckets);
        }
        return String.format(
                Locale.ROOT,
                "%s %s: %s; buckets: %s; R:R %.2f; score %d/100",
                candidate.getSetupType().getStorageKey(),
                candidate.getDirection(),
                candidate.getContext(),
                buckets,
                RewardRiskScore.ratio(candidate),
                score);
    }
}
