package com.setupbrain.config;

import com.setupbrain.decision.ScoringParameters;
import com.setupbrain.detect.DetectionThresholds;
import com.setupbrain.feature.FeatureParameters;
import com.setupbrain.risk.SizingParameters;
import java.math.BigDecimal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the immutable parameter objects of the detection pipeline from application.yml.
 *
 * <p>Every bean is validated on creation, so an inconsistent configuration stops the
 * application at startup instead of producing nonsense decisions later.
 *
 * <p>Properties prefixes: {@code brain.features.*}, {@code brain.detection.*},
 * {@code brain.scoring.*}, {@code brain.paper-trading.*}
 */
@Configuration
public class EngineConfig {

    @Bean
    public FeatureParameters featureParameters(
            @Value("${brain.features.volatility-period:20}") int volatilityPeriod,
            @Value("${brain.features.fast-ma-period:20}") int fastMaPeriod,
            @Value("${brain.features.slow-ma-period:50}") int slowMaPeriod,
            @Value("${brain.features.trend-ma-period:200}") int trendMaPeriod,
            @Value("${brain.features.range-lookback:20}") int rangeLookback,
            @Value("${brain.features.history-length:20}") int historyLength) {
        FeatureParameters featureParameters = FeatureParameters.builder()
                .volatilityPeriod(volatilityPeriod)
                .fastMaPeriod(fastMaPeriod)
                .slowMaPeriod(slowMaPeriod)
                .trendMaPeriod(trendMaPeriod)
                .rangeLookback(rangeLookback)
                .historyLength(historyLength)
                .build();
        featureParameters.validate();
        return featureParameters;
    }

    @Bean
    public DetectionThresholds detectionThresholds(
            @Value("${brain.detection.volatility-expansion-ratio:2.0}") double volatilityExpansionRatio,
            @Value("${brain.detection.volatility-expansion-high-ratio:3.0}") double volatilityExpansionHighRatio,
            @Value("${brain.detection.range-proximity-percent:2.0}") double rangeProximityPercent,
            @Value("${brain.detection.range-break-volatility-ratio:1.5}") double rangeBreakVolatilityRatio,
            @Value("${brain.detection.fast-ma-distance-percent:5.0}") double fastMaDistancePercent,
            @Value("${brain.detection.slow-ma-distance-percent:8.0}") double slowMaDistancePercent,
            @Value("${brain.detection.compression-ratio:0.7}") double compressionRatio,
            @Value("${brain.detection.compression-breakout-ratio:1.5}") double compressionBreakoutRatio,
            @Value("${brain.detection.compression-breakout-high-ratio:2.0}") double compressionBreakoutHighRatio) {
        DetectionThresholds detectionThresholds = DetectionThresholds.builder()
                .volatilityExpansionRatio(volatilityExpansionRatio)
                .volatilityExpansionHighRatio(volatilityExpansionHighRatio)
                .rangeProximityPercent(rangeProximityPercent)
                .rangeBreakVolatilityRatio(rangeBreakVolatilityRatio)
                .fastMaDistancePercent(fastMaDistancePercent)
                .slowMaDistancePercent(slowMaDistancePercent)
                .compressionRatio(compressionRatio)
                .compressionBreakoutRatio(compressionBreakoutRatio)
                .compressionBreakoutHighRatio(compressionBreakoutHighRatio)
                .build();
        detectionThresholds.validate();
        return detectionThresholds;
    }

    @Bean
    public ScoringParameters scoringParameters(
            @Value("${brain.scoring.trend-alignment-points:30}") int trendAlignmentPoints,
            @Value("${brain.scoring.volatility-expansion-points:25}") int volatilityExpansionPoints,
            @Value("${brain.scoring.reward-risk-points:25}") int rewardRiskPoints,
            @Value("${brain.scoring.structure-points:20}") int structurePoints,
            @Value("${brain.scoring.volatility-ratio-minimum:2.0}") double volatilityRatioMinimum,
            @Value("${brain.scoring.reward-risk-minimum:2.0}") double rewardRiskMinimum,
            @Value("${brain.scoring.min-forming-score:50}") int minFormingScore,
            @Value("${brain.scoring.high-cutoff:75}") int highCutoff,
            @Value("${brain.scoring.medium-cutoff:50}") int mediumCutoff) {
        ScoringParameters scoringParameters = ScoringParameters.builder()
                .trendAlignmentPoints(trendAlignmentPoints)
                .volatilityExpansionPoints(volatilityExpansionPoints)
                .rewardRiskPoints(rewardRiskPoints)
                .structurePoints(structurePoints)
                .volatilityRatioMinimum(volatilityRatioMinimum)
                .rewardRiskMinimum(rewardRiskMinimum)
                .minFormingScore(minFormingScore)
                .highCutoff(highCutoff)
                .mediumCutoff(mediumCutoff)
                .build();
        scoringParameters.validate();
        return scoringParameters;
    }

    @Bean
    public SizingParameters sizingParameters(
            @Value("${brain.paper-trading.risk-fraction:0.01}") BigDecimal riskFraction,
            @Value("${brain.paper-trading.reward-multiple:2.0}") BigDecimal rewardMultiple) {
        SizingParameters sizingParameters = SizingParameters.builder()
                .riskFraction(riskFraction)
                .rewardMultiple(rewardMultiple)
                .build();
        sizingParameters.validate();
        return sizingParameters;
    }
}
