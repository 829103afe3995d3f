package com.setupbrain.domain.vo;

import com.setupbrain.domain.enums.CandleInterval;
import com.setupbrain.domain.enums.ConfidenceTier;
import com.setupbrain.domain.enums.SetupType;
import com.setupbrain.domain.enums.TradeDirection;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A setup detected by one rule for one (symbol, timeframe). Lives for a single cycle.
 *
 * <p>Carries the features it was detected from so the decision engine can score it
 * without another lookup.
 */
@Value
@Builder
public class SetupCandidate {

    String symbol;
    CandleInterval timeframe;
    SetupType setupType;
    ConfidenceTier confidence;
    TradeDirection direction;
    String context;
    Instant detectedAt;
    FeatureSet features;

    public SetupKey getKey() {
        return SetupKey.of(symbol, timeframe, setupType);
    }
}
