package com.setupbrain.domain.vo;

import com.setupbrain.domain.enums.ConfidenceTier;
import com.setupbrain.domain.enums.DecisionStatus;
import com.setupbrain.domain.enums.TradeDirection;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Scored verdict on one candidate.
 *
 * <p>The trade plan (direction, entry, stop) is the structural suggestion the paper
 * trading engine sizes from: entry at the latest close, stop at the window low for
 * a long and at the window high for a short.
 */
@Value
@Builder
public class Decision {

    /** Stable reference for this decision: setup key plus the as-of epoch millis. */
    String decisionId;

    SetupCandidate candidate;
    int score;
    DecisionStatus status;
    ConfidenceTier tier;
    String justification;
    List<String> firedBuckets;

    TradeDirection direction;
    BigDecimal entryPrice;
    BigDecimal stopPrice;

    public boolean isForming() {
        return status == DecisionStatus.FORMING;
    }

    public String getSymbol() {
        return candidate.getSymbol();
    }
}
