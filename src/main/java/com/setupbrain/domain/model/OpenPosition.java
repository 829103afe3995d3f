package com.setupbrain.domain.model;

import com.setupbrain.domain.enums.SetupType;
import com.setupbrain.domain.enums.TradeDirection;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * The one open paper position.
 *
 * <p>The water marks start at the entry price and track the highest and lowest
 * price observed while the position is open. They feed MFE/MAE on close.
 */
@Value
@Builder(toBuilder = true)
public class OpenPosition {

    String id;
    String symbol;
    String timeframe;
    SetupType setupType;
    TradeDirection direction;

    BigDecimal entryPrice;
    BigDecimal size;
    BigDecimal stopLoss;
    BigDecimal takeProfit;
    BigDecimal riskAmount;
    BigDecimal equityAtOpen;

    Instant openedAt;

    /** Reference to the decision that opened this position. */
    String decisionId;

    BigDecimal highWaterMark;
    BigDecimal lowWaterMark;

    public OpenPosition withObservedPrice(BigDecimal price) {
        return toBuilder()
                .highWaterMark(highWaterMark.max(price))
                .lowWaterMark(lowWaterMark.min(price))
                .build();
    }

    /** True when {@code price} has reached the stop on the losing side of the entry. */
    public boolean isStopHit(BigDecimal price) {
        return direction == TradeDirection.LONG ? price.compareTo(stopLoss) <= 0 : price.compareTo(stopLoss) >= 0;
    }

    /** True when {@code price} has reached the target on the winning side of the entry. */
    public boolean isTargetHit(BigDecimal price) {
        return direction == TradeDirection.LONG
                ? price.compareTo(takeProfit) >= 0
                : price.compareTo(takeProfit) <= 0;
    }
}
