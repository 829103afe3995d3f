package com.setupbrain.domain.vo;

import com.setupbrain.domain.enums.TradeDirection;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Output of the position sizer: how much to trade and where the exits sit.
 * {@code riskAmount} equals {@code size * |entry - stop|}.
 */
@Value
@Builder
public class PositionPlan {

    TradeDirection direction;
    BigDecimal entryPrice;
    BigDecimal stopLoss;
    BigDecimal takeProfit;
    BigDecimal size;
    BigDecimal riskAmount;
}
