package com.setupbrain.domain.model;

import com.setupbrain.domain.enums.ExitReason;
import com.setupbrain.domain.enums.SetupType;
import com.setupbrain.domain.enums.TradeDirection;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A completed paper trade: the open position fields plus exit and realised result.
 */
@Value
@Builder
public class ClosedTrade {

    String positionId;
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
    String decisionId;

    BigDecimal exitPrice;
    Instant closedAt;
    ExitReason exitReason;

    BigDecimal pnl;
    BigDecimal pnlPercent;
    long durationMinutes;
    BigDecimal mfePercent;
    BigDecimal maePercent;

    public boolean isWin() {
        return pnl.signum() > 0;
    }

    /** Realised P&L in units of the risk taken, e.g. 2.0 for a full target hit at 2R. */
    public BigDecimal getRMultiple() {
        if (riskAmount == null || riskAmount.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return pnl.divide(riskAmount, 4, RoundingMode.HALF_UP);
    }
}
