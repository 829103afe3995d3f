package com.setupbrain.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * The single paper ledger. Only changes when a position closes.
 */
@Value
@Builder(toBuilder = true)
public class PaperAccount {

    BigDecimal equity;
    BigDecimal initialCapital;
    int totalTrades;
    int winningTrades;
    int losingTrades;
    Instant updatedAt;

    public static PaperAccount initial(BigDecimal initialCapital, Instant now) {
        return PaperAccount.builder()
                .equity(initialCapital)
                .initialCapital(initialCapital)
                .updatedAt(now)
                .build();
    }

    /**
     * Returns the account after realising {@code pnl}. A zero P&L counts as a losing trade.
     */
    public PaperAccount applyClose(BigDecimal pnl, Instant closedAt) {
        boolean win = pnl.signum() > 0;
        return toBuilder()
                .equity(equity.add(pnl))
                .totalTrades(totalTrades + 1)
                .winningTrades(win ? winningTrades + 1 : winningTrades)
                .losingTrades(win ? losingTrades : losingTrades + 1)
                .updatedAt(closedAt)
                .build();
    }

    public double getWinRate() {
        return totalTrades == 0 ? 0.0 : (double) winningTrades / totalTrades * 100.0;
    }

    public BigDecimal getTotalPnl() {
        return equity.subtract(initialCapital);
    }
}
