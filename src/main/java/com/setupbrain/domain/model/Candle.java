package com.setupbrain.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single OHLCV candle as returned by the market-data provider.
 *
 * <p>Candles for one (symbol, timeframe) are ordered ascending by {@code timestamp},
 * which is the epoch millisecond of the candle open. Gaps are tolerated.
 * Volume is fractional for crypto pairs, so it is a BigDecimal like the prices.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Candle {

    /** Epoch millisecond of the candle open. */
    private long timestamp;

    private BigDecimal open;

    private BigDecimal high;

    private BigDecimal low;

    private BigDecimal close;

    private BigDecimal volume;

    public Instant getOpenTime() {
        return Instant.ofEpochMilli(timestamp);
    }
}
