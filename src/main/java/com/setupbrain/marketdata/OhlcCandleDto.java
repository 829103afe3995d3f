package com.setupbrain.marketdata;

import java.math.BigDecimal;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One element of the OHLC endpoint's JSON array. {@code timestamp} is the candle open
 * time in epoch milliseconds.
 */
@Data
@NoArgsConstructor
public class OhlcCandleDto {

    private Long timestamp;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private BigDecimal volume;
}
