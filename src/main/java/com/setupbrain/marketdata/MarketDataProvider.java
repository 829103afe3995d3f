package com.setupbrain.marketdata;

import com.setupbrain.domain.enums.CandleInterval;
import com.setupbrain.domain.model.Candle;
import com.setupbrain.exception.DataException;
import java.math.BigDecimal;
import java.util.List;

/**
 * Source of OHLC candles and latest prices for the brain cycle and the paper trader.
 */
public interface MarketDataProvider {

    /**
     * Returns up to {@code limit} candles, oldest first.
     *
     * @throws DataException if the candles cannot be fetched or parsed
     */
    List<Candle> fetchCandles(String symbol, CandleInterval timeframe, int limit);

    /**
     * Returns the most recent traded price for {@code symbol}.
     *
     * @throws DataException if no price is available
     */
    BigDecimal latestPrice(String symbol);
}
