package com.setupbrain.domain.vo;

import com.setupbrain.domain.enums.CandleInterval;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Technical features derived from one candle window, as of the latest candle.
 *
 * <p>Percent distances are signed: positive when the latest close is above the
 * reference level. Volatility is the mean true range over the volatility period,
 * expressed as a percent of the latest close.
 *
 * <p>{@code volatilityHistory} holds the volatility values of the preceding candles,
 * oldest first, excluding the current value. The detector compares the current
 * value against it.
 */
@Value
@Builder
public class FeatureSet {

    String symbol;
    CandleInterval timeframe;
    Instant asOf;
    int candleCount;

    BigDecimal lastClose;

    double volatility;
    List<Double> volatilityHistory;
    /** Current volatility over the mean of {@code volatilityHistory}; 0 when the history is flat zero. */
    double volatilityRatio;

    BigDecimal fastMa;
    BigDecimal slowMa;
    BigDecimal trendMa;

    double distanceFromFastMaPct;
    double distanceFromSlowMaPct;
    double distanceFromTrendMaPct;

    BigDecimal recentHigh;
    BigDecimal recentLow;

    /** Distance of the close below the window high, in percent (>= 0). */
    double distanceFromHighPct;
    /** Distance of the close above the window low, in percent (>= 0). */
    double distanceFromLowPct;

    public double averageHistoricalVolatility() {
        if (volatilityHistory == null || volatilityHistory.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (Double value : volatilityHistory) {
            sum += value;
        }
        return sum / volatilityHistory.size();
    }
}
