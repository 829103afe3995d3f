package com.setupbrain.feature;

import com.setupbrain.domain.enums.CandleInterval;
import com.setupbrain.domain.model.Candle;
import com.setupbrain.domain.vo.FeatureSet;
import com.setupbrain.exception.DataException;
import com.setupbrain.exception.InsufficientDataException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.helpers.HighPriceIndicator;
import org.ta4j.core.indicators.helpers.HighestValueIndicator;
import org.ta4j.core.indicators.helpers.LowPriceIndicator;
import org.ta4j.core.indicators.helpers.LowestValueIndicator;
import org.ta4j.core.indicators.helpers.TRIndicator;
import org.ta4j.core.num.Num;

/**
 * Turns a candle window into a {@link FeatureSet}.
 *
 * <p>Computed on a ta4j bar series built from the window:
 * <ul>
 *   <li>volatility: SMA of true range over {@code volatilityPeriod}, as a percent of the close</li>
 *   <li>fast/slow/trend SMAs of the close and the signed percent distance of the close from each</li>
 *   <li>highest high / lowest low over {@code rangeLookback} and the close's distance from them</li>
 *   <li>the volatility values of the preceding {@code historyLength} candles, oldest first</li>
 * </ul>
 *
 * <p>Stateless: the same window always yields the same features. No I/O.
 */
@Component
public class FeatureEngine {

    private static final Logger log = LoggerFactory.getLogger(FeatureEngine.class);

    private final FeatureParameters featureParameters;

    public FeatureEngine(FeatureParameters featureParameters) {
        this.featureParameters = featureParameters;
    }

    /**
     * Computes features as of the last candle in {@code candles}.
     *
     * @throws InsufficientDataException if the window is shorter than the longest lookback
     * @throws DataException if the window is malformed
     */
    public FeatureSet compute(String symbol, CandleInterval timeframe, List<Candle> candles) {
        int required = featureParameters.getRequiredCandles();
        int available = candles == null ? 0 : candles.size();
        if (available < required) {
            throw new InsufficientDataException(symbol, timeframe.getSuffix(), available, required);
        }
        validateWindow(symbol, timeframe, candles);

        BarSeries series = CandleSeriesFactory.toBarSeries(symbol, timeframe, candles);
        int end = series.getEndIndex();

        ClosePriceIndicator closePrice = new ClosePriceIndicator(series);
        SMAIndicator fastMa = new SMAIndicator(closePrice, featureParameters.getFastMaPeriod());
        SMAIndicator slowMa = new SMAIndicator(closePrice, featureParameters.getSlowMaPeriod());
        SMAIndicator trendMa = new SMAIndicator(closePrice, featureParameters.getTrendMaPeriod());
        SMAIndicator averageTrueRange =
                new SMAIndicator(new TRIndicator(series), featureParameters.getVolatilityPeriod());
        HighestValueIndicator recentHigh =
                new HighestValueIndicator(new HighPriceIndicator(series), featureParameters.getRangeLookback());
        LowestValueIndicator recentLow =
                new LowestValueIndicator(new LowPriceIndicator(series), featureParameters.getRangeLookback());

        double close = closePrice.getValue(end).doubleValue();
        double volatility = volatilityAt(averageTrueRange, closePrice, end);
        List<Double> history = volatilityHistory(averageTrueRange, closePrice, end);
        double averageHistory = mean(history);
        double high = recentHigh.getValue(end).doubleValue();
        double low = recentLow.getValue(end).doubleValue();

        FeatureSet featureSet = FeatureSet.builder()
                .symbol(symbol)
                .timeframe(timeframe)
                .asOf(Instant.ofEpochMilli(candles.get(candles.size() - 1).getTimestamp()))
                .candleCount(available)
                .lastClose(candles.get(candles.size() - 1).getClose())
                .volatility(volatility)
                .volatilityHistory(history)
                .volatilityRatio(averageHistory > 0 ? volatility / averageHistory : 0.0)
                .fastMa(toBigDecimal(fastMa.getValue(end)))
                .slowMa(toBigDecimal(slowMa.getValue(end)))
                .trendMa(toBigDecimal(trendMa.getValue(end)))
                .distanceFromFastMaPct(percentDistance(close, fastMa.getValue(end).doubleValue()))
                .distanceFromSlowMaPct(percentDistance(close, slowMa.getValue(end).doubleValue()))
                .distanceFromTrendMaPct(percentDistance(close, trendMa.getValue(end).doubleValue()))
                .recentHigh(toBigDecimal(recentHigh.getValue(end)))
                .recentLow(toBigDecimal(recentLow.getValue(end)))
                .distanceFromHighPct((high - close) / close * 100.0)
                .distanceFromLowPct((close - low) / close * 100.0)
                .build();

        log.debug(
                "Features {} {}: vol={}% ratio={} fastDist={}% slowDist={}%",
                symbol,
                timeframe.getSuffix(),
                String.format("%.3f", volatility),
                String.format("%.2f", featureSet.getVolatilityRatio()),
                String.format("%.2f", featureSet.getDistanceFromFastMaPct()),
                String.format("%.2f", featureSet.getDistanceFromSlowMaPct()));
        return featureSet;
    }

    public int getRequiredCandles() {
        return featureParameters.getRequiredCandles();
    }

    private void validateWindow(String symbol, CandleInterval timeframe, List<Candle> candles) {
        long previous = Long.MIN_VALUE;
        for (int i = 0; i < candles.size(); i++) {
            Candle candle = candles.get(i);
            if (candle.getOpen() == null
                    || candle.getHigh() == null
                    || candle.getLow() == null
                    || candle.getClose() == null) {
                throw malformed(symbol, timeframe, "missing price at index " + i);
            }
            if (candle.getTimestamp() <= previous) {
                throw malformed(symbol, timeframe, "non-increasing timestamp at index " + i);
            }
            if (candle.getHigh().compareTo(candle.getLow()) < 0) {
                throw malformed(symbol, timeframe, "high below low at index " + i);
            }
            previous = candle.getTimestamp();
        }
        if (candles.get(candles.size() - 1).getClose().signum() <= 0) {
            throw malformed(symbol, timeframe, "non-positive latest close");
        }
    }

    private DataException malformed(String symbol, CandleInterval timeframe, String reason) {
        return new DataException(
                String.format("Malformed candle window for %s %s: %s", symbol, timeframe.getSuffix(), reason),
                Map.of("symbol", symbol, "timeframe", timeframe.getSuffix()));
    }

    private List<Double> volatilityHistory(Indicator<Num> averageTrueRange, Indicator<Num> closePrice, int end) {
        int first = Math.max(featureParameters.getVolatilityPeriod() - 1, end - featureParameters.getHistoryLength());
        List<Double> history = new ArrayList<>();
        for (int i = first; i < end; i++) {
            history.add(volatilityAt(averageTrueRange, closePrice, i));
        }
        return List.copyOf(history);
    }

    private static double volatilityAt(Indicator<Num> averageTrueRange, Indicator<Num> closePrice, int index) {
        double close = closePrice.getValue(index).doubleValue();
        if (close <= 0) {
            return 0.0;
        }
        return averageTrueRange.getValue(index).doubleValue() / close * 100.0;
    }

    private static double percentDistance(double value, double reference) {
        return reference == 0 ? 0.0 : (value - reference) / reference * 100.0;
    }

    private static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (Double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    private static BigDecimal toBigDecimal(Num num) {
        return BigDecimal.valueOf(num.doubleValue());
    }
}
