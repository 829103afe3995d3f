package com.setupbrain.feature;

import com.setupbrain.domain.enums.CandleInterval;
import com.setupbrain.domain.model.Candle;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;

/**
 * Converts a candle window into a ta4j {@link BarSeries}.
 *
 * <p>ta4j keys bars by their end time, so each bar ends at the candle open plus
 * the interval duration. Callers must pass candles with strictly increasing
 * timestamps; ta4j rejects a bar that does not end after the previous one.
 */
public final class CandleSeriesFactory {

    private CandleSeriesFactory() {}

    public static BarSeries toBarSeries(String symbol, CandleInterval timeframe, List<Candle> candles) {
        BarSeries series = new BaseBarSeriesBuilder()
                .withName(symbol + ":" + timeframe.getSuffix())
                .build();

        for (Candle candle : candles) {
            ZonedDateTime endTime = ZonedDateTime.ofInstant(
                    Instant.ofEpochMilli(candle.getTimestamp() + timeframe.getDurationMs()), ZoneOffset.UTC);
            series.addBar(
                    timeframe.getDuration(),
                    endTime,
                    candle.getOpen(),
                    candle.getHigh(),
                    candle.getLow(),
                    candle.getClose(),
                    candle.getVolume());
        }
        return series;
    }
}
