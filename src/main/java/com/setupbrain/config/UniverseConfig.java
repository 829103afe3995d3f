package com.setupbrain.config;

import com.setupbrain.domain.enums.CandleInterval;
import jakarta.annotation.PostConstruct;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * The symbols and timeframes evaluated every cycle.
 *
 * <p>Binds to {@code brain.universe.*}. Timeframe suffixes are resolved to
 * {@link CandleInterval} at startup; an unknown suffix fails the context.
 */
@Configuration
@ConfigurationProperties(prefix = "brain.universe")
@Getter
@Setter
public class UniverseConfig {

    private List<String> symbols = List.of("BTCUSDT", "ETHUSDT");

    private List<String> timeframes = List.of("4h", "1d");

    /** Candles requested per (symbol, timeframe). Must cover the longest feature lookback. */
    private int ohlcLimit = 260;

    private List<CandleInterval> intervals = List.of();

    @PostConstruct
    public void resolveIntervals() {
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalStateException("brain.universe.symbols must not be empty");
        }
        intervals = timeframes.stream().map(CandleInterval::fromSuffix).toList();
    }
}
