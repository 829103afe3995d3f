package com.setupbrain.marketdata;

import com.setupbrain.config.MarketDataConfig;
import com.setupbrain.domain.enums.CandleInterval;
import com.setupbrain.domain.model.Candle;
import com.setupbrain.exception.DataException;
import com.setupbrain.exception.MarketDataUnavailableException;
import io.github.resilience4j.retry.annotation.Retry;
import java.math.BigDecimal;
import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Fetches candles from the OHLC HTTP endpoint.
 *
 * <p>{@code GET {base-url}/ohlc?symbol=&timeframe=&limit=} with the API key sent both as an
 * {@code apikey} header and as a bearer token. The response is a JSON array of
 * {@link OhlcCandleDto}. Transport and 5xx failures are retried by the {@code marketData}
 * Resilience4j instance; a 4xx or malformed payload fails straight away.
 *
 * <p>The latest price is the close of the most recent 1h candle.
 */
@Service
public class HttpMarketDataProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpMarketDataProvider.class);

    private static final ParameterizedTypeReference<List<OhlcCandleDto>> CANDLE_LIST =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final MarketDataConfig marketDataConfig;

    public HttpMarketDataProvider(
            @Qualifier("marketDataRestTemplate") RestTemplate restTemplate, MarketDataConfig marketDataConfig) {
        this.restTemplate = restTemplate;
        this.marketDataConfig = marketDataConfig;
    }

    @Override
    @Retry(name = "marketData")
    public List<Candle> fetchCandles(String symbol, CandleInterval timeframe, int limit) {
        List<Candle> candles = request(symbol, timeframe, limit);
        log.debug("Fetched {} {} candles for {}", candles.size(), timeframe.getSuffix(), symbol);
        return candles;
    }

    @Override
    @Retry(name = "marketData")
    public BigDecimal latestPrice(String symbol) {
        List<Candle> candles = request(symbol, CandleInterval.ONE_HOUR, 1);
        if (candles.isEmpty()) {
            throw new DataException("No recent candle for " + symbol, Map.of("symbol", symbol));
        }
        return candles.get(candles.size() - 1).getClose();
    }

    private List<Candle> request(String symbol, CandleInterval timeframe, int limit) {
        URI uri = UriComponentsBuilder.fromHttpUrl(marketDataConfig.getBaseUrl())
                .path("/ohlc")
                .queryParam("symbol", symbol)
                .queryParam("timeframe", timeframe.getSuffix())
                .queryParam("limit", limit)
                .build()
                .toUri();
        Map<String, Object> context = Map.of("symbol", symbol, "timeframe", timeframe.getSuffix(), "limit", limit);

        List<OhlcCandleDto> body;
        try {
            ResponseEntity<List<OhlcCandleDto>> response =
                    restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers()), CANDLE_LIST);
            body = response.getBody();
        } catch (HttpClientErrorException e) {
            log.error("Market data rejected request for {} {}: {}", symbol, timeframe.getSuffix(), e.getStatusCode());
            throw new DataException("Market data request rejected: " + e.getStatusCode(), context, e);
        } catch (RestClientException e) {
            log.warn("Market data unavailable for {} {}: {}", symbol, timeframe.getSuffix(), e.getMessage());
            throw new MarketDataUnavailableException("Market data unavailable: " + e.getMessage(), context, e);
        }

        if (body == null) {
            throw new DataException("Empty market data response", context);
        }
        return toCandles(body, context);
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        String apiKey = marketDataConfig.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.set("apikey", apiKey);
            headers.setBearerAuth(apiKey);
        }
        return headers;
    }

    static List<Candle> toCandles(List<OhlcCandleDto> rows, Map<String, Object> context) {
        List<Candle> candles = new ArrayList<>(rows.size());
        for (OhlcCandleDto row : rows) {
            if (row == null
                    || row.getTimestamp() == null
                    || row.getOpen() == null
                    || row.getHigh() == null
                    || row.getLow() == null
                    || row.getClose() == null) {
                throw new DataException("Market data row is missing fields: " + row, context);
            }
            candles.add(Candle.builder()
                    .timestamp(row.getTimestamp())
                    .open(row.getOpen())
                    .high(row.getHigh())
                    .low(row.getLow())
                    .close(row.getClose())
                    .volume(row.getVolume() != null ? row.getVolume() : BigDecimal.ZERO)
                    .build());
        }
        candles.sort(Comparator.comparingLong(Candle::getTimestamp));
        return candles;
    }
}
