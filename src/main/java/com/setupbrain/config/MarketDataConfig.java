package com.setupbrain.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Connection settings for the OHLC market-data endpoint ({@code brain.market-data.*}).
 */
@Configuration
@ConfigurationProperties(prefix = "brain.market-data")
@Getter
@Setter
public class MarketDataConfig {

    private String baseUrl;

    private String apiKey;

    private long connectTimeoutMs = 5_000;

    private long readTimeoutMs = 15_000;

    @Bean
    public RestTemplate marketDataRestTemplate(RestTemplateBuilder restTemplateBuilder) {
        return restTemplateBuilder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}
