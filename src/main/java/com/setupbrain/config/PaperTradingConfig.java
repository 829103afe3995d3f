package com.setupbrain.config;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Activation switch and account seed for the paper trading simulator.
 *
 * <p>Binds to {@code brain.paper-trading.*}. Paper trading is off unless explicitly
 * enabled; the risk fraction and reward multiple are read separately into
 * {@link com.setupbrain.risk.SizingParameters}.
 */
@Configuration
@ConfigurationProperties(prefix = "brain.paper-trading")
@Getter
@Setter
public class PaperTradingConfig {

    private boolean enabled = false;

    private BigDecimal initialCapital = new BigDecimal("100000");
}
