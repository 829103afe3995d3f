package com.setupbrain.simulator;

import java.math.BigDecimal;

/**
 * Supplies the latest traded price for a symbol to the paper trading engine.
 * Implementations throw {@link com.setupbrain.exception.DataException} when no price is available.
 */
@FunctionalInterface
public interface PriceLookup {

    BigDecimal latestPrice(String symbol);
}
