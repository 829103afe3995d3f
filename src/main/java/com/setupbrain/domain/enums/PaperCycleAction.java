package com.setupbrain.domain.enums;

/**
 * What the paper trading engine did in one cycle. At most one of OPENED or CLOSED
 * happens per cycle.
 */
public enum PaperCycleAction {
    /** Flat and no forming decision could be sized. */
    NONE,
    OPENED,
    CLOSED,
    /** Position open, price between stop and target. */
    HELD,
    /** Position open, latest price could not be fetched. */
    PRICE_UNAVAILABLE
}
