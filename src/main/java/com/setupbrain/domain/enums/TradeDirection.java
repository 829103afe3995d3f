package com.setupbrain.domain.enums;

public enum TradeDirection {
    LONG,
    SHORT;

    /** +1 for LONG, -1 for SHORT. Multiplies a price move into a directional P&L. */
    public int sign() {
        return this == LONG ? 1 : -1;
    }
}
