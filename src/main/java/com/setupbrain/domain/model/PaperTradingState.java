package com.setupbrain.domain.model;

import lombok.Value;

/**
 * Everything the paper trading engine owns: the account and the single position slot.
 * Passed into each cycle and returned, never mutated in place.
 */
@Value
public class PaperTradingState {

    PaperAccount account;

    /** Null when flat. */
    OpenPosition position;

    public static PaperTradingState flat(PaperAccount account) {
        return new PaperTradingState(account, null);
    }

    public boolean hasOpenPosition() {
        return position != null;
    }

    public PaperTradingState withPosition(OpenPosition openPosition) {
        return new PaperTradingState(account, openPosition);
    }
}
