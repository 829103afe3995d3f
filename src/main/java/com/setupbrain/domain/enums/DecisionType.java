package com.setupbrain.domain.enums;

/**
 * The kind of event captured in the decision log.
 */
public enum DecisionType {
    // Scheduler
    HEARTBEAT,

    // Brain cycle
    CYCLE_COMPLETED,
    FEATURES_SKIPPED,
    SETUP_SCORED,

    // Setup recording
    SETUP_RECORD_FAILED,

    // Paper trading
    PAPER_TRADE_OPENED,
    PAPER_TRADE_CLOSED,
    PAPER_SIZING_REJECTED,
    PAPER_TRADING_FAILED
}
