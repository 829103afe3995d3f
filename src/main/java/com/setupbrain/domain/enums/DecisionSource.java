package com.setupbrain.domain.enums;

/**
 * Identifies which component produced a decision log entry, so the log can be
 * filtered by subsystem (e.g. only PAPER_TRADING to trace position lifecycle).
 */
public enum DecisionSource {
    BRAIN_CYCLE,
    FEATURE_ENGINE,
    DECISION_ENGINE,
    PAPER_TRADING,
    SETUP_RECORDER,
    SCHEDULER,
    SYSTEM
}
