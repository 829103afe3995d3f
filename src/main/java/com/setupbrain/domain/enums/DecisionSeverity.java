package com.setupbrain.domain.enums;

/**
 * Severity of a decision log entry. Rejected setups are DEBUG; every severity is
 * archived to brain_logs.
 */
public enum DecisionSeverity {
    DEBUG,
    INFO,
    WARNING,
    CRITICAL
}
