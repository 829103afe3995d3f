package com.setupbrain.domain.enums;

/**
 * Severity of an outbound chat alert. Declaration order is the Telegram backlog order,
 * so CRITICAL must stay first.
 */
public enum AlertSeverity {

    /** Cycle failures and paper-trading faults. */
    CRITICAL,

    /** Stop-loss exits. */
    WARNING,

    /** Trade opened, target reached, manual close. */
    INFO
}
