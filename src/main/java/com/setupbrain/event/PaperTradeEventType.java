package com.setupbrain.event;

/**
 * Classifies the paper position transition behind a {@link PaperTradeEvent}.
 */
public enum PaperTradeEventType {

    /** A position was opened from a forming decision. */
    OPENED,

    /** The open position exited by stop, target or manual close. */
    CLOSED
}
