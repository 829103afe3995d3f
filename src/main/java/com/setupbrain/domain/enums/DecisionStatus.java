package com.setupbrain.domain.enums;

/**
 * Go/no-go status of a scored setup. Only FORMING decisions are eligible for paper trading.
 */
public enum DecisionStatus {
    FORMING,
    REJECT
}
