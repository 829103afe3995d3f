package com.setupbrain.domain.enums;

/**
 * Why a paper position was closed.
 *
 * <ul>
 *   <li>STOP -- price reached the stop loss</li>
 *   <li>TARGET -- price reached the take-profit target</li>
 *   <li>MANUAL -- an operator closed the position through the API</li>
 * </ul>
 */
public enum ExitReason {
    STOP,
    TARGET,
    MANUAL
}
