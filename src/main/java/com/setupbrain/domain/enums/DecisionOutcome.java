package com.setupbrain.domain.enums;

/**
 * The result of a decision evaluation.
 *
 * <ul>
 *   <li>TRIGGERED -- the condition was met and action was taken (setup forming, trade opened)</li>
 *   <li>SKIPPED -- evaluated, nothing to do (pair skipped for lack of data)</li>
 *   <li>REJECTED -- the candidate was scored below the forming threshold or failed sizing</li>
 *   <li>FAILED -- an action was attempted and failed</li>
 *   <li>INFO -- informational entry (heartbeat, cycle summary)</li>
 * </ul>
 */
public enum DecisionOutcome {
    TRIGGERED,
    SKIPPED,
    REJECTED,
    FAILED,
    INFO
}
