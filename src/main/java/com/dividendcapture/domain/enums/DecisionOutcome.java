package com.dividendcapture.domain.enums;

/**
 * Result of a journaled decision.
 *
 * <ul>
 *   <li>TRIGGERED: the action was carried out</li>
 *   <li>SKIPPED: nothing to do, or the instrument was skipped for the day</li>
 *   <li>REJECTED: the action was declined (cash, duplicate, position cap)</li>
 *   <li>INFO: informational, no action involved</li>
 * </ul>
 */
public enum DecisionOutcome {
    TRIGGERED,
    SKIPPED,
    REJECTED,
    INFO
}
