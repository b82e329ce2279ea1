package com.dividendcapture.domain.enums;

/**
 * Lifecycle state of a position. OPEN while shares are held; CLOSED is terminal and is
 * entered exactly once, when a sell brings the share count to zero.
 */
public enum PositionStatus {
    OPEN,
    CLOSED
}
